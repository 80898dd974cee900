/* 
 * Plankit -- Copyright (c) 2024-present, the Plankit authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package plankit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.ast.FluentExpression;
import plankit.model.Type.UserType;

/**
 * An action-based planning problem: user types, objects, fluents with their
 * default and explicit initial values, actions, goals, timed goals and
 * quality metrics.
 * 
 * Type, object, fluent and action names share a single namespace; adding an
 * element whose name is already taken is a {@link ProblemDefinitionException}.
 * Goals and the conditions of every timed goal are read as conjunctions.
 */
public class Problem {

	private String name;
	private final ExpressionManager manager;

	private final Map<String,UserType> userTypes = new LinkedHashMap<String,UserType>();
	private final Map<String,PlanObject> objects = new LinkedHashMap<String,PlanObject>();
	private final Map<String,Fluent> fluents = new LinkedHashMap<String,Fluent>();
	private final Map<Fluent,Expression> fluentDefaults = new HashMap<Fluent,Expression>();
	private final Map<FluentExpression,Expression> initialValues = new LinkedHashMap<FluentExpression,Expression>();
	private final Map<String,Action> actions = new LinkedHashMap<String,Action>();
	private final List<Expression> goals = new ArrayList<Expression>();
	private final Map<TimeInterval,List<Expression>> timedGoals = new LinkedHashMap<TimeInterval,List<Expression>>();
	private final List<QualityMetric> qualityMetrics = new ArrayList<QualityMetric>();

	public Problem(String name) {
		this(name, new ExpressionManager());
	}

	public Problem(String name, ExpressionManager manager) {
		this.name = Objects.requireNonNull(name);
		this.manager = Objects.requireNonNull(manager);
	}

	public String name() {
		return name;
	}

	public void setName(String name) {
		this.name = Objects.requireNonNull(name);
	}

	public ExpressionManager manager() {
		return manager;
	}

	/**
	 * Returns true if a type, an object, a fluent or an action of this
	 * problem has the given name.
	 */
	public boolean hasName(String name) {
		return userTypes.containsKey(name) || objects.containsKey(name) || fluents.containsKey(name)
				|| actions.containsKey(name);
	}

	private void checkFreshName(String name) {
		if (hasName(name))
			throw new ProblemDefinitionException("Name " + name + " is already defined in problem " + this.name);
	}

	/* ---------------- types and objects ---------------- */

	/**
	 * Adds a user type, and its ancestors if they are not part of the problem
	 * yet.
	 */
	public void addUserType(UserType type) {
		UserType known = userTypes.get(type.name());
		if (known != null) {
			if (!known.equals(type))
				throw new ProblemDefinitionException("Type " + type.name() + " is already defined differently");
			return;
		}
		if (type.father() != null)
			addUserType(type.father());
		checkFreshName(type.name());
		userTypes.put(type.name(), type);
	}

	private void addTypeOf(Type type) {
		if (type.isUserType())
			addUserType((UserType) type);
	}

	public List<UserType> userTypes() {
		return List.copyOf(userTypes.values());
	}

	public void addObject(PlanObject object) {
		addUserType(object.type());
		checkFreshName(object.name());
		objects.put(object.name(), object);
	}

	public PlanObject addObject(String name, UserType type) {
		PlanObject res = new PlanObject(name, type);
		addObject(res);
		return res;
	}

	public List<PlanObject> objects() {
		return List.copyOf(objects.values());
	}

	/** @return the objects of the given type or of one of its subtypes. */
	public List<PlanObject> objects(UserType type) {
		List<PlanObject> res = new ArrayList<PlanObject>();
		for (PlanObject o : objects.values())
			if (o.type().isSubtypeOf(type))
				res.add(o);
		return res;
	}

	public PlanObject object(String name) {
		PlanObject res = objects.get(name);
		if (res == null)
			throw new ProblemDefinitionException("Object " + name + " is not defined");
		return res;
	}

	/* ---------------- fluents and initial values ---------------- */

	public void addFluent(Fluent fluent) {
		addFluent(fluent, null);
	}

	/**
	 * Adds a fluent with the given default initial value.
	 * 
	 * @param defaultInitialValue
	 *            the value of every ground instance of the fluent that has no
	 *            explicit initial value, or null.
	 */
	public void addFluent(Fluent fluent, Object defaultInitialValue) {
		checkFreshName(fluent.name());
		addTypeOf(fluent.type());
		for (Parameter p : fluent.signature())
			addTypeOf(p.type());
		if (defaultInitialValue != null) {
			Expression v = manager.auto(defaultInitialValue);
			if (!fluent.type().isCompatible(v.type()))
				throw new ProblemDefinitionException("Default " + v + " is not a value of " + fluent.type());
			fluentDefaults.put(fluent, v);
		}
		fluents.put(fluent.name(), fluent);
	}

	public List<Fluent> fluents() {
		return List.copyOf(fluents.values());
	}

	public boolean hasFluent(String name) {
		return fluents.containsKey(name);
	}

	public Fluent fluent(String name) {
		Fluent res = fluents.get(name);
		if (res == null)
			throw new ProblemDefinitionException("Fluent " + name + " is not defined");
		return res;
	}

	/** @return the default initial value of the given fluent, or null. */
	public Expression fluentDefault(Fluent fluent) {
		return fluentDefaults.get(fluent);
	}

	public void setInitialValue(Object fluent, Object value) {
		Expression f = manager.auto(fluent);
		Expression v = manager.auto(value);
		if (!f.isFluentExp() || fluents.get(((FluentExpression) f).fluent().name()) == null)
			throw new ProblemDefinitionException(f + " is not a fluent of problem " + name);
		if (!f.type().isCompatible(v.type()))
			throw new ProblemDefinitionException("Initial value " + v + " is not a value of " + f.type());
		initialValues.put((FluentExpression) f, v);
	}

	/**
	 * Returns the initial value of the given ground fluent expression: the
	 * explicit one if any, the default of its fluent otherwise.
	 * 
	 * @throws ProblemDefinitionException
	 *             if the expression has no initial value.
	 */
	public Expression initialValue(FluentExpression fluent) {
		Expression res = initialValues.get(fluent);
		if (res == null)
			res = fluentDefaults.get(fluent.fluent());
		if (res == null)
			throw new ProblemDefinitionException("Initial value of " + fluent + " is not set");
		return res;
	}

	public Map<FluentExpression,Expression> explicitInitialValues() {
		return Collections.unmodifiableMap(initialValues);
	}

	/* ---------------- actions ---------------- */

	public void addAction(Action action) {
		checkFreshName(action.name());
		for (Parameter p : action.parameters())
			addTypeOf(p.type());
		actions.put(action.name(), action);
	}

	public List<Action> actions() {
		return List.copyOf(actions.values());
	}

	public boolean hasAction(String name) {
		return actions.containsKey(name);
	}

	public Action action(String name) {
		Action res = actions.get(name);
		if (res == null)
			throw new ProblemDefinitionException("Action " + name + " is not defined");
		return res;
	}

	public void clearActions() {
		actions.clear();
	}

	/* ---------------- goals ---------------- */

	/** Adds a goal; a {@code true} goal is ignored. */
	public void addGoal(Object goal) {
		Expression g = toGoal(goal);
		if (!g.isTrue())
			goals.add(g);
	}

	public List<Expression> goals() {
		return Collections.unmodifiableList(goals);
	}

	public void clearGoals() {
		goals.clear();
	}

	public void addTimedGoal(Timing timing, Object goal) {
		addTimedGoal(TimeInterval.at(timing), goal);
	}

	/** Adds a goal over the given interval; a {@code true} goal is ignored. */
	public void addTimedGoal(TimeInterval interval, Object goal) {
		Expression g = toGoal(goal);
		if (!g.isTrue())
			timedGoals.computeIfAbsent(interval, i -> new ArrayList<Expression>()).add(g);
	}

	/** @return an unmodifiable snapshot of the timed goals, in insertion order. */
	public Map<TimeInterval,List<Expression>> timedGoals() {
		Map<TimeInterval,List<Expression>> res = new LinkedHashMap<TimeInterval,List<Expression>>();
		for (Map.Entry<TimeInterval,List<Expression>> e : timedGoals.entrySet())
			res.put(e.getKey(), List.copyOf(e.getValue()));
		return Collections.unmodifiableMap(res);
	}

	public void clearTimedGoals() {
		timedGoals.clear();
	}

	private Expression toGoal(Object goal) {
		Expression g = manager.auto(goal);
		if (!g.type().isBoolType())
			throw new ProblemDefinitionException("Goal " + g + " is not boolean");
		return g;
	}

	/* ---------------- metrics and kind ---------------- */

	public void addQualityMetric(QualityMetric metric) {
		qualityMetrics.add(metric);
	}

	public List<QualityMetric> qualityMetrics() {
		return Collections.unmodifiableList(qualityMetrics);
	}

	/**
	 * Computes the features this problem uses.
	 */
	public ProblemKind kind() {
		return new ProblemKindAnalyzer(this).analyze();
	}

	/**
	 * Returns a copy of this problem sharing its expression manager. Actions
	 * are copied, so the copy can be modified independently.
	 */
	public Problem copy() {
		Problem res = new Problem(name, manager);
		res.userTypes.putAll(userTypes);
		res.objects.putAll(objects);
		res.fluents.putAll(fluents);
		res.fluentDefaults.putAll(fluentDefaults);
		res.initialValues.putAll(initialValues);
		for (Action a : actions.values())
			res.actions.put(a.name(), a.copy());
		res.goals.addAll(goals);
		for (Map.Entry<TimeInterval,List<Expression>> e : timedGoals.entrySet())
			res.timedGoals.put(e.getKey(), new ArrayList<Expression>(e.getValue()));
		res.qualityMetrics.addAll(qualityMetrics);
		return res;
	}

	public String toString() {
		StringBuilder sb = new StringBuilder("problem name = ").append(name).append("\n\n");
		sb.append("types = ").append(userTypes.values()).append("\n\n");
		sb.append("fluents = [\n");
		for (Fluent f : fluents.values())
			sb.append("  ").append(f).append('\n');
		sb.append("]\n\nobjects = ").append(objects.values()).append("\n\nactions = [\n");
		for (Action a : actions.values())
			sb.append("  ").append(a).append('\n');
		sb.append("]\n\ninitial values = ").append(initialValues).append("\n\n");
		sb.append("goals = ").append(goals).append('\n');
		if (!timedGoals.isEmpty())
			sb.append("\ntimed goals = ").append(timedGoals).append('\n');
		return sb.toString();
	}
}
