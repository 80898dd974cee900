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

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.ast.FluentExpression;
import plankit.ast.ParameterExpression;

/**
 * An action of an action-based problem: a name, a list of typed parameters
 * and the expression manager its conditions and effects are built with.
 * 
 * @see InstantaneousAction
 * @see DurativeAction
 */
public abstract class Action {

	private final String name;
	private final List<Parameter> parameters;
	protected final ExpressionManager manager;

	protected Action(String name, List<Parameter> parameters, ExpressionManager manager) {
		this.name = Objects.requireNonNull(name);
		this.parameters = List.copyOf(parameters);
		this.manager = Objects.requireNonNull(manager);
		Set<String> names = new HashSet<String>();
		for (Parameter p : this.parameters)
			if (!names.add(p.name()))
				throw new ProblemDefinitionException("Duplicate parameter " + p.name() + " in action " + name);
	}

	public String name() {
		return name;
	}

	public List<Parameter> parameters() {
		return parameters;
	}

	public ExpressionManager manager() {
		return manager;
	}

	/**
	 * Returns the expression referring to the parameter with the given name.
	 * 
	 * @throws ProblemDefinitionException
	 *             if the action has no such parameter.
	 */
	public ParameterExpression parameter(String name) {
		for (Parameter p : parameters)
			if (p.name().equals(name))
				return new ParameterExpression(p);
		throw new ProblemDefinitionException("Action " + this.name + " has no parameter " + name);
	}

	/**
	 * Returns a copy of this action with the given name. Conditions and
	 * effects are copied, the expressions themselves are shared.
	 */
	public abstract Action copy(String name);

	/** @return a copy of this action with the same name. */
	public final Action copy() {
		return copy(name);
	}

	/** @return every effect of this action, whatever its timing. */
	public abstract List<Effect> allEffects();

	/** @return every condition of this action, whatever its timing. */
	public abstract List<Expression> allConditions();

	protected final FluentExpression toFluentExp(Object fluent) {
		Expression e = manager.auto(fluent);
		if (!e.isFluentExp())
			throw new ProblemDefinitionException("Effects can only modify fluents, not " + e);
		return (FluentExpression) e;
	}

	protected final Expression toCondition(Object condition) {
		Expression e = manager.auto(condition);
		if (!e.type().isBoolType())
			throw new ProblemDefinitionException("Condition " + e + " of action " + name + " is not boolean");
		return e;
	}

	protected final Effect effect(Object fluent, Object value, Object condition, Effect.Kind kind) {
		return new Effect(toFluentExp(fluent), manager.auto(value), toCondition(condition), kind);
	}
}
