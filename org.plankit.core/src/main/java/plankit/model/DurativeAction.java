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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import plankit.ast.Expression;
import plankit.ast.ExpressionManager;

/**
 * An action with a duration, conditions over time intervals and effects at
 * timings. Both maps keep their insertion order.
 */
public class DurativeAction extends Action {

	private DurationInterval duration;
	private final Map<TimeInterval,List<Expression>> conditions = new LinkedHashMap<TimeInterval,List<Expression>>();
	private final Map<Timing,List<Effect>> effects = new LinkedHashMap<Timing,List<Effect>>();

	public DurativeAction(String name, ExpressionManager manager, Parameter... parameters) {
		this(name, Arrays.asList(parameters), manager);
	}

	public DurativeAction(String name, List<Parameter> parameters, ExpressionManager manager) {
		super(name, parameters, manager);
		this.duration = DurationInterval.fixed(manager.integer(0));
	}

	public DurationInterval duration() {
		return duration;
	}

	public void setDuration(DurationInterval duration) {
		this.duration = duration;
	}

	public void setFixedDuration(Object value) {
		this.duration = DurationInterval.fixed(manager.auto(value));
	}

	public void setClosedDurationInterval(Object lower, Object upper) {
		this.duration = DurationInterval.closed(manager.auto(lower), manager.auto(upper));
	}

	/** @return an unmodifiable snapshot of the conditions, per interval. */
	public Map<TimeInterval,List<Expression>> conditions() {
		Map<TimeInterval,List<Expression>> res = new LinkedHashMap<TimeInterval,List<Expression>>();
		for (Map.Entry<TimeInterval,List<Expression>> e : conditions.entrySet())
			res.put(e.getKey(), List.copyOf(e.getValue()));
		return Collections.unmodifiableMap(res);
	}

	/** @return an unmodifiable snapshot of the effects, per timing. */
	public Map<Timing,List<Effect>> effects() {
		Map<Timing,List<Effect>> res = new LinkedHashMap<Timing,List<Effect>>();
		for (Map.Entry<Timing,List<Effect>> e : effects.entrySet())
			res.put(e.getKey(), List.copyOf(e.getValue()));
		return Collections.unmodifiableMap(res);
	}

	public void addCondition(Timing timing, Object condition) {
		addCondition(TimeInterval.at(timing), condition);
	}

	/**
	 * Adds a condition that must hold over the given interval. A {@code true}
	 * condition and a condition already present at the interval are ignored.
	 */
	public void addCondition(TimeInterval interval, Object condition) {
		Expression e = toCondition(condition);
		if (e.isTrue())
			return;
		List<Expression> l = conditions.computeIfAbsent(interval, i -> new ArrayList<Expression>());
		if (!l.contains(e))
			l.add(e);
	}

	public void clearConditions() {
		conditions.clear();
	}

	public void addEffect(Timing timing, Object fluent, Object value) {
		addEffect(timing, fluent, value, true);
	}

	public void addEffect(Timing timing, Object fluent, Object value, Object condition) {
		addEffect(timing, effect(fluent, value, condition, Effect.Kind.ASSIGN));
	}

	public void addIncreaseEffect(Timing timing, Object fluent, Object value) {
		addEffect(timing, effect(fluent, value, true, Effect.Kind.INCREASE));
	}

	public void addDecreaseEffect(Timing timing, Object fluent, Object value) {
		addEffect(timing, effect(fluent, value, true, Effect.Kind.DECREASE));
	}

	/**
	 * Adds the given effect at the given timing unless an equal one is already
	 * there.
	 */
	public void addEffect(Timing timing, Effect effect) {
		List<Effect> l = effects.computeIfAbsent(timing, t -> new ArrayList<Effect>());
		if (!l.contains(effect))
			l.add(effect);
	}

	public void clearEffects() {
		effects.clear();
	}

	@Override
	public List<Effect> allEffects() {
		List<Effect> res = new ArrayList<Effect>();
		for (List<Effect> l : effects.values())
			res.addAll(l);
		return res;
	}

	@Override
	public List<Expression> allConditions() {
		List<Expression> res = new ArrayList<Expression>();
		for (List<Expression> l : conditions.values())
			res.addAll(l);
		return res;
	}

	@Override
	public DurativeAction copy(String name) {
		DurativeAction res = new DurativeAction(name, parameters(), manager);
		res.duration = duration;
		for (Map.Entry<TimeInterval,List<Expression>> e : conditions.entrySet())
			res.conditions.put(e.getKey(), new ArrayList<Expression>(e.getValue()));
		for (Map.Entry<Timing,List<Effect>> e : effects.entrySet())
			res.effects.put(e.getKey(), new ArrayList<Effect>(e.getValue()));
		return res;
	}

	public String toString() {
		StringBuilder sb = new StringBuilder("durative-action ").append(name());
		if (!parameters().isEmpty())
			sb.append(parameters());
		sb.append(" {\n    duration = ").append(duration);
		sb.append("\n    conditions = ").append(conditions);
		sb.append("\n    effects = ").append(effects).append("\n}");
		return sb.toString();
	}
}
