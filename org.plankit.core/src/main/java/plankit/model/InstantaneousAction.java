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
import java.util.List;

import plankit.ast.Expression;
import plankit.ast.ExpressionManager;

/**
 * An action without duration: a list of preconditions, read as their
 * conjunction, and a list of effects.
 */
public class InstantaneousAction extends Action {

	private final List<Expression> preconditions = new ArrayList<Expression>();
	private final List<Effect> effects = new ArrayList<Effect>();

	public InstantaneousAction(String name, ExpressionManager manager, Parameter... parameters) {
		this(name, Arrays.asList(parameters), manager);
	}

	public InstantaneousAction(String name, List<Parameter> parameters, ExpressionManager manager) {
		super(name, parameters, manager);
	}

	public List<Expression> preconditions() {
		return Collections.unmodifiableList(preconditions);
	}

	public List<Effect> effects() {
		return Collections.unmodifiableList(effects);
	}

	/**
	 * Adds a precondition. A {@code true} precondition and a precondition
	 * already present are ignored.
	 */
	public void addPrecondition(Object precondition) {
		Expression e = toCondition(precondition);
		if (!e.isTrue() && !preconditions.contains(e))
			preconditions.add(e);
	}

	public void clearPreconditions() {
		preconditions.clear();
	}

	public void addEffect(Object fluent, Object value) {
		addEffect(fluent, value, true);
	}

	public void addEffect(Object fluent, Object value, Object condition) {
		addEffect(effect(fluent, value, condition, Effect.Kind.ASSIGN));
	}

	public void addIncreaseEffect(Object fluent, Object value) {
		addEffect(effect(fluent, value, true, Effect.Kind.INCREASE));
	}

	public void addDecreaseEffect(Object fluent, Object value) {
		addEffect(effect(fluent, value, true, Effect.Kind.DECREASE));
	}

	/**
	 * Adds the given effect unless an equal one is already present.
	 */
	public void addEffect(Effect effect) {
		if (!effects.contains(effect))
			effects.add(effect);
	}

	public void clearEffects() {
		effects.clear();
	}

	@Override
	public List<Effect> allEffects() {
		return effects();
	}

	@Override
	public List<Expression> allConditions() {
		return preconditions();
	}

	@Override
	public InstantaneousAction copy(String name) {
		InstantaneousAction res = new InstantaneousAction(name, parameters(), manager);
		res.preconditions.addAll(preconditions);
		res.effects.addAll(effects);
		return res;
	}

	public String toString() {
		StringBuilder sb = new StringBuilder("action ").append(name());
		if (!parameters().isEmpty())
			sb.append(parameters());
		sb.append(" {\n    preconditions = ").append(preconditions);
		sb.append("\n    effects = ").append(effects).append("\n}");
		return sb.toString();
	}
}
