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

import java.util.Objects;

import plankit.ast.BooleanConstant;
import plankit.ast.Expression;
import plankit.ast.FluentExpression;

/**
 * An assignment, increase or decrease of a fluent, guarded by a condition.
 * The effect is unconditional iff its condition is {@code true}. Effects are
 * immutable; {@link #withCondition(Expression)} derives a copy with another
 * guard.
 */
public final class Effect {

	public enum Kind {
		ASSIGN, INCREASE, DECREASE
	}

	private final FluentExpression fluent;
	private final Expression value;
	private final Expression condition;
	private final Kind kind;

	public Effect(FluentExpression fluent, Expression value, Expression condition, Kind kind) {
		this.fluent = Objects.requireNonNull(fluent);
		this.value = Objects.requireNonNull(value);
		this.condition = Objects.requireNonNull(condition);
		this.kind = Objects.requireNonNull(kind);
		if (!condition.type().isBoolType())
			throw new ProblemDefinitionException("Effect condition is not boolean: " + condition);
		if (!fluent.type().isCompatible(value.type()))
			throw new ProblemDefinitionException(
					"Cannot assign " + value + " of type " + value.type() + " to " + fluent + " of type " + fluent.type());
		if (kind != Kind.ASSIGN && !fluent.type().isNumeric())
			throw new ProblemDefinitionException("Cannot " + kind.name().toLowerCase() + " non numeric fluent " + fluent);
	}

	/** Creates an unconditional assignment. */
	public Effect(FluentExpression fluent, Expression value) {
		this(fluent, value, BooleanConstant.TRUE, Kind.ASSIGN);
	}

	public FluentExpression fluent()  { return fluent; }
	public Expression value()         { return value; }
	public Expression condition()     { return condition; }
	public Kind kind()                { return kind; }

	public boolean isConditional() {
		return !condition.isTrue();
	}

	public boolean isIncrease() {
		return kind == Kind.INCREASE;
	}

	public boolean isDecrease() {
		return kind == Kind.DECREASE;
	}

	/**
	 * Returns a copy of this effect guarded by the given condition.
	 */
	public Effect withCondition(Expression condition) {
		return new Effect(fluent, value, condition, kind);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Effect))
			return false;
		Effect other = (Effect) o;
		return kind == other.kind && fluent.equals(other.fluent) && value.equals(other.value)
				&& condition.equals(other.condition);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fluent, value, condition, kind);
	}

	public String toString() {
		String op = kind == Kind.ASSIGN ? ":=" : kind == Kind.INCREASE ? "+=" : "-=";
		String body = fluent + " " + op + " " + value;
		return isConditional() ? "if " + condition + " then " + body : body;
	}
}
