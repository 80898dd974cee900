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
package plankit.ast;

import java.util.List;
import java.util.Objects;

import plankit.ast.visitor.ReturnVisitor;
import plankit.model.Fluent;
import plankit.model.Type;

/**
 * The application of a {@link Fluent} to a list of arguments, one per
 * parameter of its signature.
 */
public final class FluentExpression extends Expression {

	private final Fluent fluent;
	private final List<Expression> args;

	public FluentExpression(Fluent fluent, List<Expression> args) {
		if (fluent.arity() != args.size())
			throw new IllegalArgumentException(
					"Fluent " + fluent.name() + " expects " + fluent.arity() + " arguments, got " + args.size());
		for (int i = 0; i < args.size(); i++) {
			Type expected = fluent.signature().get(i).type();
			if (!expected.isCompatible(args.get(i).type()))
				throw new IllegalArgumentException("Argument " + args.get(i) + " of " + fluent.name()
						+ " is not of type " + expected);
		}
		this.fluent = fluent;
		this.args = List.copyOf(args);
	}

	public Fluent fluent() {
		return fluent;
	}

	@Override
	public List<Expression> args() {
		return args;
	}

	@Override
	public Type type() {
		return fluent.type();
	}

	@Override
	public boolean isFluentExp() {
		return true;
	}

	@Override
	public <T> T accept(ReturnVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof FluentExpression))
			return false;
		FluentExpression other = (FluentExpression) o;
		return fluent.equals(other.fluent) && args.equals(other.args);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fluent, args);
	}

	public String toString() {
		if (args.isEmpty())
			return fluent.name();
		StringBuilder sb = new StringBuilder(fluent.name()).append('(');
		for (int i = 0; i < args.size(); i++) {
			if (i > 0)
				sb.append(", ");
			sb.append(args.get(i));
		}
		return sb.append(')').toString();
	}
}
