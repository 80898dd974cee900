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

import plankit.ast.operator.NaryOperator;
import plankit.ast.visitor.ReturnVisitor;
import plankit.model.Type;

/**
 * The application of an {@link NaryOperator} to two or more arguments.
 */
public final class NaryExpression extends Expression {

	private final NaryOperator op;
	private final List<Expression> args;

	public NaryExpression(NaryOperator op, List<? extends Expression> args) {
		if (args.size() < 2)
			throw new IllegalArgumentException(op + " requires at least two arguments: " + args);
		for (Expression arg : args) {
			if (op.isLogical())
				checkBoolean(arg);
			else
				checkNumeric(arg);
		}
		this.op = op;
		this.args = List.copyOf(args);
	}

	public NaryOperator op() {
		return op;
	}

	@Override
	public List<Expression> args() {
		return args;
	}

	@Override
	public Type type() {
		if (op.isLogical())
			return Type.BOOL;
		for (Expression arg : args)
			if (!arg.type().isIntType())
				return Type.REAL;
		return Type.INT;
	}

	@Override
	public boolean isAnd() {
		return op == NaryOperator.AND;
	}

	@Override
	public boolean isOr() {
		return op == NaryOperator.OR;
	}

	@Override
	public <T> T accept(ReturnVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof NaryExpression))
			return false;
		NaryExpression other = (NaryExpression) o;
		return op == other.op && args.equals(other.args);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, args);
	}

	public String toString() {
		StringBuilder sb = new StringBuilder("(");
		for (int i = 0; i < args.size(); i++) {
			if (i > 0)
				sb.append(' ').append(op).append(' ');
			sb.append(args.get(i));
		}
		return sb.append(')').toString();
	}
}
