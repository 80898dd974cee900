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

import plankit.ast.operator.BinaryOperator;
import plankit.ast.visitor.ReturnVisitor;
import plankit.model.Type;

/**
 * The application of a {@link BinaryOperator} to a left and a right argument.
 */
public final class BinaryExpression extends Expression {

	private final BinaryOperator op;
	private final Expression left, right;

	public BinaryExpression(BinaryOperator op, Expression left, Expression right) {
		switch (op) {
		case IMPLIES:
		case IFF:
			checkBoolean(left);
			checkBoolean(right);
			break;
		case EQUALS:
			if (!left.type().isCompatible(right.type()) && !right.type().isCompatible(left.type()))
				throw new IllegalArgumentException("Cannot compare " + left + " and " + right);
			break;
		default:
			checkNumeric(left);
			checkNumeric(right);
		}
		this.op = op;
		this.left = left;
		this.right = right;
	}

	public BinaryOperator op() {
		return op;
	}

	public Expression left() {
		return left;
	}

	public Expression right() {
		return right;
	}

	@Override
	public List<Expression> args() {
		return List.of(left, right);
	}

	@Override
	public Type type() {
		if (op.isPredicate())
			return Type.BOOL;
		if (op == BinaryOperator.MINUS && left.type().isIntType() && right.type().isIntType())
			return Type.INT;
		return Type.REAL;
	}

	@Override
	public <T> T accept(ReturnVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof BinaryExpression))
			return false;
		BinaryExpression other = (BinaryExpression) o;
		return op == other.op && left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, left, right);
	}

	public String toString() {
		return "(" + left + " " + op + " " + right + ")";
	}
}
