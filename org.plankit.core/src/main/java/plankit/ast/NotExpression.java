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

import plankit.ast.visitor.ReturnVisitor;
import plankit.model.Type;

/**
 * The negation of a boolean expression.
 */
public final class NotExpression extends Expression {

	private final Expression formula;

	public NotExpression(Expression formula) {
		checkBoolean(formula);
		this.formula = formula;
	}

	/** @return the negated formula. */
	public Expression formula() {
		return formula;
	}

	@Override
	public List<Expression> args() {
		return List.of(formula);
	}

	@Override
	public Type type() {
		return Type.BOOL;
	}

	@Override
	public boolean isNot() {
		return true;
	}

	@Override
	public <T> T accept(ReturnVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof NotExpression && formula.equals(((NotExpression) o).formula);
	}

	@Override
	public int hashCode() {
		return ~formula.hashCode();
	}

	public String toString() {
		return "(not " + formula + ")";
	}
}
