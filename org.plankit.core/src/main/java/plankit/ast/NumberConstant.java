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

import java.math.BigDecimal;

import plankit.ast.visitor.ReturnVisitor;
import plankit.model.Type;

/**
 * An integer or real constant.
 */
public final class NumberConstant extends Expression {

	private final BigDecimal value;
	private final boolean integer;

	public NumberConstant(BigDecimal value, boolean integer) {
		if (value == null)
			throw new NullPointerException("value");
		if (integer && value.stripTrailingZeros().scale() > 0)
			throw new IllegalArgumentException(value + " is not an integer.");
		this.value = value;
		this.integer = integer;
	}

	public static NumberConstant of(long value) {
		return new NumberConstant(BigDecimal.valueOf(value), true);
	}

	public static NumberConstant of(BigDecimal value) {
		return new NumberConstant(value, false);
	}

	public BigDecimal value() {
		return value;
	}

	public boolean isInteger() {
		return integer;
	}

	@Override
	public Type type() {
		return integer ? Type.INT : Type.REAL;
	}

	@Override
	public boolean isConstant() {
		return true;
	}

	@Override
	public <T> T accept(ReturnVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof NumberConstant))
			return false;
		NumberConstant other = (NumberConstant) o;
		return integer == other.integer && value.compareTo(other.value) == 0;
	}

	@Override
	public int hashCode() {
		return value.stripTrailingZeros().hashCode() * 31 + (integer ? 1 : 0);
	}

	public String toString() {
		return value.toPlainString();
	}
}
