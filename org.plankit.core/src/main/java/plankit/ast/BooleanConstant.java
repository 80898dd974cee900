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

import plankit.ast.visitor.ReturnVisitor;
import plankit.model.Type;

/**
 * The two boolean constants.
 */
public final class BooleanConstant extends Expression {

	public static final BooleanConstant TRUE = new BooleanConstant(true);
	public static final BooleanConstant FALSE = new BooleanConstant(false);

	private final boolean value;

	private BooleanConstant(boolean value) {
		this.value = value;
	}

	public static BooleanConstant of(boolean value) {
		return value ? TRUE : FALSE;
	}

	public boolean value() {
		return value;
	}

	@Override
	public Type type() {
		return Type.BOOL;
	}

	@Override
	public boolean isTrue() {
		return value;
	}

	@Override
	public boolean isFalse() {
		return !value;
	}

	@Override
	public boolean isConstant() {
		return true;
	}

	@Override
	public <T> T accept(ReturnVisitor<T> visitor) {
		return visitor.visit(this);
	}

	public String toString() {
		return String.valueOf(value);
	}
}
