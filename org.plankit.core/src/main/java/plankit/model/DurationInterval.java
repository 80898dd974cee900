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

import plankit.ast.Expression;

/**
 * The admissible durations of a durative action, as an interval between two
 * numeric expressions.
 */
public final class DurationInterval {

	private final Expression lower, upper;
	private final boolean leftOpen, rightOpen;

	public DurationInterval(Expression lower, Expression upper, boolean leftOpen, boolean rightOpen) {
		if (!lower.type().isNumeric() || !upper.type().isNumeric())
			throw new ProblemDefinitionException("Duration bounds must be numeric: " + lower + ", " + upper);
		this.lower = lower;
		this.upper = upper;
		this.leftOpen = leftOpen;
		this.rightOpen = rightOpen;
	}

	public static DurationInterval fixed(Expression duration) {
		return new DurationInterval(duration, duration, false, false);
	}

	public static DurationInterval closed(Expression lower, Expression upper) {
		return new DurationInterval(lower, upper, false, false);
	}

	public Expression lower()   { return lower; }
	public Expression upper()   { return upper; }
	public boolean leftOpen()   { return leftOpen; }
	public boolean rightOpen()  { return rightOpen; }

	/** @return true if the duration is a single value. */
	public boolean isFixed() {
		return lower.equals(upper) && !leftOpen && !rightOpen;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof DurationInterval))
			return false;
		DurationInterval other = (DurationInterval) o;
		return lower.equals(other.lower) && upper.equals(other.upper) && leftOpen == other.leftOpen
				&& rightOpen == other.rightOpen;
	}

	@Override
	public int hashCode() {
		return Objects.hash(lower, upper, leftOpen, rightOpen);
	}

	public String toString() {
		return (leftOpen ? "(" : "[") + lower + ", " + upper + (rightOpen ? ")" : "]");
	}
}
