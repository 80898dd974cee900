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

/**
 * An interval between two timings, each end possibly open. A closed
 * interval whose ends coincide is a single point.
 */
public final class TimeInterval {

	private final Timing lower, upper;
	private final boolean leftOpen, rightOpen;

	public TimeInterval(Timing lower, Timing upper, boolean leftOpen, boolean rightOpen) {
		this.lower = Objects.requireNonNull(lower);
		this.upper = Objects.requireNonNull(upper);
		this.leftOpen = leftOpen;
		this.rightOpen = rightOpen;
	}

	public static TimeInterval at(Timing timing) {
		return new TimeInterval(timing, timing, false, false);
	}

	public static TimeInterval closed(Timing lower, Timing upper) {
		return new TimeInterval(lower, upper, false, false);
	}

	public static TimeInterval open(Timing lower, Timing upper) {
		return new TimeInterval(lower, upper, true, true);
	}

	public Timing lower()       { return lower; }
	public Timing upper()       { return upper; }
	public boolean leftOpen()   { return leftOpen; }
	public boolean rightOpen()  { return rightOpen; }

	public boolean isPoint() {
		return lower.equals(upper) && !leftOpen && !rightOpen;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof TimeInterval))
			return false;
		TimeInterval other = (TimeInterval) o;
		return lower.equals(other.lower) && upper.equals(other.upper) && leftOpen == other.leftOpen
				&& rightOpen == other.rightOpen;
	}

	@Override
	public int hashCode() {
		return Objects.hash(lower, upper, leftOpen, rightOpen);
	}

	public String toString() {
		if (isPoint())
			return "[" + lower + "]";
		return (leftOpen ? "(" : "[") + lower + ", " + upper + (rightOpen ? ")" : "]");
	}
}
