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

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A point in time, given as a delay from one of four anchors: the start or
 * the end of the enclosing action, or the start or the end of the plan.
 */
public final class Timing {

	public enum Anchor {
		START("start"), END("end"), GLOBAL_START("global_start"), GLOBAL_END("global_end");

		private final String label;

		private Anchor(String label) {
			this.label = label;
		}

		public String toString() {
			return label;
		}
	}

	public static final Timing START = new Timing(Anchor.START, BigDecimal.ZERO);
	public static final Timing END = new Timing(Anchor.END, BigDecimal.ZERO);
	public static final Timing GLOBAL_START = new Timing(Anchor.GLOBAL_START, BigDecimal.ZERO);
	public static final Timing GLOBAL_END = new Timing(Anchor.GLOBAL_END, BigDecimal.ZERO);

	private final Anchor anchor;
	private final BigDecimal delay;

	public Timing(Anchor anchor, BigDecimal delay) {
		this.anchor = Objects.requireNonNull(anchor);
		this.delay = Objects.requireNonNull(delay);
	}

	public static Timing start(long delay) {
		return new Timing(Anchor.START, BigDecimal.valueOf(delay));
	}

	public static Timing end(long delay) {
		return new Timing(Anchor.END, BigDecimal.valueOf(delay));
	}

	public static Timing globalStart(long delay) {
		return new Timing(Anchor.GLOBAL_START, BigDecimal.valueOf(delay));
	}

	public Anchor anchor() {
		return anchor;
	}

	public BigDecimal delay() {
		return delay;
	}

	/** @return true if this timing is relative to the enclosing action. */
	public boolean isFromAction() {
		return anchor == Anchor.START || anchor == Anchor.END;
	}

	/** @return true if this is the start or the end of the action, without delay. */
	public boolean isActionBoundary() {
		return isFromAction() && delay.signum() == 0;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Timing))
			return false;
		Timing other = (Timing) o;
		return anchor == other.anchor && delay.compareTo(other.delay) == 0;
	}

	@Override
	public int hashCode() {
		return anchor.hashCode() * 31 + delay.stripTrailingZeros().hashCode();
	}

	public String toString() {
		if (delay.signum() == 0)
			return anchor.toString();
		return anchor + (delay.signum() > 0 ? "+" : "") + delay.toPlainString();
	}
}
