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
package plankit.ast.operator;

/**
 * Operators that take exactly two arguments.
 */
public enum BinaryOperator {
	IMPLIES("implies", true),
	IFF("iff", true),
	EQUALS("==", true),
	LE("<=", true),
	LT("<", true),
	MINUS("-", false),
	DIV("/", false);

	private final String symbol;
	private final boolean predicate;

	private BinaryOperator(String symbol, boolean predicate) {
		this.symbol = symbol;
		this.predicate = predicate;
	}

	/** @return true if an application of this operator is boolean valued. */
	public boolean isPredicate() {
		return predicate;
	}

	/** @return true if this operator compares two terms. */
	public boolean isComparison() {
		return this == EQUALS || this == LE || this == LT;
	}

	public String toString() {
		return symbol;
	}
}
