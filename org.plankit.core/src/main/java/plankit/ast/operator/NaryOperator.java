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
 * Operators that take any number of arguments.
 */
public enum NaryOperator {
	/** Logical conjunction. */
	AND {
		public String toString() { return "and"; }
	},
	/** Logical disjunction. */
	OR {
		public String toString() { return "or"; }
	},
	/** Arithmetic sum. */
	PLUS {
		public String toString() { return "+"; }
	},
	/** Arithmetic product. */
	TIMES {
		public String toString() { return "*"; }
	};

	/** @return true if this is a boolean connective. */
	public final boolean isLogical() {
		return this == AND || this == OR;
	}

	/** @return the dual connective of a logical operator. */
	public final NaryOperator dual() {
		switch (this) {
		case AND:
			return OR;
		case OR:
			return AND;
		default:
			throw new IllegalArgumentException(this + " has no dual.");
		}
	}
}
