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

import java.util.Collections;
import java.util.List;

import plankit.ast.operator.BinaryOperator;
import plankit.ast.operator.NaryOperator;
import plankit.ast.visitor.ReturnVisitor;
import plankit.model.Type;

/**
 * An immutable node of a planning expression tree. Boolean formulas, numeric
 * terms and object terms share this hierarchy; the {@link #type() type} of a
 * node tells them apart.
 * 
 * Nodes are compared structurally, so the same sub-expression may be shared
 * by any number of trees without being copied.
 */
public abstract class Expression {

	Expression() {}

	/**
	 * Returns the type of the values this expression denotes.
	 * 
	 * @return the type of this expression.
	 */
	public abstract Type type();

	/**
	 * Accepts the given visitor and returns the result.
	 * 
	 * @see ReturnVisitor
	 */
	public abstract <T> T accept(ReturnVisitor<T> visitor);

	/**
	 * Returns the direct children of this node, in order.
	 * 
	 * @return the arguments of this node.
	 */
	public List<Expression> args() {
		return Collections.emptyList();
	}

	public boolean isTrue()             { return false; }
	public boolean isFalse()            { return false; }
	public boolean isConstant()         { return false; }
	public boolean isFluentExp()        { return false; }
	public boolean isNot()              { return false; }
	public boolean isAnd()              { return false; }
	public boolean isOr()               { return false; }
	public boolean isQuantifier()       { return false; }

	/** @return this and the given formula. */
	public final Expression and(Expression formula) {
		return new NaryExpression(NaryOperator.AND, List.of(this, formula));
	}

	/** @return this or the given formula. */
	public final Expression or(Expression formula) {
		return new NaryExpression(NaryOperator.OR, List.of(this, formula));
	}

	/** @return the negation of this formula. */
	public final Expression not() {
		return new NotExpression(this);
	}

	public final Expression implies(Expression formula) {
		return new BinaryExpression(BinaryOperator.IMPLIES, this, formula);
	}

	public final Expression iff(Expression formula) {
		return new BinaryExpression(BinaryOperator.IFF, this, formula);
	}

	public final Expression eq(Expression term) {
		return new BinaryExpression(BinaryOperator.EQUALS, this, term);
	}

	public final Expression le(Expression term) {
		return new BinaryExpression(BinaryOperator.LE, this, term);
	}

	public final Expression lt(Expression term) {
		return new BinaryExpression(BinaryOperator.LT, this, term);
	}

	public final Expression plus(Expression term) {
		return new NaryExpression(NaryOperator.PLUS, List.of(this, term));
	}

	public final Expression times(Expression term) {
		return new NaryExpression(NaryOperator.TIMES, List.of(this, term));
	}

	public final Expression minus(Expression term) {
		return new BinaryExpression(BinaryOperator.MINUS, this, term);
	}

	public final Expression div(Expression term) {
		return new BinaryExpression(BinaryOperator.DIV, this, term);
	}

	static void checkBoolean(Expression e) {
		if (!e.type().isBoolType())
			throw new IllegalArgumentException("Expected a boolean expression: " + e);
	}

	static void checkNumeric(Expression e) {
		if (!e.type().isNumeric())
			throw new IllegalArgumentException("Expected a numeric expression: " + e);
	}
}
