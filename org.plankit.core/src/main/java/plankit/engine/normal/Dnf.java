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
package plankit.engine.normal;

import java.util.ArrayList;
import java.util.List;

import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.util.CartesianProduct;

/**
 * Computes disjunctive normal forms. The expression is first put in
 * {@link Nnf negation normal form}; conjunctions are then distributed over
 * disjunctions. Literals, comparisons and quantified sub-formulas are kept
 * as atoms.
 * 
 * The result is an OR of ANDs, an AND of literals, or a single literal. It is
 * not simplified: contradictory or constant clauses are left in place.
 */
public final class Dnf {

	private final ExpressionManager manager;
	private final Nnf nnf;

	public Dnf(ExpressionManager manager) {
		this.manager = manager;
		this.nnf = new Nnf(manager);
	}

	/**
	 * Returns an expression equivalent to the given one, in disjunctive
	 * normal form.
	 */
	public Expression dnf(Expression expression) {
		List<List<Expression>> clauses = clauses(nnf.nnf(expression));
		List<Expression> disjuncts = new ArrayList<Expression>(clauses.size());
		for (List<Expression> clause : clauses)
			disjuncts.add(manager.and(clause));
		return manager.or(disjuncts);
	}

	/**
	 * Returns the disjuncts of the given expression: its arguments if it is an
	 * OR, the expression alone otherwise.
	 */
	public static List<Expression> disjuncts(Expression expression) {
		return expression.isOr() ? expression.args() : List.of(expression);
	}

	private List<List<Expression>> clauses(Expression e) {
		List<List<Expression>> res = new ArrayList<List<Expression>>();
		if (e.isOr()) {
			for (Expression arg : e.args())
				res.addAll(clauses(arg));
		} else if (e.isAnd()) {
			List<List<List<Expression>>> factors = new ArrayList<List<List<Expression>>>();
			for (Expression arg : e.args())
				factors.add(clauses(arg));
			for (List<List<Expression>> combination : new CartesianProduct<List<Expression>>(factors)) {
				List<Expression> clause = new ArrayList<Expression>();
				for (List<Expression> part : combination)
					clause.addAll(part);
				res.add(clause);
			}
		} else {
			List<Expression> clause = new ArrayList<Expression>(1);
			clause.add(e);
			res.add(clause);
		}
		return res;
	}
}
