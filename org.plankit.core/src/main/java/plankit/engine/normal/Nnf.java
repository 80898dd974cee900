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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import plankit.ast.BinaryExpression;
import plankit.ast.BooleanConstant;
import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.ast.FluentExpression;
import plankit.ast.NaryExpression;
import plankit.ast.NotExpression;
import plankit.ast.NumberConstant;
import plankit.ast.ObjectExpression;
import plankit.ast.ParameterExpression;
import plankit.ast.QuantifiedExpression;
import plankit.ast.VariableExpression;
import plankit.ast.visitor.ReturnVisitor;

/**
 * Converts boolean expressions into negation normal form: implications and
 * equivalences are expanded, and negations are pushed down to the literals,
 * i.e. boolean fluents, comparisons and boolean parameters or variables.
 * Quantifiers are kept, with their bodies converted as well.
 */
public final class Nnf implements ReturnVisitor<Expression> {

	private final ExpressionManager manager;
	private final Map<Expression,Expression> positive = new HashMap<Expression,Expression>();
	private final Map<Expression,Expression> negative = new HashMap<Expression,Expression>();
	private boolean negated = false;

	public Nnf(ExpressionManager manager) {
		this.manager = manager;
	}

	/**
	 * Returns the negation normal form of the given boolean expression.
	 */
	public Expression nnf(Expression expression) {
		negated = false;
		return expression.accept(this);
	}

	private Expression cached(Expression node) {
		return (negated ? negative : positive).get(node);
	}

	private Expression cache(Expression node, Expression result) {
		(negated ? negative : positive).put(node, result);
		return result;
	}

	private Expression visitNegated(Expression node) {
		negated = !negated;
		Expression res = node.accept(this);
		negated = !negated;
		return res;
	}

	private Expression literal(Expression node) {
		return negated && node.type().isBoolType() ? node.not() : node;
	}

	public Expression visit(BooleanConstant constant) {
		return negated ? BooleanConstant.of(!constant.value()) : constant;
	}

	public Expression visit(NumberConstant constant)      { return constant; }
	public Expression visit(ObjectExpression objectExp)   { return objectExp; }
	public Expression visit(FluentExpression fluentExp)   { return literal(fluentExp); }
	public Expression visit(ParameterExpression paramExp) { return literal(paramExp); }
	public Expression visit(VariableExpression varExp)    { return literal(varExp); }

	public Expression visit(NotExpression not) {
		return visitNegated(not.formula());
	}

	public Expression visit(NaryExpression nary) {
		if (!nary.op().isLogical())
			return nary;
		Expression ret = cached(nary);
		if (ret != null)
			return ret;
		List<Expression> args = new ArrayList<Expression>(nary.args().size());
		for (Expression arg : nary.args())
			args.add(arg.accept(this));
		ret = manager.compose(negated ? nary.op().dual() : nary.op(), args);
		return cache(nary, ret);
	}

	public Expression visit(BinaryExpression binary) {
		Expression l = binary.left(), r = binary.right();
		switch (binary.op()) {
		case IMPLIES:
			if (negated)
				return manager.and(visitNegated(l), r.accept(this));
			return manager.or(visitNegated(l), r.accept(this));
		case IFF: {
			boolean pre = negated;
			negated = false;
			Expression pl = l.accept(this), pr = r.accept(this);
			negated = true;
			Expression nl = l.accept(this), nr = r.accept(this);
			negated = pre;
			if (negated)
				return manager.or(manager.and(pl, nr), manager.and(nl, pr));
			return manager.or(manager.and(pl, pr), manager.and(nl, nr));
		}
		case EQUALS:
		case LE:
		case LT:
			return literal(binary);
		default:
			return binary;
		}
	}

	public Expression visit(QuantifiedExpression quantified) {
		Expression ret = cached(quantified);
		if (ret != null)
			return ret;
		Expression body = quantified.body().accept(this);
		ret = new QuantifiedExpression(negated ? quantified.quantifier().dual() : quantified.quantifier(),
				quantified.variables(), body);
		return cache(quantified, ret);
	}
}
