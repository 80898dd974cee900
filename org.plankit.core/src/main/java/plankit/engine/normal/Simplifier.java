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

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

import plankit.ast.BinaryExpression;
import plankit.ast.BooleanConstant;
import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.ast.NaryExpression;
import plankit.ast.NotExpression;
import plankit.ast.NumberConstant;
import plankit.ast.QuantifiedExpression;
import plankit.ast.operator.NaryOperator;
import plankit.ast.visitor.AbstractReplacer;

/**
 * Bottom-up simplification of expressions. Constants are folded through
 * the boolean connectives, the comparisons and the arithmetic operators;
 * nested conjunctions and disjunctions are flattened and their duplicate
 * arguments removed; a conjunction containing a literal and its negation is
 * {@code false} and a disjunction containing both is {@code true}.
 * 
 * Simplification is idempotent.
 */
public final class Simplifier extends AbstractReplacer {

	public Simplifier(ExpressionManager manager) {
		super(manager);
	}

	public Expression simplify(Expression expression) {
		return expression.accept(this);
	}

	private static Expression negate(Expression e) {
		if (e instanceof BooleanConstant)
			return BooleanConstant.of(!((BooleanConstant) e).value());
		if (e.isNot())
			return ((NotExpression) e).formula();
		return e.not();
	}

	@Override
	public Expression visit(NotExpression not) {
		Expression ret = lookup(not);
		if (ret != null)
			return ret;
		Expression sub = not.formula().accept(this);
		ret = sub == not.formula() && !sub.isNot() && !sub.isConstant() ? not : negate(sub);
		return cache(not, ret);
	}

	@Override
	public Expression visit(NaryExpression nary) {
		Expression ret = lookup(nary);
		if (ret != null)
			return ret;
		switch (nary.op()) {
		case AND:
			ret = connective(nary, BooleanConstant.FALSE, BooleanConstant.TRUE);
			break;
		case OR:
			ret = connective(nary, BooleanConstant.TRUE, BooleanConstant.FALSE);
			break;
		default:
			ret = arithmetic(nary);
		}
		return cache(nary, ret);
	}

	/**
	 * Simplifies a conjunction (or a disjunction): the absorbing constant
	 * short-circuits, the neutral one is dropped, nested connectives of the
	 * same kind are flattened and complementary literals absorb.
	 */
	private Expression connective(NaryExpression nary, BooleanConstant absorbing, BooleanConstant neutral) {
		List<Expression> args = new ArrayList<Expression>();
		for (Expression arg : nary.args()) {
			Expression s = arg.accept(this);
			if (s.equals(absorbing))
				return absorbing;
			if (s.equals(neutral))
				continue;
			if (s instanceof NaryExpression && ((NaryExpression) s).op() == nary.op()) {
				for (Expression sub : s.args())
					if (!args.contains(sub))
						args.add(sub);
			} else if (!args.contains(s)) {
				args.add(s);
			}
		}
		for (Expression arg : args)
			if (arg.isNot() && args.contains(((NotExpression) arg).formula()))
				return absorbing;
		Expression res = manager.compose(nary.op(), args);
		return res.equals(nary) ? nary : res;
	}

	private Expression arithmetic(NaryExpression nary) {
		boolean plus = nary.op() == NaryOperator.PLUS;
		BigDecimal folded = plus ? BigDecimal.ZERO : BigDecimal.ONE;
		boolean integer = true;
		int constants = 0;
		List<Expression> args = new ArrayList<Expression>();
		for (Expression arg : nary.args()) {
			Expression s = arg.accept(this);
			if (s instanceof NumberConstant) {
				NumberConstant c = (NumberConstant) s;
				folded = plus ? folded.add(c.value()) : folded.multiply(c.value());
				integer &= c.isInteger();
				constants++;
			} else {
				args.add(s);
			}
		}
		if (constants == 0)
			return args.equals(nary.args()) ? nary : manager.compose(nary.op(), args);
		if (!plus && folded.signum() == 0)
			return new NumberConstant(BigDecimal.ZERO, integer);
		boolean neutral = plus ? folded.signum() == 0 : folded.compareTo(BigDecimal.ONE) == 0;
		if (args.isEmpty() || !neutral || !integer)
			args.add(new NumberConstant(folded, integer));
		return manager.compose(nary.op(), args);
	}

	@Override
	public Expression visit(BinaryExpression binary) {
		Expression ret = lookup(binary);
		if (ret != null)
			return ret;
		Expression l = binary.left().accept(this);
		Expression r = binary.right().accept(this);
		ret = fold(binary, l, r);
		if (ret == null)
			ret = l == binary.left() && r == binary.right() ? binary : new BinaryExpression(binary.op(), l, r);
		return cache(binary, ret);
	}

	/**
	 * Folds the given operands, or returns null if they cannot be folded.
	 */
	private Expression fold(BinaryExpression binary, Expression l, Expression r) {
		switch (binary.op()) {
		case IMPLIES:
			if (l.isFalse() || r.isTrue() || l.equals(r))
				return BooleanConstant.TRUE;
			if (l.isTrue())
				return r;
			if (r.isFalse())
				return negate(l);
			return null;
		case IFF:
			if (l.equals(r))
				return BooleanConstant.TRUE;
			if (l.isTrue())
				return r;
			if (r.isTrue())
				return l;
			if (l.isFalse())
				return negate(r);
			if (r.isFalse())
				return negate(l);
			return null;
		case EQUALS:
			if (l.equals(r))
				return BooleanConstant.TRUE;
			if (l instanceof NumberConstant && r instanceof NumberConstant)
				return BooleanConstant.of(compare(l, r) == 0);
			if (l.isConstant() && r.isConstant())
				return BooleanConstant.FALSE;
			return null;
		case LE:
			return l instanceof NumberConstant && r instanceof NumberConstant ? BooleanConstant.of(compare(l, r) <= 0)
					: null;
		case LT:
			return l instanceof NumberConstant && r instanceof NumberConstant ? BooleanConstant.of(compare(l, r) < 0)
					: null;
		case MINUS:
			if (l instanceof NumberConstant && r instanceof NumberConstant)
				return new NumberConstant(value(l).subtract(value(r)), isInteger(l) && isInteger(r));
			if (r instanceof NumberConstant && value(r).signum() == 0 && (isInteger(r) || !l.type().isIntType()))
				return l;
			return null;
		case DIV:
			if (l instanceof NumberConstant && r instanceof NumberConstant && value(r).signum() != 0)
				return new NumberConstant(value(l).divide(value(r), MathContext.DECIMAL128), false);
			return null;
		default:
			return null;
		}
	}

	@Override
	public Expression visit(QuantifiedExpression quantified) {
		Expression ret = lookup(quantified);
		if (ret != null)
			return ret;
		Expression body = quantified.body().accept(this);
		if (body.isConstant())
			ret = body;
		else
			ret = body == quantified.body() ? quantified
					: new QuantifiedExpression(quantified.quantifier(), quantified.variables(), body);
		return cache(quantified, ret);
	}

	private static BigDecimal value(Expression e) {
		return ((NumberConstant) e).value();
	}

	private static boolean isInteger(Expression e) {
		return ((NumberConstant) e).isInteger();
	}

	private static int compare(Expression l, Expression r) {
		return value(l).compareTo(value(r));
	}
}
