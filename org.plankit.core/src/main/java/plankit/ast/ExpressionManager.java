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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import plankit.ast.operator.BinaryOperator;
import plankit.ast.operator.NaryOperator;
import plankit.ast.operator.Quantifier;
import plankit.model.Fluent;
import plankit.model.Parameter;
import plankit.model.PlanObject;
import plankit.model.Variable;

/**
 * The construction context shared by a problem and everything derived from
 * it. Besides plain node construction, it promotes Java values, fluents,
 * parameters and objects to expressions, and folds degenerate conjunctions
 * and disjunctions: an empty conjunction is {@code true}, an empty
 * disjunction is {@code false} and a single argument is returned as is.
 */
public class ExpressionManager {

	public Expression TRUE() {
		return BooleanConstant.TRUE;
	}

	public Expression FALSE() {
		return BooleanConstant.FALSE;
	}

	public Expression bool(boolean value) {
		return BooleanConstant.of(value);
	}

	public Expression integer(long value) {
		return NumberConstant.of(value);
	}

	public Expression real(BigDecimal value) {
		return NumberConstant.of(value);
	}

	/**
	 * Promotes the given value to an expression.
	 * 
	 * @param value
	 *            an expression, a boolean, an integral or decimal number, a
	 *            nullary fluent, a parameter, an object or a variable.
	 * @return the expression denoting the value.
	 * @throws IllegalArgumentException
	 *             if the value cannot be promoted.
	 */
	public Expression auto(Object value) {
		if (value instanceof Expression)
			return (Expression) value;
		if (value instanceof Boolean)
			return bool((Boolean) value);
		if (value instanceof Integer || value instanceof Long || value instanceof Short)
			return integer(((Number) value).longValue());
		if (value instanceof BigDecimal)
			return real((BigDecimal) value);
		if (value instanceof Double || value instanceof Float)
			return real(BigDecimal.valueOf(((Number) value).doubleValue()));
		if (value instanceof Fluent)
			return fluentExp((Fluent) value);
		if (value instanceof Parameter)
			return new ParameterExpression((Parameter) value);
		if (value instanceof PlanObject)
			return new ObjectExpression((PlanObject) value);
		if (value instanceof Variable)
			return new VariableExpression((Variable) value);
		throw new IllegalArgumentException("Cannot promote " + value + " to an expression.");
	}

	public List<Expression> auto(Collection<?> values) {
		List<Expression> res = new ArrayList<Expression>(values.size());
		for (Object v : values)
			res.add(auto(v));
		return res;
	}

	public FluentExpression fluentExp(Fluent fluent, Object... args) {
		return new FluentExpression(fluent, auto(Arrays.asList(args)));
	}

	public Expression and(Object... args) {
		return and(Arrays.asList(args));
	}

	public Expression and(Collection<?> args) {
		return nary(NaryOperator.AND, args, BooleanConstant.TRUE);
	}

	public Expression or(Object... args) {
		return or(Arrays.asList(args));
	}

	public Expression or(Collection<?> args) {
		return nary(NaryOperator.OR, args, BooleanConstant.FALSE);
	}

	private Expression nary(NaryOperator op, Collection<?> args, Expression empty) {
		List<Expression> exprs = auto(args);
		if (exprs.isEmpty())
			return empty;
		if (exprs.size() == 1)
			return exprs.get(0);
		return new NaryExpression(op, exprs);
	}

	public Expression not(Object formula) {
		return new NotExpression(auto(formula));
	}

	public Expression implies(Object left, Object right) {
		return new BinaryExpression(BinaryOperator.IMPLIES, auto(left), auto(right));
	}

	public Expression iff(Object left, Object right) {
		return new BinaryExpression(BinaryOperator.IFF, auto(left), auto(right));
	}

	public Expression equals(Object left, Object right) {
		return new BinaryExpression(BinaryOperator.EQUALS, auto(left), auto(right));
	}

	public Expression le(Object left, Object right) {
		return new BinaryExpression(BinaryOperator.LE, auto(left), auto(right));
	}

	public Expression lt(Object left, Object right) {
		return new BinaryExpression(BinaryOperator.LT, auto(left), auto(right));
	}

	public Expression ge(Object left, Object right) {
		return le(right, left);
	}

	public Expression gt(Object left, Object right) {
		return lt(right, left);
	}

	public Expression plus(Object... args) {
		return new NaryExpression(NaryOperator.PLUS, auto(Arrays.asList(args)));
	}

	public Expression times(Object... args) {
		return new NaryExpression(NaryOperator.TIMES, auto(Arrays.asList(args)));
	}

	public Expression minus(Object left, Object right) {
		return new BinaryExpression(BinaryOperator.MINUS, auto(left), auto(right));
	}

	public Expression div(Object left, Object right) {
		return new BinaryExpression(BinaryOperator.DIV, auto(left), auto(right));
	}

	public Expression exists(Object body, Variable... variables) {
		return new QuantifiedExpression(Quantifier.EXISTS, Arrays.asList(variables), auto(body));
	}

	public Expression forall(Object body, Variable... variables) {
		return new QuantifiedExpression(Quantifier.FORALL, Arrays.asList(variables), auto(body));
	}

	/**
	 * Builds the application of the given operator to the given arguments,
	 * folding degenerate conjunctions and disjunctions as
	 * {@link #and(Collection)} and {@link #or(Collection)} do.
	 */
	public Expression compose(NaryOperator op, List<Expression> args) {
		switch (op) {
		case AND:
			return and(args);
		case OR:
			return or(args);
		default:
			return args.size() == 1 ? args.get(0) : new NaryExpression(op, args);
		}
	}
}
