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
package plankit.engine;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import plankit.ast.BinaryExpression;
import plankit.ast.BooleanConstant;
import plankit.ast.Expression;
import plankit.ast.FluentExpression;
import plankit.ast.NaryExpression;
import plankit.ast.NotExpression;
import plankit.ast.NumberConstant;
import plankit.ast.ObjectExpression;
import plankit.ast.ParameterExpression;
import plankit.ast.QuantifiedExpression;
import plankit.ast.VariableExpression;
import plankit.ast.operator.NaryOperator;
import plankit.ast.operator.Quantifier;
import plankit.ast.visitor.ReturnVisitor;
import plankit.model.Effect;
import plankit.model.Parameter;
import plankit.model.PlanObject;
import plankit.model.Problem;
import plankit.model.Type.UserType;
import plankit.model.Variable;
import plankit.util.CartesianProduct;

/**
 * Evaluates expressions in a state of a problem. A state gives the value of
 * some ground fluent expressions; the others take their initial value in the
 * problem. Action parameters are bound by the caller, quantified variables
 * range over the objects of the problem.
 */
public final class Evaluator {

	private final Problem problem;
	private final Map<FluentExpression,Expression> state;

	public Evaluator(Problem problem, Map<FluentExpression,Expression> state) {
		this.problem = problem;
		this.state = state;
	}

	/**
	 * Returns the value of a ground expression: a boolean, number or object
	 * constant.
	 */
	public Expression evaluate(Expression expression) {
		return evaluate(expression, Map.of());
	}

	public Expression evaluate(Expression expression, Map<Parameter,Expression> binding) {
		return expression.accept(new Visitor(binding));
	}

	public boolean holds(Expression condition, Map<Parameter,Expression> binding) {
		return evaluate(condition, binding).isTrue();
	}

	/**
	 * Returns the assignments performed by the given effects in this state:
	 * the effects whose condition holds, with their values evaluated in this
	 * state. Increases and decreases are resolved against the current value.
	 */
	public Map<FluentExpression,Expression> apply(List<Effect> effects, Map<Parameter,Expression> binding) {
		Map<FluentExpression,Expression> res = new LinkedHashMap<FluentExpression,Expression>();
		Visitor v = new Visitor(binding);
		for (Effect e : effects) {
			if (!e.condition().accept(v).isTrue())
				continue;
			FluentExpression target = v.ground(e.fluent());
			Expression value = e.value().accept(v);
			if (e.isIncrease())
				value = arithmetic(true, target.accept(v), value);
			else if (e.isDecrease())
				value = arithmetic(false, target.accept(v), value);
			res.put(target, value);
		}
		return res;
	}

	private static NumberConstant number(Expression e) {
		if (!(e instanceof NumberConstant))
			throw new IllegalArgumentException(e + " is not a number");
		return (NumberConstant) e;
	}

	private static Expression arithmetic(boolean add, Expression l, Expression r) {
		NumberConstant a = number(l), b = number(r);
		BigDecimal v = add ? a.value().add(b.value()) : a.value().subtract(b.value());
		return new NumberConstant(v, a.isInteger() && b.isInteger());
	}

	private final class Visitor implements ReturnVisitor<Expression> {
		private final Map<Parameter,Expression> params;
		private final Map<Variable,Expression> vars = new HashMap<Variable,Expression>();

		Visitor(Map<Parameter,Expression> params) {
			this.params = params;
		}

		FluentExpression ground(FluentExpression fluentExp) {
			List<Expression> args = new ArrayList<Expression>(fluentExp.args().size());
			for (Expression a : fluentExp.args())
				args.add(a.accept(this));
			return new FluentExpression(fluentExp.fluent(), args);
		}

		public Expression visit(BooleanConstant constant) {
			return constant;
		}

		public Expression visit(NumberConstant constant) {
			return constant;
		}

		public Expression visit(ObjectExpression objectExp) {
			return objectExp;
		}

		public Expression visit(FluentExpression fluentExp) {
			FluentExpression key = ground(fluentExp);
			Expression v = state.get(key);
			return v != null ? v : problem.initialValue(key);
		}

		public Expression visit(ParameterExpression paramExp) {
			Expression v = params.get(paramExp.parameter());
			if (v == null)
				throw new IllegalArgumentException("Parameter " + paramExp + " is not bound");
			return v;
		}

		public Expression visit(VariableExpression varExp) {
			Expression v = vars.get(varExp.variable());
			if (v == null)
				throw new IllegalArgumentException("Variable " + varExp + " is not bound");
			return v;
		}

		public Expression visit(NotExpression not) {
			return BooleanConstant.of(!not.formula().accept(this).isTrue());
		}

		public Expression visit(NaryExpression nary) {
			NaryOperator op = nary.op();
			if (op.isLogical()) {
				boolean and = op == NaryOperator.AND;
				for (Expression arg : nary.args())
					if (arg.accept(this).isTrue() != and)
						return BooleanConstant.of(!and);
				return BooleanConstant.of(and);
			}
			BigDecimal v = op == NaryOperator.PLUS ? BigDecimal.ZERO : BigDecimal.ONE;
			boolean integer = true;
			for (Expression arg : nary.args()) {
				NumberConstant c = number(arg.accept(this));
				v = op == NaryOperator.PLUS ? v.add(c.value()) : v.multiply(c.value());
				integer &= c.isInteger();
			}
			return new NumberConstant(v, integer);
		}

		public Expression visit(BinaryExpression binary) {
			Expression l = binary.left().accept(this);
			switch (binary.op()) {
			case IMPLIES:
				return l.isTrue() ? binary.right().accept(this) : BooleanConstant.TRUE;
			case IFF:
				return BooleanConstant.of(l.isTrue() == binary.right().accept(this).isTrue());
			default:
				break;
			}
			Expression r = binary.right().accept(this);
			switch (binary.op()) {
			case EQUALS:
				if (l instanceof NumberConstant && r instanceof NumberConstant)
					return BooleanConstant.of(number(l).value().compareTo(number(r).value()) == 0);
				return BooleanConstant.of(l.equals(r));
			case LE:
				return BooleanConstant.of(number(l).value().compareTo(number(r).value()) <= 0);
			case LT:
				return BooleanConstant.of(number(l).value().compareTo(number(r).value()) < 0);
			case MINUS:
				return arithmetic(false, l, r);
			case DIV:
				return new NumberConstant(number(l).value().divide(number(r).value(), MathContext.DECIMAL128), false);
			default:
				throw new IllegalStateException("Unexpected operator " + binary.op());
			}
		}

		public Expression visit(QuantifiedExpression quantified) {
			List<Variable> variables = quantified.variables();
			List<List<PlanObject>> domains = new ArrayList<List<PlanObject>>();
			for (Variable v : variables) {
				if (!v.type().isUserType())
					throw new IllegalArgumentException("Cannot quantify over " + v.type());
				domains.add(problem.objects((UserType) v.type()));
			}
			boolean exists = quantified.quantifier() == Quantifier.EXISTS;
			for (List<PlanObject> tuple : new CartesianProduct<PlanObject>(domains)) {
				for (int i = 0; i < variables.size(); i++)
					vars.put(variables.get(i), new ObjectExpression(tuple.get(i)));
				boolean holds = quantified.body().accept(this).isTrue();
				for (Variable v : variables)
					vars.remove(v);
				if (holds == exists)
					return BooleanConstant.of(exists);
			}
			return BooleanConstant.of(!exists);
		}
	}
}
