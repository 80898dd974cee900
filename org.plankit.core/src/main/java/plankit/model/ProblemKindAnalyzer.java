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

import java.util.List;

import plankit.ast.BinaryExpression;
import plankit.ast.Expression;
import plankit.ast.FluentExpression;
import plankit.ast.NaryExpression;
import plankit.ast.NotExpression;
import plankit.ast.QuantifiedExpression;
import plankit.ast.operator.BinaryOperator;
import plankit.ast.operator.NaryOperator;
import plankit.ast.operator.Quantifier;
import plankit.ast.visitor.AbstractVoidVisitor;
import plankit.model.ProblemKind.Feature;
import plankit.model.Type.UserType;

/**
 * Computes the {@link ProblemKind} of a problem. Conditions are inspected
 * with their polarity, so that a disjunction under a negation counts as a
 * conjunction and a negated conjunction counts as a disjunction.
 */
final class ProblemKindAnalyzer extends AbstractVoidVisitor {

	private final Problem problem;
	private final ProblemKind kind = new ProblemKind();
	private boolean negated = false;
	private boolean numeric = false;
	private boolean nonLinear = false;

	ProblemKindAnalyzer(Problem problem) {
		this.problem = problem;
	}

	ProblemKind analyze() {
		kind.set(Feature.ACTION_BASED);
		for (UserType t : problem.userTypes()) {
			kind.set(Feature.FLAT_TYPING);
			if (t.father() != null)
				kind.set(Feature.HIERARCHICAL_TYPING);
		}
		for (Fluent f : problem.fluents()) {
			Type t = f.type();
			if (t.isNumeric())
				kind.set(Feature.NUMERIC_FLUENTS);
			if (t.isIntType())
				kind.set(Feature.DISCRETE_NUMBERS);
			if (t.isRealType())
				kind.set(Feature.CONTINUOUS_NUMBERS);
			if (t.isUserType())
				kind.set(Feature.OBJECT_FLUENTS);
		}
		for (Action a : problem.actions()) {
			for (Expression c : a.allConditions())
				condition(c);
			for (Effect e : a.allEffects())
				effect(e);
			if (a instanceof DurativeAction)
				durative((DurativeAction) a);
		}
		for (Expression g : problem.goals())
			condition(g);
		for (List<Expression> gl : problem.timedGoals().values()) {
			kind.set(Feature.TIMED_GOALS, Feature.CONTINUOUS_TIME);
			for (Expression g : gl)
				condition(g);
		}
		for (QualityMetric m : problem.qualityMetrics())
			kind.set(m.feature());
		if (nonLinear)
			kind.set(Feature.GENERAL_NUMERIC_PLANNING);
		else if (numeric)
			kind.set(Feature.SIMPLE_NUMERIC_PLANNING);
		return kind;
	}

	private void condition(Expression c) {
		negated = false;
		c.accept(this);
	}

	private void effect(Effect e) {
		if (e.isConditional()) {
			kind.set(Feature.CONDITIONAL_EFFECTS);
			condition(e.condition());
		}
		if (e.isIncrease())
			kind.set(Feature.INCREASE_EFFECTS);
		if (e.isDecrease())
			kind.set(Feature.DECREASE_EFFECTS);
		if (e.fluent().type().isNumeric()) {
			numeric = true;
			e.value().accept(this);
		}
	}

	private void durative(DurativeAction a) {
		kind.set(Feature.CONTINUOUS_TIME);
		if (!a.duration().isFixed())
			kind.set(Feature.DURATION_INEQUALITIES);
		for (TimeInterval i : a.conditions().keySet())
			if (!isActionSpan(i))
				kind.set(Feature.INTERMEDIATE_CONDITIONS_AND_EFFECTS);
		for (Timing t : a.effects().keySet())
			if (!t.isActionBoundary())
				kind.set(Feature.INTERMEDIATE_CONDITIONS_AND_EFFECTS);
	}

	private static boolean isActionSpan(TimeInterval i) {
		if (!i.lower().isActionBoundary() || !i.upper().isActionBoundary())
			return false;
		return i.isPoint() || (i.lower().equals(Timing.START) && i.upper().equals(Timing.END));
	}

	@Override
	public Void visit(FluentExpression fluentExp) {
		if (negated && fluentExp.type().isBoolType())
			kind.set(Feature.NEGATIVE_CONDITIONS);
		return super.visit(fluentExp);
	}

	@Override
	public Void visit(NotExpression not) {
		negated = !negated;
		not.formula().accept(this);
		negated = !negated;
		return null;
	}

	@Override
	public Void visit(NaryExpression nary) {
		if ((nary.op() == NaryOperator.OR && !negated) || (nary.op() == NaryOperator.AND && negated))
			kind.set(Feature.DISJUNCTIVE_CONDITIONS);
		if (nary.op() == NaryOperator.TIMES && countNonConstant(nary.args()) > 1)
			nonLinear = true;
		return super.visit(nary);
	}

	@Override
	public Void visit(BinaryExpression binary) {
		switch (binary.op()) {
		case IMPLIES:
			if (!negated)
				kind.set(Feature.DISJUNCTIVE_CONDITIONS);
			negated = !negated;
			binary.left().accept(this);
			negated = !negated;
			binary.right().accept(this);
			return null;
		case IFF:
			kind.set(Feature.DISJUNCTIVE_CONDITIONS, Feature.NEGATIVE_CONDITIONS);
			return super.visit(binary);
		case EQUALS:
			if (binary.left().type().isNumeric())
				numeric = true;
			else
				kind.set(Feature.EQUALITY);
			if (negated)
				kind.set(Feature.NEGATIVE_CONDITIONS);
			return super.visit(binary);
		case LE:
		case LT:
			numeric = true;
			return super.visit(binary);
		default:
			if (binary.op() == BinaryOperator.DIV && !binary.right().isConstant())
				nonLinear = true;
			return super.visit(binary);
		}
	}

	@Override
	public Void visit(QuantifiedExpression quantified) {
		Quantifier q = negated ? quantified.quantifier().dual() : quantified.quantifier();
		kind.set(q == Quantifier.EXISTS ? Feature.EXISTENTIAL_CONDITIONS : Feature.UNIVERSAL_CONDITIONS);
		return super.visit(quantified);
	}

	private static int countNonConstant(List<Expression> args) {
		int n = 0;
		for (Expression e : args)
			if (!e.isConstant())
				n++;
		return n;
	}
}
