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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.ast.FluentExpression;
import plankit.ast.NotExpression;
import plankit.engine.Evaluator;
import plankit.model.Fluent;
import plankit.model.Problem;

/**
 * Checks that the disjunctive normal form of a formula is equivalent to it
 * in every state over four boolean fluents, and is an OR of ANDs of
 * literals.
 */
@RunWith(Parameterized.class)
public class DnfTest {

	private static final Problem problem = new Problem("dnf");
	private static final ExpressionManager em = problem.manager();
	private static final FluentExpression a, b, c, d;

	static {
		for (String n : new String[] { "a", "b", "c", "d" })
			problem.addFluent(new Fluent(n), false);
		a = em.fluentExp(problem.fluent("a"));
		b = em.fluentExp(problem.fluent("b"));
		c = em.fluentExp(problem.fluent("c"));
		d = em.fluentExp(problem.fluent("d"));
	}

	@Rule
	public Timeout globalTimeout = Timeout.seconds(10);

	private final Expression formula;
	private final int clauses;

	public DnfTest(Expression formula, int clauses) {
		this.formula = formula;
		this.clauses = clauses;
	}

	@Parameters(name = "{0}")
	public static Collection<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ a,                                                      1 },
			{ em.not(a),                                              1 },
			{ em.and(a, b),                                           1 },
			{ em.or(em.and(a, b), c),                                 2 },
			{ em.and(em.or(a, b), em.or(c, d)),                       4 },
			{ em.not(em.and(a, em.or(b, em.not(c)))),                 2 },
			{ em.implies(a, b),                                       2 },
			{ em.iff(a, b),                                           2 },
			{ em.not(em.iff(a, em.or(b, c))),                         3 },
			{ em.and(a, em.not(a)),                                   1 },
			{ em.not(em.implies(em.or(a, b), em.and(c, em.not(d)))), 4 },
			{ em.not(em.not(em.or(a, em.and(b, em.or(c, d))))),       3 },
		});
	}

	@Test
	public void testEquivalent() {
		Expression dnf = new Dnf(em).dnf(formula);
		for (int bits = 0; bits < 16; bits++) {
			Map<FluentExpression,Expression> state = new HashMap<FluentExpression,Expression>();
			state.put(a, em.bool((bits & 1) != 0));
			state.put(b, em.bool((bits & 2) != 0));
			state.put(c, em.bool((bits & 4) != 0));
			state.put(d, em.bool((bits & 8) != 0));
			Evaluator ev = new Evaluator(problem, state);
			assertEquals("state " + bits, ev.evaluate(formula), ev.evaluate(dnf));
		}
	}

	@Test
	public void testShape() {
		Expression dnf = new Dnf(em).dnf(formula);
		assertEquals(clauses, Dnf.disjuncts(dnf).size());
		for (Expression clause : Dnf.disjuncts(dnf)) {
			if (clause.isAnd()) {
				for (Expression l : clause.args())
					assertTrue(clause + " is not a conjunction of literals", isLiteral(l));
			} else {
				assertTrue(clause + " is not a literal", isLiteral(clause));
			}
		}
	}

	private static boolean isLiteral(Expression e) {
		return e.isFluentExp() || (e.isNot() && ((NotExpression) e).formula().isFluentExp());
	}
}
