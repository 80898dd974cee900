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
import static org.junit.Assert.assertSame;

import org.junit.Before;
import org.junit.Test;

import plankit.ast.BooleanConstant;
import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.ast.NumberConstant;
import plankit.model.Fluent;
import plankit.model.Problem;
import plankit.model.Type;

public class SimplifierTest {

	private ExpressionManager em;
	private Simplifier simplifier;
	private Expression a, b, x;

	@Before
	public void setUp() {
		Problem p = new Problem("simplify");
		p.addFluent(new Fluent("a"), false);
		p.addFluent(new Fluent("b"), false);
		p.addFluent(new Fluent("x", Type.INT), 0);
		em = p.manager();
		simplifier = new Simplifier(em);
		a = em.fluentExp(p.fluent("a"));
		b = em.fluentExp(p.fluent("b"));
		x = em.fluentExp(p.fluent("x"));
	}

	@Test
	public void testConstantsInConnectives() {
		assertEquals(a, simplifier.simplify(em.and(a, em.TRUE())));
		assertSame(BooleanConstant.FALSE, simplifier.simplify(em.and(a, em.FALSE())));
		assertEquals(a, simplifier.simplify(em.or(em.FALSE(), a)));
		assertSame(BooleanConstant.TRUE, simplifier.simplify(em.or(a, em.TRUE())));
		assertSame(BooleanConstant.TRUE, simplifier.simplify(em.and(em.TRUE(), em.TRUE())));
	}

	@Test
	public void testComplementaryLiterals() {
		assertSame(BooleanConstant.FALSE, simplifier.simplify(em.and(a, b, em.not(a))));
		assertSame(BooleanConstant.TRUE, simplifier.simplify(em.or(em.not(b), b)));
	}

	@Test
	public void testFlattenAndDeduplicate() {
		assertEquals(em.and(a, b), simplifier.simplify(em.and(a, em.and(b, a))));
		assertEquals(em.or(a, b), simplifier.simplify(em.or(em.or(a, b), em.or(b))));
		assertEquals(a, simplifier.simplify(em.and(a, a)));
	}

	@Test
	public void testNegation() {
		assertEquals(a, simplifier.simplify(em.not(em.not(a))));
		assertSame(BooleanConstant.FALSE, simplifier.simplify(em.not(em.TRUE())));
		assertEquals(em.not(a), simplifier.simplify(em.not(em.and(a, em.TRUE()))));
	}

	@Test
	public void testImplicationAndEquivalence() {
		assertSame(BooleanConstant.TRUE, simplifier.simplify(em.implies(em.FALSE(), a)));
		assertEquals(b, simplifier.simplify(em.implies(em.TRUE(), b)));
		assertEquals(em.not(a), simplifier.simplify(em.implies(a, em.FALSE())));
		assertSame(BooleanConstant.TRUE, simplifier.simplify(em.iff(a, a)));
		assertEquals(em.not(b), simplifier.simplify(em.iff(em.FALSE(), b)));
	}

	@Test
	public void testArithmetic() {
		assertEquals(NumberConstant.of(3), simplifier.simplify(em.plus(1, 2)));
		assertSame(BooleanConstant.TRUE, simplifier.simplify(em.equals(em.plus(1, 2), 3)));
		assertSame(BooleanConstant.TRUE, simplifier.simplify(em.le(1, 2)));
		assertSame(BooleanConstant.FALSE, simplifier.simplify(em.lt(2, 2)));
		assertEquals(x, simplifier.simplify(em.plus(x, 0)));
		assertEquals(NumberConstant.of(0), simplifier.simplify(em.times(x, 0)));
		assertEquals(x, simplifier.simplify(em.minus(x, 0)));
	}

	@Test
	public void testUnchangedIsSame() {
		Expression e = em.or(em.and(a, b), em.le(x, 3));
		assertSame(e, simplifier.simplify(e));
	}

	@Test
	public void testIdempotent() {
		Expression e = em.or(em.and(a, em.TRUE(), em.not(em.not(b))), em.and(em.le(x, em.plus(1, 1)), a));
		Expression once = simplifier.simplify(e);
		assertEquals(once, new Simplifier(em).simplify(once));
	}
}
