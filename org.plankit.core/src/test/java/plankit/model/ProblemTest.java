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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import plankit.ast.ExpressionManager;
import plankit.ast.FluentExpression;

public class ProblemTest {

	private Problem problem;
	private ExpressionManager em;
	private FluentExpression a;

	@Before
	public void setUp() {
		problem = new Problem("p");
		em = problem.manager();
		problem.addFluent(new Fluent("a"), false);
		a = em.fluentExp(problem.fluent("a"));
	}

	@Test(expected = ProblemDefinitionException.class)
	public void testSharedNamespace() {
		problem.addAction(new InstantaneousAction("a", em));
	}

	@Test(expected = ProblemDefinitionException.class)
	public void testEffectOnNonFluent() {
		new InstantaneousAction("act", em).addEffect(em.TRUE(), true);
	}

	@Test(expected = ProblemDefinitionException.class)
	public void testEffectTypeMismatch() {
		new InstantaneousAction("act", em).addEffect(a, 3);
	}

	@Test(expected = ProblemDefinitionException.class)
	public void testInitialValueOfUnknownFluent() {
		problem.setInitialValue(new Fluent("b"), true);
	}

	@Test
	public void testInitialValues() {
		assertSame(em.FALSE(), problem.initialValue(a));
		problem.setInitialValue(a, true);
		assertSame(em.TRUE(), problem.initialValue(a));
	}

	@Test
	public void testTrivialGoalsAreIgnored() {
		problem.addGoal(true);
		problem.addTimedGoal(Timing.GLOBAL_END, em.TRUE());
		assertTrue(problem.goals().isEmpty());
		assertTrue(problem.timedGoals().isEmpty());
		problem.addGoal(a);
		assertEquals(List.of(a), problem.goals());
	}

	@Test
	public void testCopyIsIndependent() {
		InstantaneousAction act = new InstantaneousAction("act", em);
		act.addEffect(a, true);
		problem.addAction(act);
		problem.addGoal(a);
		Problem copy = problem.copy();
		assertSame(em, copy.manager());
		assertNotSame(act, copy.action("act"));
		((InstantaneousAction) copy.action("act")).addPrecondition(a);
		copy.clearGoals();
		assertTrue(act.preconditions().isEmpty());
		assertEquals(List.of(a), problem.goals());
	}

	@Test
	public void testDurativeSnapshots() {
		DurativeAction da = new DurativeAction("da", em);
		da.addEffect(Timing.START, a, true);
		da.addEffect(Timing.END, a, false);
		da.addCondition(Timing.START, em.TRUE());
		assertTrue(da.conditions().isEmpty());
		for (Timing t : da.effects().keySet())
			da.addEffect(t, a, true, a);
		assertEquals(4, da.allEffects().size());
		assertEquals(List.of(Timing.START, Timing.END), List.copyOf(da.effects().keySet()));
	}
}
