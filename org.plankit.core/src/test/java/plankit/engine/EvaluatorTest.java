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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import plankit.ast.BooleanConstant;
import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.ast.FluentExpression;
import plankit.ast.NumberConstant;
import plankit.ast.ObjectExpression;
import plankit.model.Fluent;
import plankit.model.InstantaneousAction;
import plankit.model.Parameter;
import plankit.model.PlanObject;
import plankit.model.Problem;
import plankit.model.Type;
import plankit.model.Type.UserType;
import plankit.model.Variable;

public class EvaluatorTest {

	private Problem problem;
	private ExpressionManager em;
	private UserType room;
	private PlanObject kitchen, hall;
	private Fluent clean, count;
	private Map<FluentExpression,Expression> state;

	@Before
	public void setUp() {
		problem = new Problem("rooms");
		em = problem.manager();
		room = Type.userType("room");
		kitchen = problem.addObject("kitchen", room);
		hall = problem.addObject("hall", room);
		clean = new Fluent("clean", Type.BOOL, List.of(new Parameter("r", room)));
		count = new Fluent("count", Type.INT);
		problem.addFluent(clean, false);
		problem.addFluent(count, 0);
		state = new HashMap<FluentExpression,Expression>();
	}

	@Test
	public void testInitialValuesAndState() {
		Evaluator ev = new Evaluator(problem, state);
		assertSame(BooleanConstant.FALSE, ev.evaluate(em.fluentExp(clean, kitchen)));
		state.put(em.fluentExp(clean, kitchen), em.TRUE());
		assertSame(BooleanConstant.TRUE, ev.evaluate(em.fluentExp(clean, kitchen)));
		assertSame(BooleanConstant.FALSE, ev.evaluate(em.fluentExp(clean, hall)));
		assertEquals(NumberConstant.of(2), ev.evaluate(em.plus(em.fluentExp(count), 2)));
	}

	@Test
	public void testQuantifiers() {
		Variable r = new Variable("r", room);
		Expression some = em.exists(em.fluentExp(clean, r), r);
		Expression every = em.forall(em.fluentExp(clean, r), r);
		Evaluator ev = new Evaluator(problem, state);
		assertFalse(ev.holds(some, Map.of()));
		state.put(em.fluentExp(clean, hall), em.TRUE());
		assertTrue(ev.holds(some, Map.of()));
		assertFalse(ev.holds(every, Map.of()));
		state.put(em.fluentExp(clean, kitchen), em.TRUE());
		assertTrue(ev.holds(every, Map.of()));
	}

	@Test
	public void testParameters() {
		Parameter p = new Parameter("r", room);
		Evaluator ev = new Evaluator(problem, state);
		state.put(em.fluentExp(clean, hall), em.TRUE());
		Expression cond = em.fluentExp(clean, p);
		assertTrue(ev.holds(cond, Map.of(p, new ObjectExpression(hall))));
		assertFalse(ev.holds(cond, Map.of(p, new ObjectExpression(kitchen))));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnboundParameter() {
		Parameter p = new Parameter("r", room);
		new Evaluator(problem, state).evaluate(em.fluentExp(clean, p));
	}

	@Test
	public void testApply() {
		Parameter p = new Parameter("r", room);
		InstantaneousAction mop = new InstantaneousAction("mop", em, p);
		mop.addEffect(em.fluentExp(clean, p), true);
		mop.addIncreaseEffect(count, 1);
		mop.addEffect(em.fluentExp(clean, kitchen), true, em.fluentExp(clean, hall));
		state.put(em.fluentExp(count), em.integer(4));

		Map<FluentExpression,Expression> done = new Evaluator(problem, state).apply(mop.effects(),
				Map.of(p, new ObjectExpression(hall)));
		assertEquals(2, done.size());
		assertSame(BooleanConstant.TRUE, done.get(em.fluentExp(clean, hall)));
		assertEquals(NumberConstant.of(5), done.get(em.fluentExp(count)));

		state.put(em.fluentExp(clean, hall), em.TRUE());
		done = new Evaluator(problem, state).apply(mop.effects(), Map.of(p, new ObjectExpression(hall)));
		assertEquals(3, done.size());
		assertSame(BooleanConstant.TRUE, done.get(em.fluentExp(clean, kitchen)));
	}
}
