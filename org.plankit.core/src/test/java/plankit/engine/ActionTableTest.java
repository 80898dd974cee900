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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.List;
import java.util.function.Function;

import org.junit.Before;
import org.junit.Test;

import plankit.ast.ExpressionManager;
import plankit.ast.ObjectExpression;
import plankit.model.Effect;
import plankit.model.Fluent;
import plankit.model.InstantaneousAction;
import plankit.model.Parameter;
import plankit.model.PlanObject;
import plankit.model.Type;
import plankit.model.Type.UserType;
import plankit.plans.ActionInstance;

public class ActionTableTest {

	private final ExpressionManager em = new ExpressionManager();
	private final UserType block = Type.userType("block");
	private InstantaneousAction pick, pick0, pick1, witness;
	private ActionTable table;

	@Before
	public void setUp() {
		pick = new InstantaneousAction("pick", em, new Parameter("b", block));
		pick0 = pick.copy("pick_0");
		pick1 = pick.copy("pick_1");
		witness = new InstantaneousAction("fake", em);
		table = new ActionTable();
	}

	@Test
	public void testHandles() {
		assertEquals(0, table.add(pick0, pick));
		assertEquals(1, table.add(witness, null));
		assertEquals(2, table.add(pick1, pick));
		assertEquals(3, table.size());
		assertSame(pick1, table.action(2));
		assertSame(pick, table.original(0));
		assertNull(table.original(1));
		assertEquals(2, table.handle(pick1));
		assertEquals(List.of(pick0, pick1), table.meaningfulActions());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDuplicateName() {
		table.add(pick0, pick);
		table.add(pick.copy("pick_0"), pick);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testHandleOfUnknownAction() {
		table.add(pick0, pick);
		table.handle(pick.copy("pick_0"));
	}

	@Test
	public void testTranslator() {
		table.add(pick0, pick);
		table.add(witness, null);
		Function<ActionInstance,ActionInstance> back = table.translator();
		ObjectExpression a = new ObjectExpression(new PlanObject("a", block));
		assertEquals(new ActionInstance(pick, List.of(a)), back.apply(new ActionInstance(pick0, List.of(a))));
		assertNull(back.apply(new ActionInstance(witness)));
	}

	@Test
	public void testTranslatorSurvivesInPlaceChanges() {
		table.add(pick0, pick);
		Function<ActionInstance,ActionInstance> back = table.translator();
		pick0.addPrecondition(em.fluentExp(new Fluent("free")));
		pick0.addEffect(new Effect(em.fluentExp(new Fluent("held")), em.TRUE()));
		ActionInstance ai = new ActionInstance(pick0, List.of(new ObjectExpression(new PlanObject("a", block))));
		assertSame(pick, back.apply(ai).action());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTranslatorIsASnapshot() {
		Function<ActionInstance,ActionInstance> back = table.translator();
		table.add(witness, null);
		back.apply(new ActionInstance(witness));
	}
}
