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

import org.junit.Test;

import plankit.model.Fluent;
import plankit.model.InstantaneousAction;
import plankit.model.Problem;
import plankit.model.Type;

public class NameAllocatorTest {

	@Test
	public void testFreeBaseIsKept() {
		NameAllocator names = new NameAllocator(new Problem("p"));
		assertEquals("move", names.fresh("move"));
	}

	@Test
	public void testHandedOutNamesAreReserved() {
		NameAllocator names = new NameAllocator(new Problem("p"));
		assertEquals("move", names.fresh("move"));
		assertEquals("move_0", names.fresh("move"));
		assertEquals("move_1", names.fresh("move"));
	}

	@Test
	public void testProblemNamespace() {
		Problem p = new Problem("p");
		p.addFluent(new Fluent("goal"));
		p.addObject("move", Type.userType("thing"));
		p.addAction(new InstantaneousAction("move_0", p.manager()));
		NameAllocator names = new NameAllocator(p);
		assertEquals("goal_0", names.fresh("goal"));
		assertEquals("move_1", names.fresh("move"));
		assertEquals("thing_0", names.fresh("thing"));
	}

	@Test
	public void testNamesAddedAfterwardsAreSeen() {
		Problem p = new Problem("p");
		NameAllocator names = new NameAllocator(p);
		p.addFluent(new Fluent("flag"));
		assertEquals("flag_0", names.fresh("flag"));
	}
}
