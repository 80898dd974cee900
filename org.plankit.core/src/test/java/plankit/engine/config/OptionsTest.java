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
package plankit.engine.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import plankit.ast.ExpressionManager;
import plankit.model.Fluent;
import plankit.model.InstantaneousAction;
import plankit.model.Problem;
import plankit.model.TimeInterval;
import plankit.model.Timing;

public class OptionsTest {

	private PrintStream out;
	private ByteArrayOutputStream buffer;

	@Before
	public void setUp() {
		out = System.out;
		buffer = new ByteArrayOutputStream();
		System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
	}

	@After
	public void tearDown() {
		System.setOut(out);
	}

	private String printed() {
		return buffer.toString(StandardCharsets.UTF_8);
	}

	@Test
	public void testDefaults() {
		Options options = new Options();
		assertFalse(options.skipChecks());
		assertTrue(options.errorOnFailedChecks());
		options.reporter().warning("ignored");
		assertEquals("", printed());
	}

	@Test
	public void testClone() {
		Options options = new Options();
		options.setReporter(new ConsoleReporter());
		options.setSkipChecks(true);
		Options copy = options.clone();
		assertNotSame(options, copy);
		assertSame(options.reporter(), copy.reporter());
		assertTrue(copy.skipChecks());
		copy.setErrorOnFailedChecks(false);
		assertTrue(options.errorOnFailedChecks());
	}

	@Test(expected = NullPointerException.class)
	public void testNullReporter() {
		new Options().setReporter(null);
	}

	@Test
	public void testConsoleReporter() {
		ConsoleReporter reporter = new ConsoleReporter();
		reporter.splitAction(new InstantaneousAction("move", new ExpressionManager()), 0);
		reporter.eliminatedGoal(TimeInterval.at(Timing.GLOBAL_END), new Fluent("flag"), 2);
		reporter.debug("hidden");
		String s = printed();
		assertTrue(s.contains("removed move"));
		assertTrue(s.contains("by flag with 2 witness action(s)"));
		assertFalse(s.contains("hidden"));

		new ConsoleReporter(true).debug("shown");
		assertTrue(printed().contains("shown"));
	}

	@Test
	public void testCompiledProblemRenderedOnlyInDebug() {
		final int[] rendered = { 0 };
		Problem result = new Problem("dcrm_p") {
			@Override
			public String toString() {
				rendered[0]++;
				return "problem name = dcrm_p";
			}
		};
		new ConsoleReporter().compiled("dcrm", result);
		assertEquals(0, rendered[0]);
		assertEquals("", printed());

		new ConsoleReporter(true).compiled("dcrm", result);
		assertEquals(1, rendered[0]);
		assertTrue(printed().contains("dcrm: produced problem name = dcrm_p"));
	}
}
