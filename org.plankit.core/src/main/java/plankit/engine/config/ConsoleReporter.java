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

import plankit.model.Action;
import plankit.model.Fluent;
import plankit.model.Problem;
import plankit.model.TimeInterval;

/**
 * An implementation of the reporter interface that prints messages to the
 * standard output stream.
 */
public final class ConsoleReporter implements Reporter {

	private final boolean debug;

	public ConsoleReporter() {
		this(false);
	}

	/**
	 * @param debug
	 *            whether debug messages and compiled problems are printed.
	 */
	public ConsoleReporter(boolean debug) {
		this.debug = debug;
	}

	public void compiling(String compiler, String problem) {
		System.out.println(compiler + ": compiling " + problem + " ...");
	}

	public void splitAction(Action original, int variants) {
		if (variants == 0)
			System.out.println("  removed " + original.name() + " (unreachable or without effects)");
		else
			System.out.println("  split " + original.name() + " into " + variants + " action(s)");
	}

	public void eliminatedGoal(TimeInterval interval, Fluent flag, int witnesses) {
		System.out.println("  replaced " + (interval == null ? "goal" : "timed goal at " + interval) + " by "
				+ flag.name() + " with " + witnesses + " witness action(s)");
	}

	public void compiled(String compiler, Problem result) {
		if (debug)
			System.out.println(compiler + ": produced " + result);
	}

	public void warning(String message) {
		System.out.println("warning: " + message);
	}

	public void debug(String message) {
		if (debug)
			System.out.println(message);
	}

	public String toString() {
		return "ConsoleReporter";
	}
}
