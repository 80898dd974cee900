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
 * A skeleton implementation of the {@link Reporter} interface. The default
 * implementation of each method has an empty body.
 */
public abstract class AbstractReporter implements Reporter {

	public void compiling(String compiler, String problem) {}

	public void splitAction(Action original, int variants) {}

	public void eliminatedGoal(TimeInterval interval, Fluent flag, int witnesses) {}

	public void compiled(String compiler, Problem result) {}

	public void warning(String message) {}

	public void debug(String message) {}
}
