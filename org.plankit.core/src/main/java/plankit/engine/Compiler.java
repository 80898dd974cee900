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

import plankit.model.Problem;
import plankit.model.ProblemKind;

/**
 * An engine that transforms a problem into an equivalent one, and maps the
 * actions of the result back to the actions of the input.
 * 
 * Implementations are looked up as services, see {@link Compilers}.
 */
public interface Compiler {

	/** @return the identifier of this compiler. */
	public String name();

	/** @return every feature this compiler accepts in its input. */
	public ProblemKind supportedKind();

	/** @return true if every feature of the given kind is supported. */
	public boolean supports(ProblemKind kind);

	public boolean supportsCompilation(CompilationKind compilationKind);

	/** @return the compilation kind used by {@link #compile(Problem)}. */
	public CompilationKind defaultCompilationKind();

	/**
	 * Returns the kind of the problem obtained by compiling a problem of the
	 * given kind.
	 */
	public ProblemKind resultingProblemKind(ProblemKind kind, CompilationKind compilationKind);

	/**
	 * Compiles the given problem. The given problem is not modified.
	 * 
	 * @throws UsageException
	 *             if the compilation kind is not supported, or if the problem
	 *             has unsupported features and failed checks are errors.
	 */
	public CompilerResult compile(Problem problem, CompilationKind compilationKind);

	public default CompilerResult compile(Problem problem) {
		return compile(problem, defaultCompilationKind());
	}
}
