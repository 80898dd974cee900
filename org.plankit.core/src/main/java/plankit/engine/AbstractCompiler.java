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

import plankit.engine.config.Options;
import plankit.model.Problem;
import plankit.model.ProblemKind;

/**
 * A skeleton implementation of the {@link Compiler} interface that checks
 * the compilation kind and the problem features before delegating to
 * {@link #doCompile(Problem, CompilationKind)}.
 */
public abstract class AbstractCompiler implements Compiler {

	protected final Options options;

	protected AbstractCompiler(Options options) {
		if (options == null)
			throw new NullPointerException();
		this.options = options;
	}

	public Options options() {
		return options;
	}

	@Override
	public boolean supports(ProblemKind kind) {
		return kind.isSubsetOf(supportedKind());
	}

	@Override
	public final CompilerResult compile(Problem problem, CompilationKind compilationKind) {
		if (!supportsCompilation(compilationKind))
			throw new UsageException(name() + " cannot perform " + compilationKind);
		if (!options.skipChecks()) {
			ProblemKind kind = problem.kind();
			if (!supports(kind)) {
				String msg = name() + " cannot compile problem " + problem.name() + ", unsupported features: "
						+ unsupported(kind);
				if (options.errorOnFailedChecks())
					throw new UsageException(msg);
				options.reporter().warning(msg);
			}
		}
		options.reporter().compiling(name(), problem.name());
		return doCompile(problem, compilationKind);
	}

	private String unsupported(ProblemKind kind) {
		ProblemKind res = new ProblemKind(kind.features());
		for (ProblemKind.Feature f : supportedKind().features())
			res.unset(f);
		return res.toString();
	}

	/**
	 * Performs the compilation, once the checks have passed.
	 */
	protected abstract CompilerResult doCompile(Problem problem, CompilationKind compilationKind);
}
