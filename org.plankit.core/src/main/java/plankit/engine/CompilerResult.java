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

import java.util.function.Function;

import plankit.model.Problem;
import plankit.plans.ActionInstance;
import plankit.plans.SequentialPlan;

/**
 * The outcome of a compilation: the compiled problem, the function mapping
 * action instances of the compiled problem back to instances of the original
 * one, and the name of the compiler that produced it.
 */
public final class CompilerResult {

	private final Problem problem;
	private final Function<ActionInstance,ActionInstance> mapBack;
	private final String engineName;

	public CompilerResult(Problem problem, Function<ActionInstance,ActionInstance> mapBack, String engineName) {
		this.problem = problem;
		this.mapBack = mapBack;
		this.engineName = engineName;
	}

	public Problem problem() {
		return problem;
	}

	/**
	 * Returns the function mapping an action instance of the compiled problem
	 * to the corresponding instance of the original problem. Instances of
	 * actions without counterpart are mapped to null.
	 */
	public Function<ActionInstance,ActionInstance> mapBackActionInstance() {
		return mapBack;
	}

	public String engineName() {
		return engineName;
	}

	/**
	 * Translates a plan of the compiled problem into a plan of the original
	 * one, dropping the steps without counterpart.
	 */
	public SequentialPlan mapBack(SequentialPlan plan) {
		return plan.replaceActionInstances(mapBack);
	}
}
