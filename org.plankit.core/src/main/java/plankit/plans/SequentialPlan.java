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
package plankit.plans;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A totally ordered sequence of action instances.
 */
public final class SequentialPlan {

	private final List<ActionInstance> actions;

	public SequentialPlan(List<ActionInstance> actions) {
		this.actions = List.copyOf(actions);
	}

	public List<ActionInstance> actions() {
		return actions;
	}

	/**
	 * Returns the plan obtained by replacing every action instance with its
	 * image under the given function. Instances mapped to null are dropped.
	 */
	public SequentialPlan replaceActionInstances(Function<ActionInstance,ActionInstance> replace) {
		List<ActionInstance> res = new ArrayList<ActionInstance>(actions.size());
		for (ActionInstance ai : actions) {
			ActionInstance r = replace.apply(ai);
			if (r != null)
				res.add(r);
		}
		return new SequentialPlan(res);
	}

	public String toString() {
		StringBuilder sb = new StringBuilder("SequentialPlan:");
		for (ActionInstance ai : actions)
			sb.append("\n    ").append(ai);
		return sb.toString();
	}
}
