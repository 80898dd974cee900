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

import java.util.HashSet;
import java.util.Set;

import plankit.model.Problem;

/**
 * Hands out names that are free in the namespace of one problem. A name
 * handed out is reserved, whether or not the element it was asked for ends
 * up in the problem, so two requests never get the same name.
 * 
 * A name is derived from its base by appending {@code _0}, {@code _1}, ...
 * until it is free; the base itself is used when it is free.
 */
public final class NameAllocator {

	private final Problem problem;
	private final Set<String> reserved = new HashSet<String>();

	public NameAllocator(Problem problem) {
		this.problem = problem;
	}

	public String fresh(String base) {
		String name = base;
		for (int count = 0; isTaken(name); count++)
			name = base + "_" + count;
		reserved.add(name);
		return name;
	}

	private boolean isTaken(String name) {
		return problem.hasName(name) || reserved.contains(name);
	}
}
