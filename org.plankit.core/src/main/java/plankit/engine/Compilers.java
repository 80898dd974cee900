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

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Finds the compilers available on the class path, registered as
 * {@link Compiler} services.
 */
public final class Compilers {

	private Compilers() {}

	/** @return every registered compiler, in service loading order. */
	public static List<Compiler> all() {
		List<Compiler> res = new ArrayList<Compiler>();
		for (Compiler c : ServiceLoader.load(Compiler.class))
			res.add(c);
		return res;
	}

	/**
	 * Returns the first registered compiler that supports the given
	 * compilation kind.
	 * 
	 * @throws UsageException
	 *             if no registered compiler supports it.
	 */
	public static Compiler forKind(CompilationKind kind) {
		for (Compiler c : ServiceLoader.load(Compiler.class))
			if (c.supportsCompilation(kind))
				return c;
		throw new UsageException("No compiler available for " + kind);
	}
}
