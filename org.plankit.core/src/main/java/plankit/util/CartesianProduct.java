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
package plankit.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The cartesian product of a list of lists, enumerated lazily. Each call to
 * {@link #iterator()} starts a new enumeration over an index vector, so no
 * tuple is built before it is requested. The last factor varies fastest.
 * 
 * The product of no factors has a single, empty tuple; the product with an
 * empty factor has no tuple.
 *
 * @param <T>
 *            the type of the tuple elements.
 */
public final class CartesianProduct<T> implements Iterable<List<T>> {

	private final List<List<T>> factors;

	public CartesianProduct(List<? extends List<T>> factors) {
		this.factors = new ArrayList<List<T>>(factors);
	}

	/** @return the number of tuples, saturated at {@link Long#MAX_VALUE}. */
	public long size() {
		long size = 1;
		for (List<T> f : factors) {
			if (f.isEmpty())
				return 0;
			if (size > Long.MAX_VALUE / f.size())
				return Long.MAX_VALUE;
			size *= f.size();
		}
		return size;
	}

	@Override
	public Iterator<List<T>> iterator() {
		return new Iterator<List<T>>() {
			private final int[] index = new int[factors.size()];
			private boolean hasNext = size() > 0;

			@Override
			public boolean hasNext() {
				return hasNext;
			}

			@Override
			public List<T> next() {
				if (!hasNext)
					throw new NoSuchElementException();
				List<T> tuple = new ArrayList<T>(index.length);
				for (int i = 0; i < index.length; i++)
					tuple.add(factors.get(i).get(index[i]));
				advance();
				return tuple;
			}

			private void advance() {
				for (int i = index.length - 1; i >= 0; i--) {
					if (++index[i] < factors.get(i).size())
						return;
					index[i] = 0;
				}
				hasNext = false;
			}
		};
	}
}
