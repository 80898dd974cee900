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
package plankit.model;

import java.util.List;
import java.util.Objects;

/**
 * A state variable: a name, a value type and a signature of typed
 * parameters.
 */
public final class Fluent {

	private final String name;
	private final Type type;
	private final List<Parameter> signature;

	/** Creates a boolean fluent without parameters. */
	public Fluent(String name) {
		this(name, Type.BOOL, List.of());
	}

	public Fluent(String name, Type type) {
		this(name, type, List.of());
	}

	public Fluent(String name, Type type, List<Parameter> signature) {
		this.name = Objects.requireNonNull(name);
		this.type = Objects.requireNonNull(type);
		this.signature = List.copyOf(signature);
	}

	public String name() {
		return name;
	}

	public Type type() {
		return type;
	}

	public List<Parameter> signature() {
		return signature;
	}

	public int arity() {
		return signature.size();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Fluent))
			return false;
		Fluent other = (Fluent) o;
		return name.equals(other.name) && type.equals(other.type) && signature.equals(other.signature);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	public String toString() {
		return type + " " + name + (signature.isEmpty() ? "" : signature.toString());
	}
}
