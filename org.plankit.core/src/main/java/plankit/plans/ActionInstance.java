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

import java.util.List;
import java.util.Objects;

import plankit.ast.Expression;
import plankit.model.Action;

/**
 * An action applied to actual parameters, one per formal parameter.
 */
public final class ActionInstance {

	private final Action action;
	private final List<Expression> actualParameters;

	public ActionInstance(Action action) {
		this(action, List.of());
	}

	public ActionInstance(Action action, List<Expression> actualParameters) {
		if (action.parameters().size() != actualParameters.size())
			throw new IllegalArgumentException("Action " + action.name() + " expects " + action.parameters().size()
					+ " parameters, got " + actualParameters.size());
		this.action = action;
		this.actualParameters = List.copyOf(actualParameters);
	}

	public Action action() {
		return action;
	}

	public List<Expression> actualParameters() {
		return actualParameters;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof ActionInstance))
			return false;
		ActionInstance other = (ActionInstance) o;
		return action == other.action && actualParameters.equals(other.actualParameters);
	}

	@Override
	public int hashCode() {
		return Objects.hash(System.identityHashCode(action), actualParameters);
	}

	public String toString() {
		if (actualParameters.isEmpty())
			return action.name();
		StringBuilder sb = new StringBuilder(action.name()).append('(');
		for (int i = 0; i < actualParameters.size(); i++) {
			if (i > 0)
				sb.append(", ");
			sb.append(actualParameters.get(i));
		}
		return sb.append(')').toString();
	}
}
