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
package plankit.ast;

import java.util.List;
import java.util.Objects;

import plankit.ast.operator.Quantifier;
import plankit.ast.visitor.ReturnVisitor;
import plankit.model.Type;
import plankit.model.Variable;

/**
 * A formula quantified over one or more variables, each ranging over the
 * objects of its type.
 */
public final class QuantifiedExpression extends Expression {

	private final Quantifier quantifier;
	private final List<Variable> variables;
	private final Expression body;

	public QuantifiedExpression(Quantifier quantifier, List<Variable> variables, Expression body) {
		if (variables.isEmpty())
			throw new IllegalArgumentException("A quantifier must bind at least one variable.");
		checkBoolean(body);
		this.quantifier = quantifier;
		this.variables = List.copyOf(variables);
		this.body = body;
	}

	public Quantifier quantifier() {
		return quantifier;
	}

	public List<Variable> variables() {
		return variables;
	}

	public Expression body() {
		return body;
	}

	@Override
	public List<Expression> args() {
		return List.of(body);
	}

	@Override
	public Type type() {
		return Type.BOOL;
	}

	@Override
	public boolean isQuantifier() {
		return true;
	}

	@Override
	public <T> T accept(ReturnVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof QuantifiedExpression))
			return false;
		QuantifiedExpression other = (QuantifiedExpression) o;
		return quantifier == other.quantifier && variables.equals(other.variables) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(quantifier, variables, body);
	}

	public String toString() {
		StringBuilder sb = new StringBuilder("(").append(quantifier);
		for (Variable v : variables)
			sb.append(' ').append(v.name()).append(" - ").append(v.type());
		return sb.append(" . ").append(body).append(')').toString();
	}
}
