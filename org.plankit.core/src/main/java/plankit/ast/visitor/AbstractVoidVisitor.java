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
package plankit.ast.visitor;

import plankit.ast.BinaryExpression;
import plankit.ast.BooleanConstant;
import plankit.ast.Expression;
import plankit.ast.FluentExpression;
import plankit.ast.NaryExpression;
import plankit.ast.NotExpression;
import plankit.ast.NumberConstant;
import plankit.ast.ObjectExpression;
import plankit.ast.ParameterExpression;
import plankit.ast.QuantifiedExpression;
import plankit.ast.VariableExpression;

/**
 * A depth first traversal that visits every node and returns nothing.
 * Subclasses override the visit methods of the nodes they care about and
 * call the super implementation to keep descending.
 */
public abstract class AbstractVoidVisitor implements ReturnVisitor<Void> {

	protected void visitChildren(Expression node) {
		for (Expression arg : node.args())
			arg.accept(this);
	}

	public Void visit(BooleanConstant constant)      { return null; }
	public Void visit(NumberConstant constant)       { return null; }
	public Void visit(ParameterExpression paramExp)  { return null; }
	public Void visit(ObjectExpression objectExp)    { return null; }
	public Void visit(VariableExpression varExp)     { return null; }

	public Void visit(FluentExpression fluentExp) {
		visitChildren(fluentExp);
		return null;
	}

	public Void visit(NotExpression not) {
		visitChildren(not);
		return null;
	}

	public Void visit(NaryExpression nary) {
		visitChildren(nary);
		return null;
	}

	public Void visit(BinaryExpression binary) {
		visitChildren(binary);
		return null;
	}

	public Void visit(QuantifiedExpression quantified) {
		visitChildren(quantified);
		return null;
	}
}
