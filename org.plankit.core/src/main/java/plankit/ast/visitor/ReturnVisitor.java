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
import plankit.ast.FluentExpression;
import plankit.ast.NaryExpression;
import plankit.ast.NotExpression;
import plankit.ast.NumberConstant;
import plankit.ast.ObjectExpression;
import plankit.ast.ParameterExpression;
import plankit.ast.QuantifiedExpression;
import plankit.ast.VariableExpression;

/**
 * A visitor that visits every node of an expression tree and returns a value
 * of type T.
 *
 * @param <T>
 *            the type of the values returned by the visit methods.
 */
public interface ReturnVisitor<T> {

	public T visit(BooleanConstant constant);

	public T visit(NumberConstant constant);

	public T visit(FluentExpression fluentExp);

	public T visit(ParameterExpression paramExp);

	public T visit(ObjectExpression objectExp);

	public T visit(VariableExpression varExp);

	public T visit(NotExpression not);

	public T visit(NaryExpression nary);

	public T visit(BinaryExpression binary);

	public T visit(QuantifiedExpression quantified);
}
