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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import plankit.ast.BinaryExpression;
import plankit.ast.BooleanConstant;
import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.ast.FluentExpression;
import plankit.ast.NaryExpression;
import plankit.ast.NotExpression;
import plankit.ast.NumberConstant;
import plankit.ast.ObjectExpression;
import plankit.ast.ParameterExpression;
import plankit.ast.QuantifiedExpression;
import plankit.ast.VariableExpression;

/**
 * A depth first replacer. The default implementation rebuilds a node only
 * if one of its children was replaced, and returns the node itself
 * otherwise. Replacements are cached, so a sub-tree shared by several parents
 * is only visited once.
 */
public abstract class AbstractReplacer implements ReturnVisitor<Expression> {

	protected final ExpressionManager manager;
	protected final Map<Expression,Expression> cache = new HashMap<Expression,Expression>();

	protected AbstractReplacer(ExpressionManager manager) {
		this.manager = manager;
	}

	/**
	 * Caches the replacement of the given node and returns it.
	 */
	protected Expression cache(Expression node, Expression replacement) {
		cache.put(node, replacement);
		return replacement;
	}

	/**
	 * Returns the cached replacement of the given node, if any.
	 */
	protected Expression lookup(Expression node) {
		return cache.get(node);
	}

	protected List<Expression> visitAll(List<Expression> args) {
		List<Expression> res = new ArrayList<Expression>(args.size());
		for (Expression arg : args)
			res.add(arg.accept(this));
		return res;
	}

	public Expression visit(BooleanConstant constant) {
		return constant;
	}

	public Expression visit(NumberConstant constant) {
		return constant;
	}

	public Expression visit(ParameterExpression paramExp) {
		return paramExp;
	}

	public Expression visit(ObjectExpression objectExp) {
		return objectExp;
	}

	public Expression visit(VariableExpression varExp) {
		return varExp;
	}

	public Expression visit(FluentExpression fluentExp) {
		Expression ret = lookup(fluentExp);
		if (ret != null)
			return ret;
		List<Expression> args = visitAll(fluentExp.args());
		ret = args.equals(fluentExp.args()) ? fluentExp : new FluentExpression(fluentExp.fluent(), args);
		return cache(fluentExp, ret);
	}

	public Expression visit(NotExpression not) {
		Expression ret = lookup(not);
		if (ret != null)
			return ret;
		Expression sub = not.formula().accept(this);
		ret = sub == not.formula() ? not : sub.not();
		return cache(not, ret);
	}

	public Expression visit(NaryExpression nary) {
		Expression ret = lookup(nary);
		if (ret != null)
			return ret;
		List<Expression> args = visitAll(nary.args());
		ret = args.equals(nary.args()) ? nary : manager.compose(nary.op(), args);
		return cache(nary, ret);
	}

	public Expression visit(BinaryExpression binary) {
		Expression ret = lookup(binary);
		if (ret != null)
			return ret;
		Expression l = binary.left().accept(this);
		Expression r = binary.right().accept(this);
		ret = l == binary.left() && r == binary.right() ? binary : new BinaryExpression(binary.op(), l, r);
		return cache(binary, ret);
	}

	public Expression visit(QuantifiedExpression quantified) {
		Expression ret = lookup(quantified);
		if (ret != null)
			return ret;
		Expression body = quantified.body().accept(this);
		ret = body == quantified.body() ? quantified
				: new QuantifiedExpression(quantified.quantifier(), quantified.variables(), body);
		return cache(quantified, ret);
	}
}
