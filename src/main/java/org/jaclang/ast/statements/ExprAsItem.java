package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * {@code open(f) as fh} in a with statement.
 */
public class ExprAsItem extends AstNode
{
	private final AstNode expr;
	private final AstNode alias;

	public ExprAsItem(List<? extends AstNode> kids, AstNode expr, AstNode alias)
	{
		super(kids);
		this.expr = expr;
		this.alias = alias;
	}

	public AstNode getExpr()
	{
		return expr;
	}

	public AstNode getAlias()
	{
		return alias;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitExprAsItem(this);
	}
}
