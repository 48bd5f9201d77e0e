package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

public class YieldStmt extends AstNode
{
	private final AstNode expr;
	private final boolean from;

	public YieldStmt(List<? extends AstNode> kids, AstNode expr, boolean from)
	{
		super(kids);
		this.expr = expr;
		this.from = from;
	}

	public AstNode getExpr()
	{
		return expr;
	}

	public boolean isFrom()
	{
		return from;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitYieldStmt(this);
	}
}
