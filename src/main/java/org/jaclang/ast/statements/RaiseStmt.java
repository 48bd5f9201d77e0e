package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

public class RaiseStmt extends AstNode
{
	private final AstNode cause;
	private final AstNode from;

	public RaiseStmt(List<? extends AstNode> kids, AstNode cause, AstNode from)
	{
		super(kids);
		this.cause = cause;
		this.from = from;
	}

	public AstNode getCause()
	{
		return cause;
	}

	public AstNode getFrom()
	{
		return from;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitRaiseStmt(this);
	}
}
