package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

public class AssertStmt extends AstNode
{
	private final AstNode condition;
	private final AstNode message;

	public AssertStmt(List<? extends AstNode> kids, AstNode condition, AstNode message)
	{
		super(kids);
		this.condition = condition;
		this.message = message;
	}

	public AstNode getCondition()
	{
		return condition;
	}

	public AstNode getMessage()
	{
		return message;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitAssertStmt(this);
	}
}
