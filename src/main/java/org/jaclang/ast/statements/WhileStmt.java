package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

public class WhileStmt extends AstNode
{
	private final AstNode condition;
	private final SubNodeList<AstNode> body;

	public WhileStmt(List<? extends AstNode> kids, AstNode condition, SubNodeList<AstNode> body)
	{
		super(kids);
		this.condition = condition;
		this.body = body;
	}

	public AstNode getCondition()
	{
		return condition;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitWhileStmt(this);
	}
}
