package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

public class IfStmt extends AstNode
{
	private final AstNode condition;
	private final SubNodeList<AstNode> body;
	private final AstNode elseBody;

	public IfStmt(List<? extends AstNode> kids, AstNode condition, SubNodeList<AstNode> body, AstNode elseBody)
	{
		super(kids);
		this.condition = condition;
		this.body = body;
		this.elseBody = elseBody;
	}

	public AstNode getCondition()
	{
		return condition;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	/**
	 * An {@link ElseIf}, an {@link ElseStmt} or null.
	 */
	public AstNode getElseBody()
	{
		return elseBody;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitIfStmt(this);
	}
}
