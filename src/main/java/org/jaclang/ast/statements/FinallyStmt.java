package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

public class FinallyStmt extends AstNode
{
	private final SubNodeList<AstNode> body;

	public FinallyStmt(List<? extends AstNode> kids, SubNodeList<AstNode> body)
	{
		super(kids);
		this.body = body;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitFinallyStmt(this);
	}
}
