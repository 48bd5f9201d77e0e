package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

public class DeleteStmt extends AstNode
{
	private final SubNodeList<AstNode> targets;

	public DeleteStmt(List<? extends AstNode> kids, SubNodeList<AstNode> targets)
	{
		super(kids);
		this.targets = targets;
	}

	public SubNodeList<AstNode> getTargets()
	{
		return targets;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitDeleteStmt(this);
	}
}
