package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

public class MatchStmt extends AstNode
{
	private final AstNode target;
	private final SubNodeList<MatchCase> cases;

	public MatchStmt(List<? extends AstNode> kids, AstNode target, SubNodeList<MatchCase> cases)
	{
		super(kids);
		this.target = target;
		this.cases = cases;
	}

	public AstNode getTarget()
	{
		return target;
	}

	public SubNodeList<MatchCase> getCases()
	{
		return cases;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMatchStmt(this);
	}
}
