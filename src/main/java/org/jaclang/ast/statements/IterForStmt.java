package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

/**
 * {@code for i = 0 to i < 10 by i += 1 { ... }}
 */
public class IterForStmt extends AstNode
{
	private final Assignment iter;
	private final AstNode condition;
	private final Assignment count;
	private final SubNodeList<AstNode> body;

	public IterForStmt(List<? extends AstNode> kids, Assignment iter, AstNode condition, Assignment count, SubNodeList<AstNode> body)
	{
		super(kids);
		this.iter = iter;
		this.condition = condition;
		this.count = count;
		this.body = body;
	}

	public Assignment getIter()
	{
		return iter;
	}

	public AstNode getCondition()
	{
		return condition;
	}

	public Assignment getCount()
	{
		return count;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitIterForStmt(this);
	}
}
