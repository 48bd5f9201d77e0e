package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.WalkerNode;

import java.util.List;

public class IgnoreStmt extends AstNode implements WalkerNode
{
	private final AstNode target;
	private boolean fromWalker;

	public IgnoreStmt(List<? extends AstNode> kids, AstNode target)
	{
		super(kids);
		this.target = target;
	}

	public AstNode getTarget()
	{
		return target;
	}

	@Override
	public boolean isFromWalker()
	{
		return fromWalker;
	}

	@Override
	public void setFromWalker(boolean fromWalker)
	{
		this.fromWalker = fromWalker;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitIgnoreStmt(this);
	}
}
