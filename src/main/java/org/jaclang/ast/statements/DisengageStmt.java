package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.WalkerNode;

import java.util.List;

public class DisengageStmt extends AstNode implements WalkerNode
{
	private boolean fromWalker;

	public DisengageStmt(List<? extends AstNode> kids)
	{
		super(kids);
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
		return visitor.visitDisengageStmt(this);
	}
}
