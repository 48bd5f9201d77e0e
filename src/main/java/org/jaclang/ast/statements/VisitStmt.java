package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.WalkerNode;

import java.util.List;

/**
 * {@code visit [-->] else { ... }}
 */
public class VisitStmt extends AstNode implements WalkerNode
{
	private final AstNode target;
	private final ElseStmt elseBody;
	private boolean fromWalker;

	public VisitStmt(List<? extends AstNode> kids, AstNode target, ElseStmt elseBody)
	{
		super(kids);
		this.target = target;
		this.elseBody = elseBody;
	}

	public AstNode getTarget()
	{
		return target;
	}

	public ElseStmt getElseBody()
	{
		return elseBody;
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
		return visitor.visitVisitStmt(this);
	}
}
