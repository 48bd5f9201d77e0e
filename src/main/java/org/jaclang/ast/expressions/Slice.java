package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

public class Slice extends AstNode
{
	private final AstNode start;
	private final AstNode stop;
	private final AstNode step;

	public Slice(List<? extends AstNode> kids, AstNode start, AstNode stop, AstNode step)
	{
		super(kids);
		this.start = start;
		this.stop = stop;
		this.step = step;
	}

	public AstNode getStart()
	{
		return start;
	}

	public AstNode getStop()
	{
		return stop;
	}

	public AstNode getStep()
	{
		return step;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitSlice(this);
	}
}
