package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Token;
import org.jaclang.ast.WalkerNode;

import java.util.List;

/**
 * An edge reference, {@code [-->]}, {@code [<--]} or {@code [<-->]}.
 */
public class EdgeOpRef extends AstNode implements WalkerNode
{
	private final Token edgeDir;
	private boolean fromWalker;

	public EdgeOpRef(List<? extends AstNode> kids, Token edgeDir)
	{
		super(kids);
		this.edgeDir = edgeDir;
	}

	public Token getEdgeDir()
	{
		return edgeDir;
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
		return visitor.visitEdgeOpRef(this);
	}
}
