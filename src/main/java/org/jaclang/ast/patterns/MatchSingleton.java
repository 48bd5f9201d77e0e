package org.jaclang.ast.patterns;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Token;

import java.util.List;

/**
 * {@code None}, {@code True} or {@code False}, compared by identity.
 */
public class MatchSingleton extends AstNode
{
	private final Token value;

	public MatchSingleton(List<? extends AstNode> kids, Token value)
	{
		super(kids);
		this.value = value;
	}

	public Token getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMatchSingleton(this);
	}
}
