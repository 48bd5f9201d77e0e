package org.jaclang.ast.patterns;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * {@code _}
 */
public class MatchWild extends AstNode
{
	public MatchWild(List<? extends AstNode> kids)
	{
		super(kids);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMatchWild(this);
	}
}
