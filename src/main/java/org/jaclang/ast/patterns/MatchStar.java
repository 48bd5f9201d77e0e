package org.jaclang.ast.patterns;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;

import java.util.List;

/**
 * {@code *rest} inside a sequence pattern; binds the remaining items.
 */
public class MatchStar extends AstNode
{
	private final Name name;

	public MatchStar(List<? extends AstNode> kids, Name name)
	{
		super(kids);
		this.name = name;
	}

	public Name getName()
	{
		return name;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMatchStar(this);
	}
}
