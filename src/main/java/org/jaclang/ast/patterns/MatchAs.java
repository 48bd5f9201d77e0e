package org.jaclang.ast.patterns;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;

import java.util.List;

/**
 * A capture ({@code case x:}) or a pattern bound to a name ({@code case [a, b] as pair:}).
 */
public class MatchAs extends AstNode
{
	private final Name name;
	private final AstNode pattern;

	public MatchAs(List<? extends AstNode> kids, Name name, AstNode pattern)
	{
		super(kids);
		this.name = name;
		this.pattern = pattern;
	}

	public Name getName()
	{
		return name;
	}

	/**
	 * The bound pattern, null for a bare capture.
	 */
	public AstNode getPattern()
	{
		return pattern;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMatchAs(this);
	}
}
