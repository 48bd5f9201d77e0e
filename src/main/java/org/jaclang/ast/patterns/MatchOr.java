package org.jaclang.ast.patterns;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

public class MatchOr extends AstNode
{
	private final List<AstNode> patterns;

	public MatchOr(List<? extends AstNode> kids, List<AstNode> patterns)
	{
		super(kids);
		this.patterns = List.copyOf(patterns);
	}

	public List<AstNode> getPatterns()
	{
		return patterns;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMatchOr(this);
	}
}
