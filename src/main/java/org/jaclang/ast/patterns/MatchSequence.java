package org.jaclang.ast.patterns;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * {@code [first, *rest]}
 */
public class MatchSequence extends AstNode
{
	private final List<AstNode> values;

	public MatchSequence(List<? extends AstNode> kids, List<AstNode> values)
	{
		super(kids);
		this.values = List.copyOf(values);
	}

	public List<AstNode> getValues()
	{
		return values;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMatchSequence(this);
	}
}
