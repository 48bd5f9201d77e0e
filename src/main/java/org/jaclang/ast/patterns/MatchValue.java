package org.jaclang.ast.patterns;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * A literal or dotted value compared for equality, {@code case 1:} or {@code case Color.RED:}.
 */
public class MatchValue extends AstNode
{
	private final AstNode value;

	public MatchValue(List<? extends AstNode> kids, AstNode value)
	{
		super(kids);
		this.value = value;
	}

	public AstNode getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMatchValue(this);
	}
}
