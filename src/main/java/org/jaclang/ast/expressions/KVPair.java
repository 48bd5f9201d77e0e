package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * {@code key: value} in a dict, or {@code **mapping} when the key is null.
 */
public class KVPair extends AstNode
{
	private final AstNode key;
	private final AstNode value;

	public KVPair(List<? extends AstNode> kids, AstNode key, AstNode value)
	{
		super(kids);
		this.key = key;
		this.value = value;
	}

	public AstNode getKey()
	{
		return key;
	}

	public AstNode getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitKVPair(this);
	}
}
