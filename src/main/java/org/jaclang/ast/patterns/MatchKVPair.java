package org.jaclang.ast.patterns;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;

import java.util.List;

public class MatchKVPair extends AstNode
{
	private final Name key;
	private final AstNode value;

	public MatchKVPair(List<? extends AstNode> kids, Name key, AstNode value)
	{
		super(kids);
		this.key = key;
		this.value = value;
	}

	public Name getKey()
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
		return visitor.visitMatchKVPair(this);
	}
}
