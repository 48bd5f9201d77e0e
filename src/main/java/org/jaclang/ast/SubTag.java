package org.jaclang.ast;

import java.util.List;

/**
 * A colon-prefixed tag such as an access tag ({@code :priv}), a language tag
 * ({@code :py}) or a type annotation ({@code : int}).
 */
public class SubTag<T extends AstNode> extends AstNode
{
	private final T tag;

	public SubTag(List<? extends AstNode> kids, T tag)
	{
		super(kids);
		this.tag = tag;
	}

	public T getTag()
	{
		return tag;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitSubTag(this);
	}
}
