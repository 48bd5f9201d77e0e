package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.StringLiteral;

import java.util.List;

/**
 * Adjacent string literals, concatenated implicitly.
 */
public class MultiString extends AstNode
{
	private final List<StringLiteral> strings;

	public MultiString(List<? extends AstNode> kids, List<StringLiteral> strings)
	{
		super(kids);
		this.strings = List.copyOf(strings);
	}

	public List<StringLiteral> getStrings()
	{
		return strings;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMultiString(this);
	}
}
