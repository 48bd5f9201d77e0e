package org.jaclang.ast;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An ordered list of like nodes together with the separators and brackets around
 * them. {@link #getItems()} holds only the structural items.
 */
public class SubNodeList<T extends AstNode> extends AstNode
{
	private final List<T> items;

	public SubNodeList(List<? extends AstNode> kids, List<T> items)
	{
		super(kids);
		this.items = List.copyOf(items);
	}

	public List<T> getItems()
	{
		return Collections.unmodifiableList(items);
	}

	public boolean isEmpty()
	{
		return items.isEmpty();
	}

	public Optional<Token> getOpen()
	{
		if (!getKids().isEmpty() && getKids().get(0) instanceof Token token && isOpenBracket(token))
		{
			return Optional.of(token);
		}
		return Optional.empty();
	}

	public Optional<Token> getClose()
	{
		List<AstNode> kids = getKids();
		if (!kids.isEmpty() && kids.get(kids.size() - 1) instanceof Token token && isCloseBracket(token))
		{
			return Optional.of(token);
		}
		return Optional.empty();
	}

	/**
	 * True for brace-delimited statement blocks.
	 */
	public boolean isBlock()
	{
		return getOpen().map(t -> t.is("{")).orElse(false);
	}

	private static boolean isOpenBracket(Token token)
	{
		return token.is("{") || token.is("(") || token.is("[");
	}

	private static boolean isCloseBracket(Token token)
	{
		return token.is("}") || token.is(")") || token.is("]");
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitSubNodeList(this);
	}
}
