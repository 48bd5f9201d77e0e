package org.jaclang.ast;

import org.jaclang.semantic.symbol.Symbol;

/**
 * An identifier. Keyword-escaped names ({@code <>obj}) keep their escape in the
 * source value but declare and resolve under the bare identifier.
 */
public class Name extends Token implements AstSymbolNode
{
	private final boolean kwesc;
	private boolean deleted;
	private Symbol symbol;

	public Name(String kind, String value, SourceLocation location)
	{
		super(kind, value, location);
		this.kwesc = value.startsWith("<>");
	}

	/**
	 * Builds an implicit name (such as {@code self}) that points at its owner as parent
	 * without being one of the owner's kids.
	 */
	public static Name stub(AstNode owner, String value)
	{
		Name stub = new Name("NAME", value, owner.getLocation());
		stub.setParent(owner);
		return stub;
	}

	public boolean isKwesc()
	{
		return kwesc;
	}

	public boolean isDeleted()
	{
		return deleted;
	}

	public void markDeleted()
	{
		this.deleted = true;
	}

	@Override
	public String getSymName()
	{
		return kwesc ? getValue().substring(2) : getValue();
	}

	@Override
	public AstNode getNameSpec()
	{
		return this;
	}

	@Override
	public Symbol getSymbol()
	{
		return symbol;
	}

	@Override
	public void setSymbol(Symbol symbol)
	{
		this.symbol = symbol;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitName(this);
	}
}
