package org.jaclang.ast;

import org.jaclang.semantic.symbol.Symbol;

/**
 * A literal token. Literals resolve through the name of their builtin type, so
 * {@code 5} is a use of {@code int} wherever that name is declared.
 */
public abstract class Literal extends Token implements AstSymbolNode
{
	private Symbol symbol;

	protected Literal(String kind, String value, SourceLocation location)
	{
		super(kind, value, location);
	}

	public abstract String getTypeName();

	@Override
	public String getSymName()
	{
		return getTypeName();
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
		return visitor.visitLiteral(this);
	}
}
