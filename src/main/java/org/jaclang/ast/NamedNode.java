package org.jaclang.ast;

import org.jaclang.semantic.symbol.Symbol;

import java.util.List;

/**
 * A node declared under a single {@link Name}; the symbol link lives on that name.
 */
public abstract class NamedNode extends AstNode implements AstSymbolNode
{
	private final Name name;

	protected NamedNode(List<? extends AstNode> kids, Name name)
	{
		super(kids);
		this.name = name;
	}

	public Name getName()
	{
		return name;
	}

	@Override
	public String getSymName()
	{
		return name.getSymName();
	}

	@Override
	public Name getNameSpec()
	{
		return name;
	}

	@Override
	public Symbol getSymbol()
	{
		return name.getSymbol();
	}

	@Override
	public void setSymbol(Symbol symbol)
	{
		name.setSymbol(symbol);
	}
}
