package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstSymbolNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.semantic.symbol.Symbol;

import java.util.List;

/**
 * {@code y as z} inside {@code import from a { ... }}.
 */
public class ModuleItem extends AstNode implements AstSymbolNode
{
	private final Name name;
	private final Name alias;

	public ModuleItem(List<? extends AstNode> kids, Name name, Name alias)
	{
		super(kids);
		this.name = name;
		this.alias = alias;
	}

	public Name getName()
	{
		return name;
	}

	public Name getAlias()
	{
		return alias;
	}

	@Override
	public String getSymName()
	{
		return getNameSpec().getSymName();
	}

	@Override
	public Name getNameSpec()
	{
		return alias != null ? alias : name;
	}

	@Override
	public Symbol getSymbol()
	{
		return getNameSpec().getSymbol();
	}

	@Override
	public void setSymbol(Symbol symbol)
	{
		getNameSpec().setSymbol(symbol);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitModuleItem(this);
	}
}
