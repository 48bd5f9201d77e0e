package org.jaclang.ast;

import org.jaclang.semantic.symbol.Symbol;

/**
 * Implemented by nodes that declare or reference a symbol. The name spec is the
 * node that carries the symbol link for the declaration (usually its {@link Name}).
 */
public interface AstSymbolNode
{
	String getSymName();

	AstNode getNameSpec();

	Symbol getSymbol();

	void setSymbol(Symbol symbol);
}
