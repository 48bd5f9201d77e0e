package org.jaclang.semantic.symbol;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of resolving a dotted chain. {@code symbols} has one entry per segment,
 * null from the first unresolved segment on. {@code failedScope} is the member scope
 * a segment was missing from, or null when the chain stopped because a symbol had no
 * member scope (or the head was not found).
 */
public record ChainResolution(List<Symbol> symbols, int firstUnresolved, Scope failedScope)
{
	public ChainResolution
	{
		symbols = Collections.unmodifiableList(symbols);
	}

	public boolean isComplete()
	{
		return firstUnresolved < 0;
	}

	public Symbol last()
	{
		return symbols.get(symbols.size() - 1);
	}

	public Symbol get(int index)
	{
		return symbols.get(index);
	}
}
