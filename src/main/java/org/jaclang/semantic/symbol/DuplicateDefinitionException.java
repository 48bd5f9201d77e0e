package org.jaclang.semantic.symbol;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstSymbolNode;

/**
 * Thrown by {@link Scope#define} when a single-declaration name is declared twice
 * in the same scope. The scope is left unchanged.
 */
public class DuplicateDefinitionException extends RuntimeException
{
	private final transient Symbol existing;
	private final transient AstSymbolNode duplicate;

	public DuplicateDefinitionException(Symbol existing, AstSymbolNode duplicate, String label)
	{
		super(String.format("Name '%s' used for %s already declared at line %d", existing.getName(), label, existing.getDeclarationLine()));
		this.existing = existing;
		this.duplicate = duplicate;
	}

	public Symbol getExisting()
	{
		return existing;
	}

	public AstNode getDuplicateNode()
	{
		return duplicate.getNameSpec();
	}
}
