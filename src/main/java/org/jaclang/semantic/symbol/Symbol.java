package org.jaclang.semantic.symbol;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstSymbolNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compile-time record of one declared name: its canonical declaration, any further
 * declaration sites, and every resolved use in order. Symbols are never removed.
 */
public class Symbol
{
	private final String name;
	private final SymbolKind kind;
	private final AccessModifier access;
	private final AstSymbolNode declaration;
	private final String singleDecl;
	private final Scope owner;
	private final List<AstSymbolNode> additionalDecls = new ArrayList<>();
	private final List<AstSymbolNode> uses = new ArrayList<>();
	private Scope memberScope;

	Symbol(String name, SymbolKind kind, AccessModifier access, AstSymbolNode declaration, String singleDecl, Scope owner)
	{
		this.name = name;
		this.kind = kind;
		this.access = access;
		this.declaration = declaration;
		this.singleDecl = singleDecl;
		this.owner = owner;
	}

	public String getName()
	{
		return name;
	}

	public SymbolKind getKind()
	{
		return kind;
	}

	public AccessModifier getAccess()
	{
		return access;
	}

	public AstSymbolNode getDeclaration()
	{
		return declaration;
	}

	public int getDeclarationLine()
	{
		return declaration.getNameSpec().getLocation().firstLine();
	}

	/**
	 * The label of a single-declaration kind ("ability", "has var", ...), or null when
	 * the name may be declared any number of times.
	 */
	public String getSingleDecl()
	{
		return singleDecl;
	}

	public Scope getOwner()
	{
		return owner;
	}

	public List<AstSymbolNode> getAdditionalDecls()
	{
		return Collections.unmodifiableList(additionalDecls);
	}

	void addDeclaration(AstSymbolNode node)
	{
		additionalDecls.add(node);
	}

	public List<AstSymbolNode> getUses()
	{
		return Collections.unmodifiableList(uses);
	}

	/**
	 * Records a use site. Recording the same node twice keeps a single entry.
	 */
	public void addUse(AstSymbolNode use)
	{
		for (AstSymbolNode existing : uses)
		{
			if (existing == use)
			{
				return;
			}
		}
		uses.add(use);
	}

	/**
	 * The scope that attribute access on this symbol looks into: the body of a type,
	 * the root of an imported module, the enclosing type for {@code self}. Null when unknown.
	 */
	public Scope getMemberScope()
	{
		return memberScope;
	}

	public void setMemberScope(Scope memberScope)
	{
		this.memberScope = memberScope;
	}

	public AstNode getDeclNode()
	{
		return (AstNode) declaration;
	}

	@Override
	public String toString()
	{
		return kind + " " + name + " (" + access + ")";
	}
}
