package org.jaclang.semantic.symbol;

import org.jaclang.ast.AstSymbolNode;
import org.jaclang.ast.Name;
import org.jaclang.ast.declarations.*;

public enum SymbolKind
{
	MODULE,
	MOD_VAR,
	VARIABLE,
	OBJECT_ARCH,
	NODE_ARCH,
	EDGE_ARCH,
	WALKER_ARCH,
	CLASS_ARCH,
	ENUM_ARCH,
	ENUM_MEMBER,
	ABILITY,
	METHOD,
	IMPL,
	HAS_VAR,
	PARAM,
	TEST,
	SELF,
	SUPER,
	BUILTIN;

	/**
	 * Derives the kind from the declaring node.
	 */
	public static SymbolKind of(AstSymbolNode node)
	{
		if (node instanceof Architype arch)
		{
			return switch (arch.getArchType())
			{
				case OBJ -> OBJECT_ARCH;
				case NODE -> NODE_ARCH;
				case EDGE -> EDGE_ARCH;
				case WALKER -> WALKER_ARCH;
				case CLASS -> CLASS_ARCH;
			};
		}
		if (node instanceof EnumDecl)
		{
			return ENUM_ARCH;
		}
		if (node instanceof EnumMember)
		{
			return ENUM_MEMBER;
		}
		if (node instanceof Ability ability)
		{
			return ability.isMethod() ? METHOD : ABILITY;
		}
		if (node instanceof OutOfLineDef)
		{
			return IMPL;
		}
		if (node instanceof HasVar)
		{
			return HAS_VAR;
		}
		if (node instanceof ParamVar)
		{
			return PARAM;
		}
		if (node instanceof TestBlock)
		{
			return TEST;
		}
		if (node instanceof ModulePath || node instanceof ModuleItem)
		{
			return MOD_VAR;
		}
		if (node instanceof Name name && name.getParent() instanceof ModulePath)
		{
			return MOD_VAR;
		}
		return VARIABLE;
	}
}
