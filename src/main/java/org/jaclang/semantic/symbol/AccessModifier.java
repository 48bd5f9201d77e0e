package org.jaclang.semantic.symbol;

import org.jaclang.ast.SubTag;
import org.jaclang.ast.Token;

public enum AccessModifier
{
	PUBLIC, PROTECTED, PRIVATE;

	/**
	 * Reads an access tag such as {@code :priv}; an absent tag means public.
	 */
	public static AccessModifier of(SubTag<Token> tag)
	{
		if (tag == null)
		{
			return PUBLIC;
		}
		return switch (tag.getTag().getValue())
		{
			case "priv" -> PRIVATE;
			case "protect" -> PROTECTED;
			default -> PUBLIC;
		};
	}
}
