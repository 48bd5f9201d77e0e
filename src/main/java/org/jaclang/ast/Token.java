package org.jaclang.ast;

import java.util.List;

/**
 * A leaf carrying literal source text. {@code kind} is the grammar's token name
 * (for example {@code KW_OBJ} or {@code LBRACE}).
 */
public class Token extends AstNode
{
	private final String kind;
	private final String value;
	private final SourceLocation location;

	public Token(String kind, String value, SourceLocation location)
	{
		super(List.of());
		this.kind = kind;
		this.value = value;
		this.location = location;
	}

	public String getKind()
	{
		return kind;
	}

	public String getValue()
	{
		return value;
	}

	public boolean is(String tokenValue)
	{
		return value.equals(tokenValue);
	}

	@Override
	public SourceLocation getLocation()
	{
		return location;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitToken(this);
	}

	@Override
	public String toString()
	{
		return kind + "('" + value + "')@" + location;
	}
}
