package org.jaclang.ast;

public class NullLiteral extends Literal
{
	public NullLiteral(String kind, String value, SourceLocation location)
	{
		super(kind, value, location);
	}

	@Override
	public String getTypeName()
	{
		return "None";
	}
}
