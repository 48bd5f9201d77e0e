package org.jaclang.ast;

public class IntLiteral extends Literal
{
	public IntLiteral(String kind, String value, SourceLocation location)
	{
		super(kind, value, location);
	}

	@Override
	public String getTypeName()
	{
		return "int";
	}
}
