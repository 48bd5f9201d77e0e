package org.jaclang.ast;

public class FloatLiteral extends Literal
{
	public FloatLiteral(String kind, String value, SourceLocation location)
	{
		super(kind, value, location);
	}

	@Override
	public String getTypeName()
	{
		return "float";
	}
}
