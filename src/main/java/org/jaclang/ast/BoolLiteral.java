package org.jaclang.ast;

public class BoolLiteral extends Literal
{
	public BoolLiteral(String kind, String value, SourceLocation location)
	{
		super(kind, value, location);
	}

	@Override
	public String getTypeName()
	{
		return "bool";
	}
}
