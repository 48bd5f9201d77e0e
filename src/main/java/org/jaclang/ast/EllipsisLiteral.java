package org.jaclang.ast;

public class EllipsisLiteral extends Literal
{
	public EllipsisLiteral(String kind, String value, SourceLocation location)
	{
		super(kind, value, location);
	}

	@Override
	public String getTypeName()
	{
		return "ellipsis";
	}
}
