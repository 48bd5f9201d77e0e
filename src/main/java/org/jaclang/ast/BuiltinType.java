package org.jaclang.ast;

public class BuiltinType extends Name
{
	public BuiltinType(String kind, String value, SourceLocation location)
	{
		super(kind, value, location);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitBuiltinType(this);
	}
}
