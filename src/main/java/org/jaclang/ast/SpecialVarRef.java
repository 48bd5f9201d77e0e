package org.jaclang.ast;

/**
 * {@code self}, {@code super}, {@code here}, {@code root} or {@code visitor}.
 */
public class SpecialVarRef extends Name
{
	public SpecialVarRef(String kind, String value, SourceLocation location)
	{
		super(kind, value, location);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitSpecialVarRef(this);
	}
}
