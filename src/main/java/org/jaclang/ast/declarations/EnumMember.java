package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.ast.NamedNode;

import java.util.List;

public class EnumMember extends NamedNode
{
	private final AstNode value;

	public EnumMember(List<? extends AstNode> kids, Name name, AstNode value)
	{
		super(kids, name);
		this.value = value;
	}

	public AstNode getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitEnumMember(this);
	}
}
