package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.ast.NamedNode;
import org.jaclang.ast.SubTag;

import java.util.List;

public class HasVar extends NamedNode
{
	private final SubTag<AstNode> typeTag;
	private final AstNode value;

	public HasVar(List<? extends AstNode> kids, Name name, SubTag<AstNode> typeTag, AstNode value)
	{
		super(kids, name);
		this.typeTag = typeTag;
		this.value = value;
	}

	public SubTag<AstNode> getTypeTag()
	{
		return typeTag;
	}

	public AstNode getValue()
	{
		return value;
	}

	/**
	 * The {@code has} statement holding this var; the var list sits between the two.
	 */
	public ArchHas getOwnerHas()
	{
		AstNode list = getParent();
		if (list != null && list.getParent() instanceof ArchHas has)
		{
			return has;
		}
		return null;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitHasVar(this);
	}
}
