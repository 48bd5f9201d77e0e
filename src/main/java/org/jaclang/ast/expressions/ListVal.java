package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

public class ListVal extends CollectionVal<AstNode>
{
	public ListVal(SubNodeList<AstNode> values)
	{
		super(values);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitListVal(this);
	}
}
