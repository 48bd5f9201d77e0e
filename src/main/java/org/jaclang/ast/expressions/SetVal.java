package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

public class SetVal extends CollectionVal<AstNode>
{
	public SetVal(SubNodeList<AstNode> values)
	{
		super(values);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitSetVal(this);
	}
}
