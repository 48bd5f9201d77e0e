package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

/**
 * A tuple display. Loop targets such as {@code for k, v in ...} are tuples
 * without parentheses.
 */
public class TupleVal extends CollectionVal<AstNode>
{
	public TupleVal(SubNodeList<AstNode> values)
	{
		super(values);
	}

	public boolean isParenthesized()
	{
		return getValues().getOpen().isPresent();
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitTupleVal(this);
	}
}
