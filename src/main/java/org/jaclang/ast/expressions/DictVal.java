package org.jaclang.ast.expressions;

import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

public class DictVal extends CollectionVal<KVPair>
{
	public DictVal(SubNodeList<KVPair> values)
	{
		super(values);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitDictVal(this);
	}
}
