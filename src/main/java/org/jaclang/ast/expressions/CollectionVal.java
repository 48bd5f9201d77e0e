package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.SubNodeList;

import java.util.List;

/**
 * A list, set, tuple or dict display; its only kid is the bracketed value list.
 */
public abstract class CollectionVal<T extends AstNode> extends AstNode
{
	private final SubNodeList<T> values;

	protected CollectionVal(SubNodeList<T> values)
	{
		super(List.of(values));
		this.values = values;
	}

	public SubNodeList<T> getValues()
	{
		return values;
	}
}
