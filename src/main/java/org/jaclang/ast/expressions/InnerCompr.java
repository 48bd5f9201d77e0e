package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * {@code for x in xs if x > 0}
 */
public class InnerCompr extends AstNode
{
	private final AstNode target;
	private final AstNode collection;
	private final List<AstNode> conditions;

	public InnerCompr(List<? extends AstNode> kids, AstNode target, AstNode collection, List<AstNode> conditions)
	{
		super(kids);
		this.target = target;
		this.collection = collection;
		this.conditions = List.copyOf(conditions);
	}

	public AstNode getTarget()
	{
		return target;
	}

	public AstNode getCollection()
	{
		return collection;
	}

	public List<AstNode> getConditions()
	{
		return conditions;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitInnerCompr(this);
	}
}
