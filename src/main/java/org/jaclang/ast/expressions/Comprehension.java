package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;

import java.util.List;

/**
 * Base of list, set, generator and dict comprehensions. Each opens a scope holding
 * the names bound by its {@code for} clauses.
 */
public abstract class Comprehension extends AstNode
{
	private final AstNode out;
	private final List<InnerCompr> compr;

	protected Comprehension(List<? extends AstNode> kids, AstNode out, List<InnerCompr> compr)
	{
		super(kids);
		this.out = out;
		this.compr = List.copyOf(compr);
	}

	/**
	 * The produced element; a {@link KVPair} for dict comprehensions.
	 */
	public AstNode getOut()
	{
		return out;
	}

	public List<InnerCompr> getCompr()
	{
		return compr;
	}
}
