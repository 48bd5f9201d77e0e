package org.jaclang.ast;

import org.jaclang.semantic.symbol.Scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Base of every syntax tree node. A node exclusively owns its kids, which are kept in
 * literal source order (tokens, comments and structural children alike). The parent
 * pointer and the scope reference are non-owning.
 */
public abstract class AstNode
{
	private final List<AstNode> kids = new ArrayList<>();
	private AstNode parent;
	private Scope scope;
	private String generatedText;

	protected AstNode(List<? extends AstNode> kids)
	{
		for (AstNode kid : kids)
		{
			if (kid != null)
			{
				adopt(kid);
				this.kids.add(kid);
			}
		}
	}

	private void adopt(AstNode kid)
	{
		kid.parent = this;
	}

	public List<AstNode> getKids()
	{
		return Collections.unmodifiableList(kids);
	}

	/**
	 * Inserts a kid at the given position. Only the comment attacher should need this,
	 * the rest of the tree is fixed once built.
	 */
	public void insertKid(int index, AstNode kid)
	{
		adopt(kid);
		kids.add(index, kid);
	}

	public AstNode getParent()
	{
		return parent;
	}

	void setParent(AstNode parent)
	{
		this.parent = parent;
	}

	public SourceLocation getLocation()
	{
		if (kids.isEmpty())
		{
			return SourceLocation.UNKNOWN;
		}
		return SourceLocation.span(kids.get(0).getLocation(), kids.get(kids.size() - 1).getLocation());
	}

	public Scope getScope()
	{
		return scope;
	}

	public void setScope(Scope scope)
	{
		this.scope = scope;
	}

	public String getGeneratedText()
	{
		return generatedText;
	}

	public void setGeneratedText(String generatedText)
	{
		this.generatedText = generatedText;
	}

	public <T extends AstNode> Optional<T> findParent(Class<T> type)
	{
		AstNode current = parent;
		while (current != null)
		{
			if (type.isInstance(current))
			{
				return Optional.of(type.cast(current));
			}
			current = current.parent;
		}
		return Optional.empty();
	}

	/**
	 * Collects every node of the given type in this subtree, this node included, in
	 * depth-first source order.
	 */
	public <T extends AstNode> List<T> findAll(Class<T> type)
	{
		List<T> found = new ArrayList<>();
		collect(type, found);
		return found;
	}

	private <T extends AstNode> void collect(Class<T> type, List<T> found)
	{
		if (type.isInstance(this))
		{
			found.add(type.cast(this));
		}
		for (AstNode kid : kids)
		{
			kid.collect(type, found);
		}
	}

	public abstract <R> R accept(AstVisitor<R> visitor);

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "@" + getLocation();
	}
}
