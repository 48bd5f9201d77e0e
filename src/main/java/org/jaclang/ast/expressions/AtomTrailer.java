package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstSymbolNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Attribute access ({@code target.name}) or subscription ({@code target[index]}).
 */
public class AtomTrailer extends AstNode
{
	private final AstNode target;
	private final AstNode right;
	private final boolean isAttr;

	public AtomTrailer(List<? extends AstNode> kids, AstNode target, AstNode right, boolean isAttr)
	{
		super(kids);
		this.target = target;
		this.right = right;
		this.isAttr = isAttr;
	}

	public AstNode getTarget()
	{
		return target;
	}

	/**
	 * A {@link Name} for attribute access, an {@link IndexSlice} otherwise.
	 */
	public AstNode getRight()
	{
		return right;
	}

	public boolean isAttr()
	{
		return isAttr;
	}

	/**
	 * The segments of a dotted chain rooted at a name, {@code self.a.b} giving
	 * {@code [self, a, b]}. Chains rooted at anything else (a call, a literal,
	 * a subscript) have no segment list and give an empty list.
	 */
	public List<AstSymbolNode> asAttrList()
	{
		List<AstSymbolNode> segments = new ArrayList<>();
		AstNode current = this;
		while (current instanceof AtomTrailer trailer && trailer.isAttr && trailer.right instanceof Name name)
		{
			segments.add(name);
			current = trailer.target;
		}
		if (!(current instanceof Name root) || segments.isEmpty())
		{
			return List.of();
		}
		segments.add(root);
		Collections.reverse(segments);
		return segments;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitAtomTrailer(this);
	}
}
