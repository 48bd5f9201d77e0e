package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * {@code [i]}, {@code [1:n:2]} or {@code [str, int]}; each index is an expression or a {@link Slice}.
 */
public class IndexSlice extends AstNode
{
	private final List<AstNode> indices;

	public IndexSlice(List<? extends AstNode> kids, List<AstNode> indices)
	{
		super(kids);
		this.indices = List.copyOf(indices);
	}

	public List<AstNode> getIndices()
	{
		return indices;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitIndexSlice(this);
	}
}
