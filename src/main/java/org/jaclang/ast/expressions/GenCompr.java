package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

public class GenCompr extends Comprehension
{
	public GenCompr(List<? extends AstNode> kids, AstNode out, List<InnerCompr> compr)
	{
		super(kids, out, compr);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitGenCompr(this);
	}
}
