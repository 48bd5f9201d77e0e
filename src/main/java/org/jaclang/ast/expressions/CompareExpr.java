package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * {@code a < b <= c}. Operators are kept as text because {@code not in} and
 * {@code is not} span two tokens.
 */
public class CompareExpr extends AstNode
{
	private final AstNode left;
	private final List<String> ops;
	private final List<AstNode> rights;

	public CompareExpr(List<? extends AstNode> kids, AstNode left, List<String> ops, List<AstNode> rights)
	{
		super(kids);
		this.left = left;
		this.ops = List.copyOf(ops);
		this.rights = List.copyOf(rights);
	}

	public AstNode getLeft()
	{
		return left;
	}

	public List<String> getOps()
	{
		return ops;
	}

	public List<AstNode> getRights()
	{
		return rights;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitCompareExpr(this);
	}
}
