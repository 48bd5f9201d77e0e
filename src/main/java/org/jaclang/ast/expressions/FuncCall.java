package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

public class FuncCall extends AstNode
{
	private final AstNode target;
	private final SubNodeList<AstNode> params;

	public FuncCall(List<? extends AstNode> kids, AstNode target, SubNodeList<AstNode> params)
	{
		super(kids);
		this.target = target;
		this.params = params;
	}

	public AstNode getTarget()
	{
		return target;
	}

	/**
	 * The parenthesized argument list: expressions, {@link KWPair}s and unpacking {@link UnaryExpr}s.
	 */
	public SubNodeList<AstNode> getParams()
	{
		return params;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitFuncCall(this);
	}
}
