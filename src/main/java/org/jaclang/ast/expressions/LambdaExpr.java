package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;
import org.jaclang.ast.declarations.ParamVar;

import java.util.List;

/**
 * {@code with x: int can x * 2}
 */
public class LambdaExpr extends AstNode
{
	private final SubNodeList<ParamVar> params;
	private final AstNode returnType;
	private final AstNode body;

	public LambdaExpr(List<? extends AstNode> kids, SubNodeList<ParamVar> params, AstNode returnType, AstNode body)
	{
		super(kids);
		this.params = params;
		this.returnType = returnType;
		this.body = body;
	}

	public SubNodeList<ParamVar> getParams()
	{
		return params;
	}

	public AstNode getReturnType()
	{
		return returnType;
	}

	public AstNode getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitLambdaExpr(this);
	}
}
