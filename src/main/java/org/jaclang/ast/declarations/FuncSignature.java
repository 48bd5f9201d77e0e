package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

/**
 * {@code (a: int, *rest) -> int}; the parentheses may be omitted when only a
 * return type is given.
 */
public class FuncSignature extends AstNode
{
	private final SubNodeList<ParamVar> params;
	private final AstNode returnType;

	public FuncSignature(List<? extends AstNode> kids, SubNodeList<ParamVar> params, AstNode returnType)
	{
		super(kids);
		this.params = params;
		this.returnType = returnType;
	}

	/**
	 * The parameter list, or null when the signature has no parentheses.
	 */
	public SubNodeList<ParamVar> getParams()
	{
		return params;
	}

	public AstNode getReturnType()
	{
		return returnType;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitFuncSignature(this);
	}
}
