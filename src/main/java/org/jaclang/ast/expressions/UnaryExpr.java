package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Token;

import java.util.List;

/**
 * {@code -x}, {@code ~x}, {@code not x}, and the {@code *x}/{@code **x} unpacking of call arguments.
 */
public class UnaryExpr extends AstNode
{
	private final Token op;
	private final AstNode operand;

	public UnaryExpr(List<? extends AstNode> kids, Token op, AstNode operand)
	{
		super(kids);
		this.op = op;
		this.operand = operand;
	}

	public Token getOp()
	{
		return op;
	}

	public AstNode getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitUnaryExpr(this);
	}
}
