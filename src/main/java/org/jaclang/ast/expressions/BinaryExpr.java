package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Token;

import java.util.List;

/**
 * Arithmetic, bitwise, shift, power, {@code spawn} and connect ({@code ++>}, {@code <++})
 * operations. Chains of the same precedence nest to the left.
 */
public class BinaryExpr extends AstNode
{
	private final AstNode left;
	private final Token op;
	private final AstNode right;

	public BinaryExpr(List<? extends AstNode> kids, AstNode left, Token op, AstNode right)
	{
		super(kids);
		this.left = left;
		this.op = op;
		this.right = right;
	}

	public AstNode getLeft()
	{
		return left;
	}

	public Token getOp()
	{
		return op;
	}

	public AstNode getRight()
	{
		return right;
	}

	public boolean isArithmetic()
	{
		return switch (op.getValue())
		{
			case "+", "-", "*", "/", "//", "%" -> true;
			default -> false;
		};
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitBinaryExpr(this);
	}
}
