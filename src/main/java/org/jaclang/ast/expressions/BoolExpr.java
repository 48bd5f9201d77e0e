package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Token;

import java.util.List;

/**
 * A flat {@code and} or {@code or} chain.
 */
public class BoolExpr extends AstNode
{
	private final Token op;
	private final List<AstNode> values;

	public BoolExpr(List<? extends AstNode> kids, Token op, List<AstNode> values)
	{
		super(kids);
		this.op = op;
		this.values = List.copyOf(values);
	}

	public Token getOp()
	{
		return op;
	}

	public List<AstNode> getValues()
	{
		return values;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitBoolExpr(this);
	}
}
