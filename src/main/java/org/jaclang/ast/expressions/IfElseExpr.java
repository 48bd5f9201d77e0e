package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * {@code value if condition else elseValue}
 */
public class IfElseExpr extends AstNode
{
	private final AstNode value;
	private final AstNode condition;
	private final AstNode elseValue;

	public IfElseExpr(List<? extends AstNode> kids, AstNode value, AstNode condition, AstNode elseValue)
	{
		super(kids);
		this.value = value;
		this.condition = condition;
		this.elseValue = elseValue;
	}

	public AstNode getValue()
	{
		return value;
	}

	public AstNode getCondition()
	{
		return condition;
	}

	public AstNode getElseValue()
	{
		return elseValue;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitIfElseExpr(this);
	}
}
