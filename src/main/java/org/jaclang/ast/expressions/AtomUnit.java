package org.jaclang.ast.expressions;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * A parenthesized expression.
 */
public class AtomUnit extends AstNode
{
	private final AstNode value;

	public AtomUnit(List<? extends AstNode> kids, AstNode value)
	{
		super(kids);
		this.value = value;
	}

	public AstNode getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitAtomUnit(this);
	}
}
