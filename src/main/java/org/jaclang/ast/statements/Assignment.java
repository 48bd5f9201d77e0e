package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubTag;
import org.jaclang.ast.Token;

import java.util.List;

/**
 * Plain ({@code a = b = 1}), typed ({@code x: int = 1}, value optional) or
 * augmented ({@code i += 1}) assignment.
 */
public class Assignment extends AstNode
{
	private final List<AstNode> targets;
	private final AstNode value;
	private final SubTag<AstNode> typeTag;
	private final Token augOp;
	private final boolean isLet;

	public Assignment(List<? extends AstNode> kids, List<AstNode> targets, AstNode value, SubTag<AstNode> typeTag, Token augOp, boolean isLet)
	{
		super(kids);
		this.targets = List.copyOf(targets);
		this.value = value;
		this.typeTag = typeTag;
		this.augOp = augOp;
		this.isLet = isLet;
	}

	public List<AstNode> getTargets()
	{
		return targets;
	}

	public AstNode getValue()
	{
		return value;
	}

	public SubTag<AstNode> getTypeTag()
	{
		return typeTag;
	}

	public Token getAugOp()
	{
		return augOp;
	}

	public boolean isAugmented()
	{
		return augOp != null;
	}

	public boolean isLet()
	{
		return isLet;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitAssignment(this);
	}
}
