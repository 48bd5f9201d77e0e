package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Token;

import java.util.List;

/**
 * {@code with Node entry}, the trigger of a walker or node ability.
 */
public class EventSignature extends AstNode
{
	private final AstNode archTag;
	private final Token event;
	private final AstNode returnType;

	public EventSignature(List<? extends AstNode> kids, AstNode archTag, Token event, AstNode returnType)
	{
		super(kids);
		this.archTag = archTag;
		this.event = event;
		this.returnType = returnType;
	}

	public AstNode getArchTag()
	{
		return archTag;
	}

	public Token getEvent()
	{
		return event;
	}

	public AstNode getReturnType()
	{
		return returnType;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitEventSignature(this);
	}
}
