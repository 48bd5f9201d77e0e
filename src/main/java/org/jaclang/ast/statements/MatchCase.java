package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

/**
 * {@code case Point(x=0) if flag: ...}; the body is an unbracketed statement list.
 */
public class MatchCase extends AstNode
{
	private final AstNode pattern;
	private final AstNode guard;
	private final SubNodeList<AstNode> body;

	public MatchCase(List<? extends AstNode> kids, AstNode pattern, AstNode guard, SubNodeList<AstNode> body)
	{
		super(kids);
		this.pattern = pattern;
		this.guard = guard;
		this.body = body;
	}

	public AstNode getPattern()
	{
		return pattern;
	}

	public AstNode getGuard()
	{
		return guard;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMatchCase(this);
	}
}
