package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.ast.SubNodeList;

import java.util.List;

/**
 * {@code except ValueError as e { ... }}; both the type and the name are optional.
 */
public class Except extends AstNode
{
	private final AstNode exType;
	private final Name name;
	private final SubNodeList<AstNode> body;

	public Except(List<? extends AstNode> kids, AstNode exType, Name name, SubNodeList<AstNode> body)
	{
		super(kids);
		this.exType = exType;
		this.name = name;
		this.body = body;
	}

	public AstNode getExType()
	{
		return exType;
	}

	public Name getName()
	{
		return name;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitExcept(this);
	}
}
