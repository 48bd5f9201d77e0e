package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.ast.NamedNode;
import org.jaclang.ast.SubTag;
import org.jaclang.ast.Token;

import java.util.List;

public class ParamVar extends NamedNode
{
	private final Token unpack;
	private final SubTag<AstNode> typeTag;
	private final AstNode value;

	public ParamVar(List<? extends AstNode> kids, Token unpack, Name name, SubTag<AstNode> typeTag, AstNode value)
	{
		super(kids, name);
		this.unpack = unpack;
		this.typeTag = typeTag;
		this.value = value;
	}

	/**
	 * {@code *} or {@code **}, or null for a plain parameter.
	 */
	public Token getUnpack()
	{
		return unpack;
	}

	public SubTag<AstNode> getTypeTag()
	{
		return typeTag;
	}

	public AstNode getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitParamVar(this);
	}
}
