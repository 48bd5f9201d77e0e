package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.ast.NamedNode;
import org.jaclang.ast.SubNodeList;
import org.jaclang.ast.SubTag;
import org.jaclang.ast.Token;

import java.util.List;

/**
 * {@code enum:pub Color :Base: { RED = 1, GREEN }}
 */
public class EnumDecl extends NamedNode
{
	private final SubTag<Token> access;
	private final SubNodeList<AstNode> baseClasses;
	private final SubNodeList<EnumMember> body;
	private ArchDef definition;

	public EnumDecl(List<? extends AstNode> kids, SubTag<Token> access, Name name, SubNodeList<AstNode> baseClasses, SubNodeList<EnumMember> body)
	{
		super(kids, name);
		this.access = access;
		this.baseClasses = baseClasses;
		this.body = body;
	}

	public SubTag<Token> getAccess()
	{
		return access;
	}

	public SubNodeList<AstNode> getBaseClasses()
	{
		return baseClasses;
	}

	public SubNodeList<EnumMember> getBody()
	{
		return body;
	}

	public ArchDef getDefinition()
	{
		return definition;
	}

	public void setDefinition(ArchDef definition)
	{
		this.definition = definition;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitEnumDecl(this);
	}
}
