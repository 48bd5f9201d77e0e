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
 * An {@code obj}, {@code node}, {@code edge}, {@code walker} or {@code class} declaration.
 * The body is absent when the members are given by a separate {@link ArchDef}.
 */
public class Architype extends NamedNode
{
	public enum ArchType
	{
		OBJ, NODE, EDGE, WALKER, CLASS;

		public static ArchType fromKeyword(String keyword)
		{
			return valueOf(keyword.toUpperCase());
		}
	}

	private final ArchType archType;
	private final SubTag<Token> access;
	private final SubNodeList<AstNode> baseClasses;
	private final SubNodeList<AstNode> body;
	private ArchDef definition;

	public Architype(List<? extends AstNode> kids, ArchType archType, SubTag<Token> access, Name name, SubNodeList<AstNode> baseClasses, SubNodeList<AstNode> body)
	{
		super(kids, name);
		this.archType = archType;
		this.access = access;
		this.baseClasses = baseClasses;
		this.body = body;
	}

	public ArchType getArchType()
	{
		return archType;
	}

	public boolean isWalker()
	{
		return archType == ArchType.WALKER;
	}

	public SubTag<Token> getAccess()
	{
		return access;
	}

	public SubNodeList<AstNode> getBaseClasses()
	{
		return baseClasses;
	}

	public SubNodeList<AstNode> getBody()
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
		return visitor.visitArchitype(this);
	}
}
