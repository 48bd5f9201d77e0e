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
 * A function or method ({@code can}). Without a body it is a forward declaration
 * whose implementation is an {@link AbilityDef}.
 */
public class Ability extends NamedNode
{
	private final boolean isStatic;
	private final SubTag<Token> access;
	private final AstNode signature;
	private final SubNodeList<AstNode> body;
	private AbilityDef definition;

	public Ability(List<? extends AstNode> kids, boolean isStatic, SubTag<Token> access, Name name, AstNode signature, SubNodeList<AstNode> body)
	{
		super(kids, name);
		this.isStatic = isStatic;
		this.access = access;
		this.signature = signature;
		this.body = body;
	}

	public boolean isStatic()
	{
		return isStatic;
	}

	public SubTag<Token> getAccess()
	{
		return access;
	}

	/**
	 * A {@link FuncSignature}, an {@link EventSignature} or null.
	 */
	public AstNode getSignature()
	{
		return signature;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	public boolean isForwardDecl()
	{
		return body == null;
	}

	public AbilityDef getDefinition()
	{
		return definition;
	}

	public void setDefinition(AbilityDef definition)
	{
		this.definition = definition;
	}

	/**
	 * The architype or arch def whose body directly holds this ability, or null.
	 */
	public AstNode getOwnerArch()
	{
		AstNode list = getParent();
		if (list instanceof SubNodeList<?> && (list.getParent() instanceof Architype || list.getParent() instanceof ArchDef))
		{
			return list.getParent();
		}
		return null;
	}

	public boolean isMethod()
	{
		return getOwnerArch() != null;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitAbility(this);
	}
}
