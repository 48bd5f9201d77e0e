package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;
import org.jaclang.ast.SubTag;
import org.jaclang.ast.Token;

import java.util.List;

/**
 * {@code static has:priv x: int = 5, y: str;}
 */
public class ArchHas extends AstNode
{
	private final boolean isStatic;
	private final SubTag<Token> access;
	private final SubNodeList<HasVar> vars;

	public ArchHas(List<? extends AstNode> kids, boolean isStatic, SubTag<Token> access, SubNodeList<HasVar> vars)
	{
		super(kids);
		this.isStatic = isStatic;
		this.access = access;
		this.vars = vars;
	}

	public boolean isStatic()
	{
		return isStatic;
	}

	public SubTag<Token> getAccess()
	{
		return access;
	}

	public SubNodeList<HasVar> getVars()
	{
		return vars;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitArchHas(this);
	}
}
