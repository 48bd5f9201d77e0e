package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.ast.SubNodeList;

import java.util.List;

/**
 * {@code :g: x, y;} or, when nonlocal, {@code :nl: x;}
 */
public class GlobalStmt extends AstNode
{
	private final SubNodeList<Name> names;
	private final boolean nonlocal;

	public GlobalStmt(List<? extends AstNode> kids, SubNodeList<Name> names, boolean nonlocal)
	{
		super(kids);
		this.names = names;
		this.nonlocal = nonlocal;
	}

	public SubNodeList<Name> getNames()
	{
		return names;
	}

	public boolean isNonlocal()
	{
		return nonlocal;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitGlobalStmt(this);
	}
}
