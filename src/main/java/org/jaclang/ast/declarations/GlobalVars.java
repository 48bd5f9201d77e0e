package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubTag;
import org.jaclang.ast.Token;
import org.jaclang.ast.statements.Assignment;

import java.util.List;

/**
 * {@code glob:priv x = 1, y = 2;}
 */
public class GlobalVars extends AstNode
{
	private final SubTag<Token> access;
	private final List<Assignment> assignments;

	public GlobalVars(List<? extends AstNode> kids, SubTag<Token> access, List<Assignment> assignments)
	{
		super(kids);
		this.access = access;
		this.assignments = List.copyOf(assignments);
	}

	public SubTag<Token> getAccess()
	{
		return access;
	}

	public List<Assignment> getAssignments()
	{
		return assignments;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitGlobalVars(this);
	}
}
