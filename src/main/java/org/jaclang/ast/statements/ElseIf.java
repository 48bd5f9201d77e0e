package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

public class ElseIf extends IfStmt
{
	public ElseIf(List<? extends AstNode> kids, AstNode condition, SubNodeList<AstNode> body, AstNode elseBody)
	{
		super(kids, condition, body, elseBody);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitElseIf(this);
	}
}
