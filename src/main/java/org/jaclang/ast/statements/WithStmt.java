package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

public class WithStmt extends AstNode
{
	private final SubNodeList<ExprAsItem> items;
	private final SubNodeList<AstNode> body;

	public WithStmt(List<? extends AstNode> kids, SubNodeList<ExprAsItem> items, SubNodeList<AstNode> body)
	{
		super(kids);
		this.items = items;
		this.body = body;
	}

	public SubNodeList<ExprAsItem> getItems()
	{
		return items;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitWithStmt(this);
	}
}
