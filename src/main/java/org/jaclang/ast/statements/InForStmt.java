package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

/**
 * {@code for k, v in d.items() { ... }}
 */
public class InForStmt extends AstNode
{
	private final AstNode target;
	private final AstNode collection;
	private final SubNodeList<AstNode> body;

	public InForStmt(List<? extends AstNode> kids, AstNode target, AstNode collection, SubNodeList<AstNode> body)
	{
		super(kids);
		this.target = target;
		this.collection = collection;
		this.body = body;
	}

	public AstNode getTarget()
	{
		return target;
	}

	public AstNode getCollection()
	{
		return collection;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitInForStmt(this);
	}
}
