package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

public class TryStmt extends AstNode
{
	private final SubNodeList<AstNode> body;
	private final List<Except> excepts;
	private final ElseStmt elseBody;
	private final FinallyStmt finallyBody;

	public TryStmt(List<? extends AstNode> kids, SubNodeList<AstNode> body, List<Except> excepts, ElseStmt elseBody, FinallyStmt finallyBody)
	{
		super(kids);
		this.body = body;
		this.excepts = List.copyOf(excepts);
		this.elseBody = elseBody;
		this.finallyBody = finallyBody;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	public List<Except> getExcepts()
	{
		return excepts;
	}

	public ElseStmt getElseBody()
	{
		return elseBody;
	}

	public FinallyStmt getFinallyBody()
	{
		return finallyBody;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitTryStmt(this);
	}
}
