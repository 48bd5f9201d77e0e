package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

public class ReportStmt extends AstNode
{
	private final AstNode expr;

	public ReportStmt(List<? extends AstNode> kids, AstNode expr)
	{
		super(kids);
		this.expr = expr;
	}

	public AstNode getExpr()
	{
		return expr;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitReportStmt(this);
	}
}
