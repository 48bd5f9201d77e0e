package org.jaclang.ast.statements;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Token;

import java.util.List;

/**
 * {@code break}, {@code continue} or {@code skip}.
 */
public class CtrlStmt extends AstNode
{
	private final Token ctrl;

	public CtrlStmt(List<? extends AstNode> kids, Token ctrl)
	{
		super(kids);
		this.ctrl = ctrl;
	}

	public Token getCtrl()
	{
		return ctrl;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitCtrlStmt(this);
	}
}
