package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

/**
 * {@code :obj:A { has y: int; }}
 */
public class ArchDef extends OutOfLineDef
{
	public ArchDef(List<? extends AstNode> kids, ArchRefChain target, SubNodeList<AstNode> body)
	{
		super(kids, target, body);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitArchDef(this);
	}
}
