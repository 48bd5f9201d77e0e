package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.SubNodeList;

import java.util.List;

/**
 * {@code :obj:A:can:f(p: int) -> int { ... }}
 */
public class AbilityDef extends OutOfLineDef
{
	private final AstNode signature;

	public AbilityDef(List<? extends AstNode> kids, ArchRefChain target, AstNode signature, SubNodeList<AstNode> body)
	{
		super(kids, target, body);
		this.signature = signature;
	}

	/**
	 * A {@link FuncSignature}, an {@link EventSignature} or null.
	 */
	public AstNode getSignature()
	{
		return signature;
	}

	/**
	 * True when the definition belongs to an architype, for example {@code :obj:A:can:f}.
	 */
	public boolean isMethod()
	{
		return getTarget().getArchs().size() > 1;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitAbilityDef(this);
	}
}
