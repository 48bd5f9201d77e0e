package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstSymbolNode;
import org.jaclang.ast.SubNodeList;
import org.jaclang.semantic.symbol.Symbol;

import java.util.List;

/**
 * Body given separately from its declaration, addressed through an {@link ArchRefChain}.
 * Once linked, {@link #getDeclaration()} is the declaring architype, enum or ability.
 */
public abstract class OutOfLineDef extends AstNode implements AstSymbolNode
{
	private final ArchRefChain target;
	private final SubNodeList<AstNode> body;
	private Symbol symbol;
	private AstNode declaration;

	protected OutOfLineDef(List<? extends AstNode> kids, ArchRefChain target, SubNodeList<AstNode> body)
	{
		super(kids);
		this.target = target;
		this.body = body;
	}

	public ArchRefChain getTarget()
	{
		return target;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	public AstNode getDeclaration()
	{
		return declaration;
	}

	public void setDeclaration(AstNode declaration)
	{
		this.declaration = declaration;
	}

	@Override
	public String getSymName()
	{
		return target.getFlatName();
	}

	@Override
	public AstNode getNameSpec()
	{
		return target;
	}

	@Override
	public Symbol getSymbol()
	{
		return symbol;
	}

	@Override
	public void setSymbol(Symbol symbol)
	{
		this.symbol = symbol;
	}
}
