package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstSymbolNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.ast.SubNodeList;
import org.jaclang.semantic.symbol.Symbol;

import java.util.List;

/**
 * {@code test name { ... }}. Anonymous tests declare a generated name.
 */
public class TestBlock extends AstNode implements AstSymbolNode
{
	private final Name name;
	private final Name nameSpec;
	private final SubNodeList<AstNode> body;

	public TestBlock(List<? extends AstNode> kids, Name name, SubNodeList<AstNode> body, int index)
	{
		super(kids);
		this.name = name;
		this.body = body;
		this.nameSpec = name != null ? name : Name.stub(this, "_jac_gen_" + index);
	}

	/**
	 * The written name, or null for an anonymous test.
	 */
	public Name getName()
	{
		return name;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	@Override
	public String getSymName()
	{
		return nameSpec.getSymName();
	}

	@Override
	public Name getNameSpec()
	{
		return nameSpec;
	}

	@Override
	public Symbol getSymbol()
	{
		return nameSpec.getSymbol();
	}

	@Override
	public void setSymbol(Symbol symbol)
	{
		nameSpec.setSymbol(symbol);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitTestBlock(this);
	}
}
