package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstSymbolNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.semantic.symbol.Symbol;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A dotted module reference, optionally relative ({@code ..pkg.mod}) and aliased.
 * The module binds its alias when it has one, its first segment otherwise.
 */
public class ModulePath extends AstNode implements AstSymbolNode
{
	private final List<Name> path;
	private final Name alias;
	private final int level;
	private JacModule subModule;

	public ModulePath(List<? extends AstNode> kids, List<Name> path, Name alias, int level)
	{
		super(kids);
		this.path = List.copyOf(path);
		this.alias = alias;
		this.level = level;
	}

	public List<Name> getPath()
	{
		return path;
	}

	public Name getAlias()
	{
		return alias;
	}

	public int getLevel()
	{
		return level;
	}

	public String getDotPath()
	{
		return ".".repeat(level) + path.stream().map(Name::getSymName).collect(Collectors.joining("."));
	}

	/**
	 * The module this path resolved to, when it was resolved.
	 */
	public JacModule getSubModule()
	{
		return subModule;
	}

	public void setSubModule(JacModule subModule)
	{
		this.subModule = subModule;
	}

	@Override
	public String getSymName()
	{
		return getNameSpec().getSymName();
	}

	@Override
	public Name getNameSpec()
	{
		return alias != null ? alias : path.get(0);
	}

	@Override
	public Symbol getSymbol()
	{
		return getNameSpec().getSymbol();
	}

	@Override
	public void setSymbol(Symbol symbol)
	{
		getNameSpec().setSymbol(symbol);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitModulePath(this);
	}
}
