package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.ast.SubNodeList;
import org.jaclang.ast.SubTag;

import java.util.List;

/**
 * One of three import forms:
 * <ul>
 * <li>{@code import:py os, sys as s;} plain module imports ({@link #getPaths()})</li>
 * <li>{@code import:jac from a.b { x, y as z }} item imports ({@link #getFromLoc()} and {@link #getItems()})</li>
 * <li>{@code include:jac base;} absorb imports, pulling every public name of the target in</li>
 * </ul>
 */
public class Import extends AstNode
{
	private final SubTag<Name> lang;
	private final ModulePath fromLoc;
	private final SubNodeList<ModuleItem> items;
	private final List<ModulePath> paths;
	private final boolean absorb;

	public Import(List<? extends AstNode> kids, SubTag<Name> lang, ModulePath fromLoc, SubNodeList<ModuleItem> items, List<ModulePath> paths, boolean absorb)
	{
		super(kids);
		this.lang = lang;
		this.fromLoc = fromLoc;
		this.items = items;
		this.paths = List.copyOf(paths);
		this.absorb = absorb;
	}

	public SubTag<Name> getLang()
	{
		return lang;
	}

	public boolean isJac()
	{
		return "jac".equals(lang.getTag().getSymName());
	}

	public ModulePath getFromLoc()
	{
		return fromLoc;
	}

	public SubNodeList<ModuleItem> getItems()
	{
		return items;
	}

	public List<ModulePath> getPaths()
	{
		return paths;
	}

	public boolean isAbsorb()
	{
		return absorb;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitImport(this);
	}
}
