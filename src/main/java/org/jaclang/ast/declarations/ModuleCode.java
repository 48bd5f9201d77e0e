package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.ast.SubNodeList;
import org.jaclang.ast.SubTag;

import java.util.List;

/**
 * {@code with entry { ... }} or {@code with entry:main { ... }}.
 */
public class ModuleCode extends AstNode
{
	private final SubTag<Name> entryName;
	private final SubNodeList<AstNode> body;

	public ModuleCode(List<? extends AstNode> kids, SubTag<Name> entryName, SubNodeList<AstNode> body)
	{
		super(kids);
		this.entryName = entryName;
		this.body = body;
	}

	public SubTag<Name> getEntryName()
	{
		return entryName;
	}

	public SubNodeList<AstNode> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitModuleCode(this);
	}
}
