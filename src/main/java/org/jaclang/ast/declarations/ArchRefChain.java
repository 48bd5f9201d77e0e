package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstSymbolNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code :obj:A:can:f}, the target of an out-of-line definition.
 */
public class ArchRefChain extends AstNode
{
	private final List<ArchRef> archs;

	public ArchRefChain(List<? extends AstNode> kids, List<ArchRef> archs)
	{
		super(kids);
		this.archs = List.copyOf(archs);
	}

	public List<ArchRef> getArchs()
	{
		return archs;
	}

	public List<AstSymbolNode> getNames()
	{
		return archs.stream().<AstSymbolNode>map(ArchRef::getName).toList();
	}

	public String getFlatName()
	{
		return archs.stream().map(ArchRef::getFlatName).collect(Collectors.joining("."));
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitArchRefChain(this);
	}
}
