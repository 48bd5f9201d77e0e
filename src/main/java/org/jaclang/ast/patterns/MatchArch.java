package org.jaclang.ast.patterns;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;

import java.util.List;

/**
 * A class pattern, {@code Point(0, y=py)}. Arguments are patterns or {@link MatchKVPair}s.
 */
public class MatchArch extends AstNode
{
	private final AstNode name;
	private final List<AstNode> args;

	public MatchArch(List<? extends AstNode> kids, AstNode name, List<AstNode> args)
	{
		super(kids);
		this.name = name;
		this.args = List.copyOf(args);
	}

	/**
	 * The matched type, a name or a dotted chain.
	 */
	public AstNode getName()
	{
		return name;
	}

	public List<AstNode> getArgs()
	{
		return args;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMatchArch(this);
	}
}
