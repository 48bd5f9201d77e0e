package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.Name;
import org.jaclang.ast.NamedNode;
import org.jaclang.ast.Token;

import java.util.List;

/**
 * One {@code :kind:name} segment of an out-of-line definition target.
 */
public class ArchRef extends NamedNode
{
	private final Token kind;

	public ArchRef(List<? extends AstNode> kids, Token kind, Name name)
	{
		super(kids, name);
		this.kind = kind;
	}

	public Token getKind()
	{
		return kind;
	}

	public boolean isAbilityRef()
	{
		return kind.is("can");
	}

	/**
	 * Flat form used as scope and symbol name, for example {@code (o)A} or {@code (c)f}.
	 */
	public String getFlatName()
	{
		String code = switch (kind.getValue())
		{
			case "obj" -> "o";
			case "node" -> "n";
			case "edge" -> "e";
			case "walker" -> "w";
			case "class" -> "cls";
			case "enum" -> "en";
			case "can" -> "c";
			default -> kind.getValue();
		};
		return "(" + code + ")" + getSymName();
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitArchRef(this);
	}
}
