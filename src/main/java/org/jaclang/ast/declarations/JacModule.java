package org.jaclang.ast.declarations;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstVisitor;
import org.jaclang.ast.StringLiteral;

import java.util.Collections;
import java.util.List;

/**
 * Root of one compiled module.
 */
public class JacModule extends AstNode
{
	private final String name;
	private final StringLiteral docstring;
	private final List<AstNode> body;

	public JacModule(List<? extends AstNode> kids, String name, StringLiteral docstring, List<AstNode> body)
	{
		super(kids);
		this.name = name;
		this.docstring = docstring;
		this.body = List.copyOf(body);
	}

	public String getName()
	{
		return name;
	}

	public StringLiteral getDocstring()
	{
		return docstring;
	}

	public List<AstNode> getBody()
	{
		return Collections.unmodifiableList(body);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitModule(this);
	}
}
