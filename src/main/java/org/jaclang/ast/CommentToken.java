package org.jaclang.ast;

/**
 * A line ({@code #}) or block ({@code #* *#}) comment. Inline comments share their
 * first line with the code token before them.
 */
public class CommentToken extends Token
{
	private final boolean inline;

	public CommentToken(String kind, String value, SourceLocation location, boolean inline)
	{
		super(kind, value, location);
		this.inline = inline;
	}

	public boolean isInline()
	{
		return inline;
	}

	public boolean isBlock()
	{
		return getValue().startsWith("#*");
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitCommentToken(this);
	}
}
