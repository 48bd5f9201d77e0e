package org.jaclang.ast;

/**
 * A single string token, prefix and quotes included in its value.
 */
public class StringLiteral extends Literal
{
	public StringLiteral(String kind, String value, SourceLocation location)
	{
		super(kind, value, location);
	}

	@Override
	public String getTypeName()
	{
		return "str";
	}

	public String getPrefix()
	{
		String value = getValue();
		int i = 0;
		while (i < value.length() && value.charAt(i) != '"' && value.charAt(i) != '\'')
		{
			i++;
		}
		return value.substring(0, i);
	}

	public boolean isTripleQuoted()
	{
		String body = getValue().substring(getPrefix().length());
		return body.startsWith("\"\"\"") || body.startsWith("'''");
	}

	public boolean isMultiLine()
	{
		return getValue().indexOf('\n') >= 0;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitStringLiteral(this);
	}
}
