package org.jaclang.codegen;

/**
 * Line-oriented text builder used by the formatter. Every line written through
 * {@link #line(String)} is indented to the current level; text that already spans
 * several lines is re-indented line by line, so a nested node's generated text can
 * be embedded without knowing how deep it ends up.
 */
public class TextEmitter
{
	private final StringBuilder out = new StringBuilder();
	private final String indentUnit;
	private int level;

	public TextEmitter(String indentUnit)
	{
		this.indentUnit = indentUnit;
	}

	public TextEmitter indent()
	{
		level++;
		return this;
	}

	public TextEmitter dedent()
	{
		if (level > 0)
		{
			level--;
		}
		return this;
	}

	/**
	 * Writes the text as one or more complete lines. Empty lines are left empty.
	 */
	public TextEmitter line(String text)
	{
		String prefix = indentUnit.repeat(level);
		for (String line : text.split("\n", -1))
		{
			if (!line.isEmpty())
			{
				out.append(prefix).append(line);
			}
			out.append('\n');
		}
		return this;
	}

	/**
	 * Appends to the last written line, e.g. an inline comment after a statement.
	 * With nothing written yet the text becomes a line of its own.
	 */
	public TextEmitter appendToLastLine(String text)
	{
		if (out.length() == 0)
		{
			return line(text.strip());
		}
		out.setLength(out.length() - 1);
		out.append(text).append('\n');
		return this;
	}

	/**
	 * Ensures exactly one empty line before the next line. Never emits a leading
	 * blank line.
	 */
	public TextEmitter blankLine()
	{
		if (out.length() > 0 && !endsWithBlankLine())
		{
			out.append('\n');
		}
		return this;
	}

	public boolean isEmpty()
	{
		return out.length() == 0;
	}

	private boolean endsWithBlankLine()
	{
		int n = out.length();
		return n >= 2 && out.charAt(n - 1) == '\n' && out.charAt(n - 2) == '\n';
	}

	/**
	 * @return the text without its final line break
	 */
	public String build()
	{
		int end = out.length();
		while (end > 0 && out.charAt(end - 1) == '\n')
		{
			end--;
		}
		return out.substring(0, end);
	}

	@Override
	public String toString()
	{
		return build();
	}
}
