package org.jaclang.ast;

/**
 * Span of source text covered by a node. Lines and columns are 1-based and the
 * last column is inclusive.
 */
public record SourceLocation(int firstLine, int firstColumn, int lastLine, int lastColumn)
{
	public static final SourceLocation UNKNOWN = new SourceLocation(0, 0, 0, 0);

	public boolean isKnown()
	{
		return firstLine > 0;
	}

	public static SourceLocation span(SourceLocation first, SourceLocation last)
	{
		if (!first.isKnown())
		{
			return last;
		}
		if (!last.isKnown())
		{
			return first;
		}
		return new SourceLocation(first.firstLine, first.firstColumn, last.lastLine, last.lastColumn);
	}

	@Override
	public String toString()
	{
		return firstLine + ":" + firstColumn;
	}
}
