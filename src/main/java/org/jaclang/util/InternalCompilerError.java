package org.jaclang.util;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.SourceLocation;

/**
 * The tree broke an invariant the passes rely on, which points to a defect in the
 * tree builder rather than in the user's program. Aborts the running pass.
 */
public class InternalCompilerError extends RuntimeException
{
	private final SourceLocation location;

	public InternalCompilerError(String message, AstNode node)
	{
		this(message, node != null ? node.getLocation() : SourceLocation.UNKNOWN);
	}

	public InternalCompilerError(String message, SourceLocation location)
	{
		super(String.format("[Internal Error] line %d:%d - %s", location.firstLine(), location.firstColumn(), message));
		this.location = location;
	}

	public SourceLocation getLocation()
	{
		return location;
	}
}
