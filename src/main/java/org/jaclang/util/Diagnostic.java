package org.jaclang.util;

import org.jaclang.ast.SourceLocation;

public record Diagnostic(DiagnosticKind kind, Severity severity, String message, String module, SourceLocation location)
{
	public boolean isError()
	{
		return severity == Severity.ERROR;
	}

	public String format()
	{
		String level = severity == Severity.ERROR ? "Error" : "Warning";
		return String.format("[%s %s] %s - line %d:%d - %s",
				kind.getCategory(), level, module, location.firstLine(), location.firstColumn(), message);
	}

	@Override
	public String toString()
	{
		return format();
	}
}
