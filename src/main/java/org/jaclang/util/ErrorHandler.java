package org.jaclang.util;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one module so a single run reports as many problems
 * as it can. Every diagnostic is also logged as it arrives.
 */
public class ErrorHandler
{
	private final String moduleName;
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	public ErrorHandler(String moduleName)
	{
		this.moduleName = moduleName;
	}

	public void logError(AstNode node, DiagnosticKind kind, String msg)
	{
		report(kind, node.getLocation(), msg);
	}

	public void report(DiagnosticKind kind, SourceLocation location, String msg)
	{
		Diagnostic diagnostic = new Diagnostic(kind, kind.getSeverity(), msg, moduleName, location);
		diagnostics.add(diagnostic);
		if (diagnostic.isError())
		{
			Debug.logError(diagnostic.format());
		}
		else
		{
			Debug.logWarning(diagnostic.format());
		}
	}

	public boolean hasErrors()
	{
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public boolean has(DiagnosticKind kind)
	{
		return diagnostics.stream().anyMatch(d -> d.kind() == kind);
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	public List<Diagnostic> getDiagnostics(DiagnosticKind kind)
	{
		return diagnostics.stream().filter(d -> d.kind() == kind).toList();
	}

	public String getModuleName()
	{
		return moduleName;
	}
}
