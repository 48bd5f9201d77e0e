package org.jaclang;

import org.jaclang.ast.declarations.JacModule;
import org.jaclang.semantic.symbol.Scope;
import org.jaclang.util.Diagnostic;
import org.jaclang.util.DiagnosticKind;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of compiling one module. A module with syntax errors has no tree, no scope
 * and no formatted text, only diagnostics.
 */
public class CompilationResult
{
	private final String moduleName;
	private final JacModule module;
	private final Scope rootScope;
	private final List<Diagnostic> diagnostics;
	private final String formatted;

	public CompilationResult(String moduleName, JacModule module, Scope rootScope, List<Diagnostic> diagnostics, String formatted)
	{
		this.moduleName = moduleName;
		this.module = module;
		this.rootScope = rootScope;
		this.diagnostics = List.copyOf(diagnostics);
		this.formatted = formatted;
	}

	public static CompilationResult syntaxError(String moduleName, List<Diagnostic> diagnostics)
	{
		return new CompilationResult(moduleName, null, null, diagnostics, null);
	}

	public String getModuleName()
	{
		return moduleName;
	}

	public JacModule getModule()
	{
		return module;
	}

	public Scope getRootScope()
	{
		return rootScope;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}

	public List<Diagnostic> getDiagnostics(DiagnosticKind kind)
	{
		return diagnostics.stream().filter(d -> d.kind() == kind).toList();
	}

	public Optional<String> getFormatted()
	{
		return Optional.ofNullable(formatted);
	}

	public boolean isParsed()
	{
		return module != null;
	}

	public boolean hasErrors()
	{
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public boolean isSuccess()
	{
		return isParsed() && !hasErrors();
	}
}
