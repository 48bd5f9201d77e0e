package org.jaclang.util;

/**
 * Recoverable problems collected during one compilation. Fatal consistency
 * violations are not diagnostics; they abort with {@link InternalCompilerError}.
 */
public enum DiagnosticKind
{
	SYNTAX_ERROR("Syntax", Severity.ERROR),
	DUPLICATE_DEFINITION("Semantic", Severity.ERROR),
	INVALID_ASSIGNMENT_TARGET("Semantic", Severity.ERROR),
	MODULE_NOT_FOUND("Semantic", Severity.ERROR),
	CYCLIC_INHERITANCE("Semantic", Severity.ERROR),
	UNRESOLVED_NAME("Semantic", Severity.WARNING),
	UNRESOLVED_ATTRIBUTE("Semantic", Severity.WARNING);

	private final String category;
	private final Severity severity;

	DiagnosticKind(String category, Severity severity)
	{
		this.category = category;
		this.severity = severity;
	}

	public String getCategory()
	{
		return category;
	}

	public Severity getSeverity()
	{
		return severity;
	}
}
