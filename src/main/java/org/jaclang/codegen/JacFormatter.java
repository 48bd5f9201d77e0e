package org.jaclang.codegen;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.declarations.JacModule;
import org.jaclang.util.CompilerSettings;
import org.jaclang.util.Debug;

/**
 * Produces the canonical source text of a module, or of any subtree on its own.
 */
public class JacFormatter
{
	private final CompilerSettings settings;

	public JacFormatter(CompilerSettings settings)
	{
		this.settings = settings;
	}

	public String format(JacModule module)
	{
		Debug.logDebug("Formatting module '" + module.getName() + "'...");
		return format((AstNode) module);
	}

	/**
	 * Formats a node and everything below it. Each visited node keeps its text in
	 * {@link AstNode#getGeneratedText()}.
	 */
	public String format(AstNode node)
	{
		String text = node.accept(new FormatVisitor(settings));
		return text != null ? text : "";
	}
}
