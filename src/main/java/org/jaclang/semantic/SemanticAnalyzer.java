package org.jaclang.semantic;

import org.jaclang.ast.declarations.JacModule;
import org.jaclang.semantic.symbol.Scope;
import org.jaclang.util.Debug;
import org.jaclang.util.ErrorHandler;

/**
 * Runs the semantic passes over one module. Each call uses fresh pass instances, so
 * independent modules can be analyzed by separate analyzers at the same time.
 */
public class SemanticAnalyzer
{
	private final ErrorHandler errorHandler;
	private final ModuleResolver moduleResolver;
	private Scope rootScope;

	public SemanticAnalyzer(ErrorHandler errorHandler, ModuleResolver moduleResolver)
	{
		this.errorHandler = errorHandler;
		this.moduleResolver = moduleResolver;
	}

	/**
	 * Scopes and resolves the module. Problems in the user's program are collected in
	 * the error handler; a broken tree aborts with an internal compiler error.
	 *
	 * @return true when no error-severity diagnostic was reported
	 */
	public boolean analyze(JacModule module)
	{
		Debug.logDebug("Starting semantic analysis of '" + module.getName() + "'...");

		// --- PASS 1: Scopes and hoisted declarations ---
		Debug.logDebug("PASS 1: Building symbol table...");
		rootScope = new SymbolTableBuilder(errorHandler).build(module);

		// --- PASS 2: Definitions and uses ---
		Debug.logDebug("PASS 2: Resolving definitions and uses...");
		new DefUseVisitor(errorHandler, moduleResolver).resolve(module);

		if (errorHandler.hasErrors())
		{
			Debug.logError("Semantic analysis of '" + module.getName() + "' finished with errors.");
			return false;
		}
		Debug.logDebug("Semantic analysis of '" + module.getName() + "' finished.");
		return true;
	}

	public Scope getRootScope()
	{
		return rootScope;
	}
}
