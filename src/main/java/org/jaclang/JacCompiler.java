package org.jaclang;

import org.jaclang.ast.declarations.JacModule;
import org.jaclang.codegen.JacFormatter;
import org.jaclang.parser.JacSourceParser;
import org.jaclang.semantic.ModuleRegistry;
import org.jaclang.semantic.SemanticAnalyzer;
import org.jaclang.util.CompilerSettings;
import org.jaclang.util.Debug;
import org.jaclang.util.ErrorHandler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Compiles Jac modules: parse, build scopes, resolve definitions and uses, then
 * format. Modules compiled by the same instance share a {@link ModuleRegistry}, so a
 * module can include any module compiled before it.
 */
public class JacCompiler
{
	public static final String SOURCE_EXTENSION = ".jac";

	private final CompilerSettings settings;
	private final ModuleRegistry registry;

	public JacCompiler()
	{
		this(CompilerSettings.load(), new ModuleRegistry());
	}

	public JacCompiler(CompilerSettings settings, ModuleRegistry registry)
	{
		this.settings = settings;
		this.registry = registry;
		if (settings.isDebug())
		{
			Debug.ENABLE_DEBUG = true;
		}
	}

	/**
	 * Compiles one module. Resolution diagnostics do not stop the pipeline: the module
	 * is still registered and formatted. Syntax errors do.
	 *
	 * @param source     The module's source text.
	 * @param moduleName The dotted name other modules include it by.
	 */
	public CompilationResult compile(String source, String moduleName)
	{
		Debug.logDebug("\nCompiling module '" + moduleName + "'...");
		ErrorHandler errorHandler = new ErrorHandler(moduleName);

		JacModule module = new JacSourceParser(errorHandler).parse(source);
		if (module == null)
		{
			Debug.logError("Compilation of '" + moduleName + "' stopped after parsing.");
			return CompilationResult.syntaxError(moduleName, errorHandler.getDiagnostics());
		}

		SemanticAnalyzer analyzer = new SemanticAnalyzer(errorHandler, registry);
		analyzer.analyze(module);
		registry.register(module);

		String formatted = new JacFormatter(settings).format(module);
		if (!errorHandler.hasErrors())
		{
			Debug.logInfo("Compiled '" + moduleName + "'.");
		}
		return new CompilationResult(moduleName, module, analyzer.getRootScope(), errorHandler.getDiagnostics(), formatted);
	}

	/**
	 * Compiles a source file; the module is named after the file.
	 */
	public CompilationResult compile(Path file) throws IOException
	{
		String fileName = file.getFileName().toString();
		String moduleName = fileName.endsWith(SOURCE_EXTENSION)
				? fileName.substring(0, fileName.length() - SOURCE_EXTENSION.length())
				: fileName;
		return compile(Files.readString(file), moduleName);
	}

	/**
	 * Formats source text without running the semantic passes.
	 *
	 * @return the canonical text, or empty when the source does not parse
	 */
	public Optional<String> format(String source)
	{
		ErrorHandler errorHandler = new ErrorHandler("<format>");
		JacModule module = new JacSourceParser(errorHandler).parse(source);
		if (module == null)
		{
			return Optional.empty();
		}
		return Optional.of(new JacFormatter(settings).format(module));
	}

	public ModuleRegistry getRegistry()
	{
		return registry;
	}

	public CompilerSettings getSettings()
	{
		return settings;
	}
}
