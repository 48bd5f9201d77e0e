package org.jaclang.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.jaclang.ast.declarations.JacModule;
import org.jaclang.util.Debug;
import org.jaclang.util.ErrorHandler;
import org.jaclang.util.SyntaxErrorListener;

/**
 * Front end for a single module: lexes and parses the source, then builds the AST
 * and attaches comments to it.
 */
public class JacSourceParser
{
	private final ErrorHandler errorHandler;

	public JacSourceParser(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * @return the module tree, or null when the source has syntax errors (they are
	 * reported to the error handler)
	 */
	public JacModule parse(String source)
	{
		CharStream input = CharStreams.fromString(source, errorHandler.getModuleName());
		JacLexer lexer = new JacLexer(input);
		CommonTokenStream tokens = new CommonTokenStream(lexer);
		JacParser parser = new JacParser(tokens);

		// Remove default error listeners to use our own
		SyntaxErrorListener listener = new SyntaxErrorListener(errorHandler);
		lexer.removeErrorListeners();
		lexer.addErrorListener(listener);
		parser.removeErrorListeners();
		parser.addErrorListener(listener);

		ParseTree tree = parser.moduleUnit();
		if (parser.getNumberOfSyntaxErrors() > 0 || errorHandler.hasErrors())
		{
			Debug.logError("Parsing failed due to syntax errors in " + errorHandler.getModuleName());
			return null;
		}

		JacModule module = (JacModule) new AstBuilder(errorHandler.getModuleName()).visit(tree);
		new CommentAttacher(tokens).attach(module);
		return module;
	}
}
