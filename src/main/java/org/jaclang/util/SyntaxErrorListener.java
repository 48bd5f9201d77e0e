package org.jaclang.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.jaclang.ast.SourceLocation;

/**
 * Routes lexer and parser errors into the module's {@link ErrorHandler}.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final ErrorHandler errorHandler;

	public SyntaxErrorListener(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		SourceLocation location = new SourceLocation(line, charPositionInLine + 1, line, charPositionInLine + 1);
		errorHandler.report(DiagnosticKind.SYNTAX_ERROR, location, msg);
	}
}
