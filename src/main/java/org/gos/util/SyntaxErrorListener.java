package org.gos.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.Interval;
import org.gos.error.LexicalException;
import org.gos.error.SyntaxException;

/**
 * Routes ANTLR lexer and parser errors into an {@link ErrorHandler} as GOS diagnostics.
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
		int column = charPositionInLine + 1;
		if (recognizer instanceof Lexer lexer)
		{
			int start = lexer._tokenStartCharIndex;
			String text = lexer.getInputStream().getText(Interval.of(start, start));
			char illegal = text.isEmpty() ? '?' : text.charAt(0);
			errorHandler.logError(new LexicalException(line, column, illegal));
			return;
		}
		errorHandler.logError(new SyntaxException(line, column, "parsing error, " + msg));
	}
}
