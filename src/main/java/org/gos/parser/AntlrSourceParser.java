package org.gos.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.gos.ast.AstNode.Module;
import org.gos.error.GrammarException;
import org.gos.util.Debug;
import org.gos.util.ErrorHandler;
import org.gos.util.SyntaxErrorListener;

/**
 * {@link SourceParser} backed by the generated ANTLR lexer and parser.
 * <p>
 * Lexer and parser errors are collected through a {@link SyntaxErrorListener}; the first one
 * is thrown once the parse has finished. Warnings (deprecated syntax) stay in the handler.
 */
public class AntlrSourceParser implements SourceParser
{
	@Override
	public Module parse(String source)
	{
		return parse(source, new ErrorHandler());
	}

	public Module parse(String source, ErrorHandler errorHandler)
	{
		CharStream input = CharStreams.fromString(source);
		GosLexer lexer = new GosLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(new SyntaxErrorListener(errorHandler));

		CommonTokenStream tokens = new CommonTokenStream(lexer);
		GosParser parser = new GosParser(tokens);
		parser.removeErrorListeners();
		parser.addErrorListener(new SyntaxErrorListener(errorHandler));

		GosParser.ModuleContext tree;
		try
		{
			tree = parser.module();
		}
		catch (RuntimeException e)
		{
			throw new GrammarException(String.valueOf(e.getMessage()), e);
		}
		errorHandler.throwIfErrors();

		Debug.logDebug("Parsed " + tokens.size() + " tokens");
		return (Module) new AstBuilder(tokens, errorHandler).visit(tree);
	}
}
