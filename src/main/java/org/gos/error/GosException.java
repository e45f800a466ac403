package org.gos.error;

import java.util.OptionalInt;

/**
 * Root of the GOS diagnostic taxonomy. The set of diagnostics is closed; position-carrying
 * variants report where in the source they were raised.
 */
public abstract sealed class GosException extends RuntimeException
		permits SyntaxException, LexicalException, SemanticException, DuplicateDefinitionException,
		DeprecatedFeatureException, UnsupportedFeatureException, InvalidValueException,
		GeneralException, GosIoException, GrammarException
{
	private final int line;
	private final int column;

	protected GosException(String message, int line, int column)
	{
		super(message);
		this.line = line;
		this.column = column;
	}

	protected GosException(String message, Throwable cause)
	{
		super(message, cause);
		this.line = -1;
		this.column = -1;
	}

	protected GosException(String message)
	{
		this(message, -1, -1);
	}

	public OptionalInt getLine()
	{
		return line < 0 ? OptionalInt.empty() : OptionalInt.of(line);
	}

	public OptionalInt getColumn()
	{
		return column < 0 ? OptionalInt.empty() : OptionalInt.of(column);
	}
}
