package org.gos.error;

/**
 * Failure of the parsing engine itself, passed through unchanged.
 */
public final class GrammarException extends GosException
{
	public GrammarException(String detail, Throwable cause)
	{
		super("Grammar error: " + detail, cause);
	}
}
