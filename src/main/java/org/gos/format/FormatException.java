package org.gos.format;

/**
 * Raised when a tree or a source file cannot be formatted.
 */
public class FormatException extends RuntimeException
{
	public FormatException(String message)
	{
		super(message);
	}
}
