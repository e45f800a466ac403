package org.gos.decompiler;

/**
 * Raised when IR cannot be rendered back to source. The message describes the offending entry.
 */
public class DecompileException extends RuntimeException
{
	public DecompileException(String message)
	{
		super(message);
	}

	public DecompileException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
