package org.gos.error;

public final class GeneralException extends GosException
{
	public GeneralException(String detail)
	{
		super("Parse error: " + detail);
	}
}
