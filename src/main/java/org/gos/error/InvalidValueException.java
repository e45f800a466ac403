package org.gos.error;

public final class InvalidValueException extends GosException
{
	public InvalidValueException(String detail, int line, int column)
	{
		super(String.format("Invalid value: %s at line %d, column %d", detail, line, column), line, column);
	}
}
