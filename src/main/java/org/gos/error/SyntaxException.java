package org.gos.error;

public final class SyntaxException extends GosException
{
	private final String detail;

	public SyntaxException(int line, int column, String detail)
	{
		super(String.format("Syntax error at line %d, column %d: %s", line, column, detail), line, column);
		this.detail = detail;
	}

	public String getDetail()
	{
		return detail;
	}
}
