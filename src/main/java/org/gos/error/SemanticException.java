package org.gos.error;

public final class SemanticException extends GosException
{
	public SemanticException(int line, int column, String detail)
	{
		super(String.format("Semantic error at line %d, column %d: %s", line, column, detail), line, column);
	}
}
