package org.gos.ast;

import java.util.Objects;

/**
 * Source span of an AST node. Lines and columns are 1-based; {@code endCol} is the column just
 * past the last character.
 * The span is the only mutable part of a node, so the builder can widen it once all
 * tokens of a construct are known.
 */
public final class Position
{
	private int line;
	private int endLine;
	private int startCol;
	private int endCol;

	public Position(int line, int endLine, int startCol, int endCol)
	{
		set(line, endLine, startCol, endCol);
	}

	public static Position of(int line, int startCol, int endCol)
	{
		return new Position(line, line, startCol, endCol);
	}

	/**
	 * A position for nodes built by hand, outside of any source file.
	 */
	public static Position synthetic()
	{
		return new Position(1, 1, 1, 1);
	}

	public void set(int line, int endLine, int startCol, int endCol)
	{
		if (endLine < line || (endLine == line && endCol < startCol))
		{
			throw new IllegalArgumentException("Span ends before it starts: " + line + ":" + startCol + " - " + endLine + ":" + endCol);
		}
		this.line = line;
		this.endLine = endLine;
		this.startCol = startCol;
		this.endCol = endCol;
	}

	public Position copy()
	{
		return new Position(line, endLine, startCol, endCol);
	}

	public int getLine()
	{
		return line;
	}

	public int getEndLine()
	{
		return endLine;
	}

	public int getStartCol()
	{
		return startCol;
	}

	public int getEndCol()
	{
		return endCol;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof Position other))
		{
			return false;
		}
		return line == other.line && endLine == other.endLine && startCol == other.startCol && endCol == other.endCol;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(line, endLine, startCol, endCol);
	}

	@Override
	public String toString()
	{
		return line + ":" + startCol + "-" + endLine + ":" + endCol;
	}
}
