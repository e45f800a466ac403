package org.gos.printer;

import java.util.List;

/**
 * Output buffer shared by the decompiler and the formatter.
 * <p>
 * Owns the indentation width and the column budget of one rendering call and tracks the column
 * the next character will land on, so every wrap decision is taken against the real line length.
 * An indentation width of {@code 0} selects the compact layout: no indentation and no wrapping.
 */
public class SourceWriter
{
	private final StringBuilder buffer = new StringBuilder();
	private final int indentWidth;
	private final int maxCol;
	private int column;

	public SourceWriter(int indentWidth, int maxCol)
	{
		if (indentWidth < 0)
		{
			throw new IllegalArgumentException("Indent must not be negative: " + indentWidth);
		}
		if (maxCol <= 0)
		{
			throw new IllegalArgumentException("Max column must be positive: " + maxCol);
		}
		this.indentWidth = indentWidth;
		this.maxCol = maxCol;
	}

	/**
	 * A writer that never wraps, used to measure the single-line form of a construct.
	 */
	public static SourceWriter singleLine()
	{
		return new SourceWriter(0, Integer.MAX_VALUE);
	}

	public int getIndentWidth()
	{
		return indentWidth;
	}

	public int getMaxCol()
	{
		return maxCol;
	}

	/**
	 * Number of characters already written on the current line.
	 */
	public int column()
	{
		return column;
	}

	public boolean isCompact()
	{
		return indentWidth == 0;
	}

	public SourceWriter write(String text)
	{
		buffer.append(text);
		int lastNewline = text.lastIndexOf('\n');
		column = lastNewline < 0 ? column + text.length() : text.length() - lastNewline - 1;
		return this;
	}

	public SourceWriter write(char c)
	{
		buffer.append(c);
		column = c == '\n' ? 0 : column + 1;
		return this;
	}

	/**
	 * True when {@code length} more characters still fit on the current line. Always true in compact mode.
	 */
	public boolean fits(int length)
	{
		return isCompact() || column + length <= maxCol;
	}

	/**
	 * Starts a new line indented to {@code level}. Unconditional: used where one statement per
	 * line is kept even in compact mode.
	 */
	public void line(int level)
	{
		buffer.append('\n');
		column = 0;
		pad(level * indentWidth);
	}

	/**
	 * Starts a new line indented to {@code level}, or does nothing in compact mode.
	 */
	public void softLine(int level)
	{
		if (!isCompact())
		{
			line(level);
		}
	}

	/**
	 * Starts a new line aligned to an absolute column, or does nothing in compact mode.
	 */
	public void breakAt(int col)
	{
		if (isCompact())
		{
			return;
		}
		buffer.append('\n');
		column = 0;
		pad(col);
	}

	/**
	 * Column-budget list layout: the single-line join when it fits, otherwise one item per line
	 * aligned to the column the list started at. The delimiter follows every item but the last.
	 */
	public void writeList(List<String> items, String delimiter)
	{
		String candidate = String.join(delimiter, items);
		if (fits(candidate.length()))
		{
			write(candidate);
			return;
		}
		int startCol = column;
		for (int i = 0; i < items.size(); i++)
		{
			if (i > 0)
			{
				write(delimiter.stripTrailing());
				breakAt(startCol);
			}
			write(items.get(i));
		}
	}

	/**
	 * Writes {@code suffix} on the current line when it fits, else on a new line at {@code level}.
	 */
	public void writeWrapped(String suffix, int level)
	{
		if (fits(suffix.length()))
		{
			write(suffix);
			return;
		}
		softLine(level);
		write(suffix.stripLeading());
	}

	private void pad(int spaces)
	{
		buffer.append(" ".repeat(Math.max(0, spaces)));
		column += Math.max(0, spaces);
	}

	public boolean isEmpty()
	{
		return buffer.length() == 0;
	}

	@Override
	public String toString()
	{
		return buffer.toString();
	}
}
