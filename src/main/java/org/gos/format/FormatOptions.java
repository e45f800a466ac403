package org.gos.format;

/**
 * Immutable formatter settings.
 */
public final class FormatOptions
{
	public static final int DEFAULT_INDENT = 4;
	public static final int DEFAULT_MAX_COL = 100;

	private final int indent;
	private final int maxCol;

	private FormatOptions(Builder builder)
	{
		this.indent = builder.indent;
		this.maxCol = builder.maxCol;
	}

	public static FormatOptions defaults()
	{
		return builder().build();
	}

	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Spaces per nesting level; {@code 0} keeps one statement per line but drops indentation and wrapping.
	 */
	public int getIndent()
	{
		return indent;
	}

	public int getMaxCol()
	{
		return maxCol;
	}

	public static final class Builder
	{
		private int indent = DEFAULT_INDENT;
		private int maxCol = DEFAULT_MAX_COL;

		private Builder()
		{
		}

		public Builder indent(int indent)
		{
			if (indent < 0)
			{
				throw new IllegalArgumentException("Indent must not be negative: " + indent);
			}
			this.indent = indent;
			return this;
		}

		public Builder maxCol(int maxCol)
		{
			if (maxCol <= 0)
			{
				throw new IllegalArgumentException("Max column must be positive: " + maxCol);
			}
			this.maxCol = maxCol;
			return this;
		}

		public FormatOptions build()
		{
			return new FormatOptions(this);
		}
	}
}
