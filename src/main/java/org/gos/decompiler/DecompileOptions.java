package org.gos.decompiler;

/**
 * Immutable decompiler settings, threaded through every rendering call.
 */
public final class DecompileOptions
{
	public static final int DEFAULT_INDENT = 4;
	public static final int DEFAULT_MAX_COL = 100;

	private final int indent;
	private final int maxCol;
	private final boolean unescape;
	private final boolean keepOrder;

	private DecompileOptions(Builder builder)
	{
		this.indent = builder.indent;
		this.maxCol = builder.maxCol;
		this.unescape = builder.unescape;
		this.keepOrder = builder.keepOrder;
	}

	public static DecompileOptions defaults()
	{
		return builder().build();
	}

	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Spaces per nesting level; {@code 0} renders everything compactly without wrapping.
	 */
	public int getIndent()
	{
		return indent;
	}

	public int getMaxCol()
	{
		return maxCol;
	}

	public boolean isUnescape()
	{
		return unescape;
	}

	public boolean isKeepOrder()
	{
		return keepOrder;
	}

	public static final class Builder
	{
		private int indent = DEFAULT_INDENT;
		private int maxCol = DEFAULT_MAX_COL;
		private boolean unescape = false;
		private boolean keepOrder = false;

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

		public Builder unescape(boolean unescape)
		{
			this.unescape = unescape;
			return this;
		}

		/**
		 * Keep the producer's node order; otherwise nodes are rendered sorted by key.
		 */
		public Builder keepOrder(boolean keepOrder)
		{
			this.keepOrder = keepOrder;
			return this;
		}

		public DecompileOptions build()
		{
			return new DecompileOptions(this);
		}
	}
}
