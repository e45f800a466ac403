package org.gos.compiler;

/**
 * Immutable compiler settings. Defaults: no op name or subgraph listing, insertion order kept.
 */
public final class CompileOptions
{
	private final boolean returnOpNames;
	private final boolean returnSubgraphs;
	private final boolean keepOrder;

	private CompileOptions(Builder builder)
	{
		this.returnOpNames = builder.returnOpNames;
		this.returnSubgraphs = builder.returnSubgraphs;
		this.keepOrder = builder.keepOrder;
	}

	public static CompileOptions defaults()
	{
		return builder().build();
	}

	public static Builder builder()
	{
		return new Builder();
	}

	public boolean isReturnOpNames()
	{
		return returnOpNames;
	}

	public boolean isReturnSubgraphs()
	{
		return returnSubgraphs;
	}

	public boolean isKeepOrder()
	{
		return keepOrder;
	}

	public static final class Builder
	{
		private boolean returnOpNames = false;
		private boolean returnSubgraphs = false;
		private boolean keepOrder = true;

		private Builder()
		{
		}

		public Builder returnOpNames(boolean returnOpNames)
		{
			this.returnOpNames = returnOpNames;
			return this;
		}

		public Builder returnSubgraphs(boolean returnSubgraphs)
		{
			this.returnSubgraphs = returnSubgraphs;
			return this;
		}

		/**
		 * When false, property, node, variable and spec maps are emitted sorted by key.
		 */
		public Builder keepOrder(boolean keepOrder)
		{
			this.keepOrder = keepOrder;
			return this;
		}

		public CompileOptions build()
		{
			return new CompileOptions(this);
		}
	}
}
