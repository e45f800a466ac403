package org.gos.error;

public final class DuplicateDefinitionException extends GosException
{
	private final String name;

	public DuplicateDefinitionException(String name, int line, int column)
	{
		super(String.format("Duplicate definition: %s at line %d, column %d", name, line, column), line, column);
		this.name = name;
	}

	public static DuplicateDefinitionException graphAlias(String alias, int line, int column)
	{
		return new DuplicateDefinitionException("graph as '" + alias + "'", line, column);
	}

	public static DuplicateDefinitionException opAlias(String alias, int line, int column)
	{
		return new DuplicateDefinitionException("op as '" + alias + "'", line, column);
	}

	public static DuplicateDefinitionException importAlias(String alias, int line, int column)
	{
		return new DuplicateDefinitionException("import as '" + alias + "'", line, column);
	}

	public String getName()
	{
		return name;
	}
}
