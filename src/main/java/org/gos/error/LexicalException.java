package org.gos.error;

public final class LexicalException extends GosException
{
	private final char character;

	public LexicalException(int line, int column, char character)
	{
		super(String.format("Lexical error at line %d, column %d: illegal character '%c'", line, column, character), line, column);
		this.character = character;
	}

	public char getCharacter()
	{
		return character;
	}
}
