package org.gos.parser;

import org.gos.ast.AstNode.Module;
import org.gos.error.GosException;

/**
 * Turns GOS source text into a syntax tree.
 */
public interface SourceParser
{
	/**
	 * @throws GosException for the first problem found in {@code source}
	 */
	Module parse(String source);
}
