package org.gos.format;

import org.gos.ast.AstNode;
import org.gos.parser.AntlrSourceParser;
import org.gos.printer.SourceWriter;
import org.gos.util.Debug;
import org.gos.util.FileUtils;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pretty-prints GOS syntax trees. Unlike the decompiler it works on the tree itself, so comments
 * written next to statements survive formatting.
 */
public final class Formatter
{
	private Formatter()
	{
	}

	public static String format(AstNode root)
	{
		return format(root, FormatOptions.defaults());
	}

	/**
	 * @throws FormatException when the tree holds a construct that has no source form
	 */
	public static String format(AstNode root, FormatOptions options)
	{
		SourceWriter writer = new SourceWriter(options.getIndent(), options.getMaxCol());
		root.accept(new AstFormatter(writer));
		return writer.toString();
	}

	/**
	 * Single-line source form of a node, as the compiler stores condition expressions.
	 */
	public static String formatInline(AstNode node)
	{
		return AstFormatter.inline(node);
	}

	public static String formatSource(String source)
	{
		return formatSource(source, FormatOptions.defaults());
	}

	public static String formatSource(String source, FormatOptions options)
	{
		return format(new AntlrSourceParser().parse(source), options);
	}

	public static String formatFile(Path path, FormatOptions options)
	{
		if (path == null || path.toString().isEmpty())
		{
			throw new FormatException("Filename cannot be empty");
		}
		if (!Files.isRegularFile(path))
		{
			throw new FormatException("File " + path + " not found");
		}
		Debug.logDebug("Formatting " + path);
		return formatSource(FileUtils.read(path), options);
	}
}
