package org.gos.decompiler;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.gos.printer.SourceWriter;
import org.gos.util.Debug;
import org.gos.util.FileUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Turns compiled IR back into GOS source text.
 * <p>
 * Output order is fixed: every graph, then every operation, then bare top-level nodes, each
 * section separated by a blank line. Each instance owns its options, so decompilers with different
 * settings can run side by side.
 */
public class Decompiler
{
	private final DecompileOptions options;

	public Decompiler()
	{
		this(DecompileOptions.defaults());
	}

	public Decompiler(DecompileOptions options)
	{
		this.options = options;
	}

	public static String decompile(JsonElement ir, DecompileOptions options)
	{
		return new Decompiler(options).decompile(ir);
	}

	/**
	 * @throws DecompileException when the IR is malformed or carries an invalid identifier
	 */
	public String decompile(JsonElement ir)
	{
		if (ir == null || !ir.isJsonObject())
		{
			throw new DecompileException("Decompile input must be a JSON object");
		}
		JsonObject root = (options.isUnescape() ? JsonValues.unescape(ir) : ir).getAsJsonObject();

		SourceWriter writer = new SourceWriter(options.getIndent(), options.getMaxCol());
		GraphDecompiler graphs = new GraphDecompiler(writer, options.isKeepOrder());

		JsonElement graphList = root.get("graphs");
		if (graphList != null && !graphList.isJsonNull())
		{
			if (!graphList.isJsonArray())
			{
				throw new DecompileException("Graphs must be an array");
			}
			for (JsonElement graph : graphList.getAsJsonArray())
			{
				separate(writer);
				graphs.decompile(graph, 0);
			}
		}

		JsonElement opList = root.get("ops");
		if (opList != null && opList.isJsonArray())
		{
			OpDecompiler ops = new OpDecompiler(writer, graphs);
			for (JsonElement op : opList.getAsJsonArray())
			{
				separate(writer);
				ops.decompile(op, 0);
			}
		}

		JsonElement nodes = root.get("nodes");
		if (nodes != null && nodes.isJsonObject())
		{
			separate(writer);
			boolean first = true;
			for (Map.Entry<String, JsonElement> entry : graphs.entries(nodes.getAsJsonObject()))
			{
				if (!first)
				{
					writer.softLine(0);
				}
				first = false;
				new NodeDecompiler(entry.getKey(), entry.getValue(), writer, 0).decompile();
			}
		}

		Debug.logDebug("Decompiled IR into " + writer.toString().length() + " characters");
		return writer.toString();
	}

	/**
	 * Reads a JSON IR file and decompiles it.
	 */
	public String decompileFile(Path path)
	{
		if (path == null || !Files.isRegularFile(path))
		{
			throw new DecompileException("File " + path + " not found");
		}
		JsonElement ir;
		try
		{
			ir = JsonParser.parseString(FileUtils.read(path));
		}
		catch (JsonParseException e)
		{
			throw new DecompileException("File " + path + " is not valid JSON: " + e.getMessage(), e);
		}
		return decompile(ir);
	}

	/**
	 * Blank line between top-level blocks; nothing before the first one.
	 */
	private static void separate(SourceWriter writer)
	{
		if (!writer.isEmpty())
		{
			writer.write("\n\n");
		}
	}
}
