package org.gos.decompiler;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.gos.printer.SourceWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders one IR graph object: header, property line, one line per node, closing alias.
 */
class GraphDecompiler
{
	private final SourceWriter writer;
	private final boolean keepOrder;

	GraphDecompiler(SourceWriter writer, boolean keepOrder)
	{
		this.writer = writer;
		this.keepOrder = keepOrder;
	}

	void decompile(JsonElement element, int level)
	{
		if (element == null || !element.isJsonObject())
		{
			throw new DecompileException("Graph must be a JSON object");
		}
		JsonObject graph = element.getAsJsonObject();

		String template = JsonValues.stringOrNull(graph, "template_graph");
		if (template != null)
		{
			writer.write("graph : " + Identifiers.checkId(template));
			String templateVersion = JsonValues.stringOrNull(graph, "template_version");
			if (templateVersion != null)
			{
				writer.write(".version(" + JsonValues.quote(Identifiers.checkVersion(templateVersion)) + ")");
			}
			writer.write(" {");
		}
		else
		{
			writer.write("graph {");
		}

		JsonElement properties = graph.has("properties") ? graph.get("properties") : graph.get("property");
		if (properties != null && !(properties.isJsonObject() && properties.getAsJsonObject().size() == 0))
		{
			writer.softLine(level + 1);
			new ParamFormatter(writer).write(properties, "graph properties");
			writer.write(";");
		}

		JsonElement nodes = graph.get("nodes");
		if (nodes != null && nodes.isJsonObject())
		{
			for (Map.Entry<String, JsonElement> entry : entries(nodes.getAsJsonObject()))
			{
				writer.softLine(level + 1);
				new NodeDecompiler(entry.getKey(), entry.getValue(), writer, level + 1).decompile();
			}
		}

		writer.softLine(level);
		writer.write("}");
		String alias = JsonValues.stringOrNull(graph, "as");
		if (alias != null)
		{
			writer.write(" as " + Identifiers.checkId(alias));
			String version = JsonValues.stringOrNull(graph, "version");
			if (version != null)
			{
				writer.write(".version(" + JsonValues.quote(Identifiers.checkVersion(version)) + ")");
			}
		}
		writer.write(";");
	}

	/**
	 * Node entries in render order: producer order, or sorted by key.
	 */
	List<Map.Entry<String, JsonElement>> entries(JsonObject nodes)
	{
		List<Map.Entry<String, JsonElement>> entries = new ArrayList<>(nodes.entrySet());
		if (!keepOrder)
		{
			entries.sort(Map.Entry.comparingByKey());
		}
		return entries;
	}
}
