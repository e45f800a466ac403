package org.gos.decompiler;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.gos.printer.SourceWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders one IR operation: {@code meta}, {@code input}, {@code output} and {@code config}
 * sections, an optional embedded graph, then the alias taken from the metas.
 */
class OpDecompiler
{
	private static final String[][] SECTIONS = {{"inputs", "input"}, {"outputs", "output"}, {"configs", "config"}};

	private final SourceWriter writer;
	private final GraphDecompiler graphs;

	OpDecompiler(SourceWriter writer, GraphDecompiler graphs)
	{
		this.writer = writer;
		this.graphs = graphs;
	}

	void decompile(JsonElement element, int level)
	{
		if (element == null || !element.isJsonObject())
		{
			throw new DecompileException("Operation must be a JSON object");
		}
		JsonObject op = element.getAsJsonObject();

		JsonObject metas = new JsonObject();
		JsonElement declared = op.get("metas");
		if (declared != null && declared.isJsonObject())
		{
			declared.getAsJsonObject().entrySet().forEach(entry -> metas.add(entry.getKey(), entry.getValue()));
		}
		String alias = metaText(metas, op, "as");
		String version = metaText(metas, op, "version");
		metas.remove("as");
		metas.remove("version");

		writer.write("op {");
		if (metas.size() > 0)
		{
			writer.softLine(level + 1);
			writer.write("meta {");
			writer.softLine(level + 2);
			new ParamFormatter(writer).write(metas, "op metas");
			writer.write(";");
			writer.softLine(level + 1);
			writer.write("};");
		}

		for (String[] section : SECTIONS)
		{
			JsonElement specs = op.get(section[0]);
			if (specs != null && specs.isJsonObject())
			{
				writer.softLine(level + 1);
				writer.write(section[1] + " {");
				for (Map.Entry<String, JsonElement> spec : specs.getAsJsonObject().entrySet())
				{
					writer.softLine(level + 2);
					writer.write(Identifiers.checkId(spec.getKey()) + ":(" + formatSpec(spec.getValue()) + ");");
				}
				writer.softLine(level + 1);
				writer.write("};");
			}
		}

		JsonElement graph = op.get("graph");
		if (graph != null && !graph.isJsonNull())
		{
			writer.softLine(level + 1);
			graphs.decompile(graph, level + 1);
		}

		writer.softLine(level);
		writer.write("}");
		if (alias != null)
		{
			writer.write(" as " + Identifiers.checkId(alias));
			if (version != null)
			{
				writer.write(".version(" + JsonValues.quote(Identifiers.checkVersion(version)) + ")");
			}
		}
		writer.write(";");
	}

	private static String metaText(JsonObject metas, JsonObject op, String name)
	{
		String value = JsonValues.stringOrNull(metas, name);
		return value != null ? value : JsonValues.stringOrNull(op, name);
	}

	/**
	 * {@code dtype=string,length=[1,100],choice=('a','b'),default=true}
	 */
	static String formatSpec(JsonElement spec)
	{
		if (spec == null || !spec.isJsonObject())
		{
			return "";
		}
		List<String> items = new ArrayList<>();
		for (Map.Entry<String, JsonElement> entry : spec.getAsJsonObject().entrySet())
		{
			JsonElement value = entry.getValue();
			String rendered = switch (entry.getKey())
			{
				case "dtype" -> value.isJsonPrimitive() ? value.getAsString() : JsonValues.format(value);
				case "length", "range" -> formatBounds(value);
				case "choice" -> formatChoice(value);
				default -> JsonValues.format(value);
			};
			items.add(Identifiers.checkId(entry.getKey()) + "=" + rendered);
		}
		return String.join(",", items);
	}

	/**
	 * {@code {eq:n}} as {@code n}; otherwise an interval whose bracket shape encodes inclusiveness.
	 */
	static String formatBounds(JsonElement value)
	{
		if (value == null || !value.isJsonObject())
		{
			return JsonValues.format(value);
		}
		JsonObject bounds = value.getAsJsonObject();
		if (bounds.has("eq"))
		{
			return JsonValues.format(bounds.get("eq"));
		}
		StringBuilder text = new StringBuilder();
		if (bounds.has("ge"))
		{
			text.append('[').append(JsonValues.format(bounds.get("ge")));
		}
		else if (bounds.has("gt"))
		{
			text.append('(').append(JsonValues.format(bounds.get("gt")));
		}
		else
		{
			text.append('[');
		}
		text.append(',');
		if (bounds.has("le"))
		{
			text.append(JsonValues.format(bounds.get("le"))).append(']');
		}
		else if (bounds.has("lt"))
		{
			text.append(JsonValues.format(bounds.get("lt"))).append(')');
		}
		else
		{
			text.append(']');
		}
		return text.toString();
	}

	private static String formatChoice(JsonElement value)
	{
		if (value == null || !value.isJsonArray())
		{
			return JsonValues.format(value);
		}
		List<String> choices = new ArrayList<>();
		value.getAsJsonArray().forEach(choice -> choices.add(JsonValues.format(choice)));
		return "(" + String.join(",", choices) + ")";
	}
}
