package org.gos.decompiler;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.gos.printer.SourceWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes {@code key=value} parameter lists (graph properties, op metas, {@code .with(...)} and
 * friends) under the writer's column budget. An entry that does not fit is broken open and its
 * object or array value is laid out one item per line, recursively.
 */
class ParamFormatter
{
	private final SourceWriter writer;

	ParamFormatter(SourceWriter writer)
	{
		this.writer = writer;
	}

	void write(JsonElement params, String owner)
	{
		if (params == null || !params.isJsonObject())
		{
			throw new DecompileException("Parameters of " + owner + " must be a JSON object");
		}
		JsonObject object = params.getAsJsonObject();
		List<String> entries = new ArrayList<>();
		for (Map.Entry<String, JsonElement> entry : object.entrySet())
		{
			entries.add(Identifiers.checkId(entry.getKey()) + "=" + JsonValues.format(entry.getValue()));
		}
		String candidate = String.join(",", entries);
		if (writer.fits(candidate.length()))
		{
			writer.write(candidate);
			return;
		}

		int startCol = writer.column();
		int i = 0;
		for (Map.Entry<String, JsonElement> entry : object.entrySet())
		{
			if (i > 0)
			{
				writer.write(",");
				writer.breakAt(startCol);
			}
			String rendered = entries.get(i++);
			if (writer.fits(rendered.length()))
			{
				writer.write(rendered);
			}
			else
			{
				writer.write(entry.getKey() + "=");
				writeValue(entry.getValue());
			}
		}
	}

	private void writeValue(JsonElement value)
	{
		String rendered = JsonValues.format(value);
		if (writer.fits(rendered.length()) || !(value.isJsonObject() || value.isJsonArray()))
		{
			writer.write(rendered);
			return;
		}

		int openCol = writer.column();
		int itemCol = openCol + writer.getIndentWidth();
		if (value.isJsonObject())
		{
			writer.write("{");
			int i = 0;
			JsonObject object = value.getAsJsonObject();
			for (Map.Entry<String, JsonElement> entry : object.entrySet())
			{
				writer.breakAt(itemCol);
				writer.write(JsonValues.formatKey(entry.getKey()) + ":");
				writeValue(entry.getValue());
				if (++i < object.size())
				{
					writer.write(",");
				}
			}
			writer.breakAt(openCol);
			writer.write("}");
			return;
		}

		JsonArray array = value.getAsJsonArray();
		writer.write("[");
		for (int i = 0; i < array.size(); i++)
		{
			writer.breakAt(itemCol);
			writeValue(array.get(i));
			if (i < array.size() - 1)
			{
				writer.write(",");
			}
		}
		writer.breakAt(openCol);
		writer.write("]");
	}
}
