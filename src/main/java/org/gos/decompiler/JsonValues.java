package org.gos.decompiler;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Source renderings of IR values.
 */
public final class JsonValues
{
	private static final Pattern NUMBER = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

	private JsonValues()
	{
	}

	/**
	 * Rewrites escape sequences left in string leaves by producers that double-escaped them.
	 */
	public static JsonElement unescape(JsonElement value)
	{
		if (value.isJsonObject())
		{
			JsonObject copy = new JsonObject();
			for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet())
			{
				copy.add(entry.getKey(), unescape(entry.getValue()));
			}
			return copy;
		}
		if (value.isJsonArray())
		{
			JsonArray copy = new JsonArray();
			value.getAsJsonArray().forEach(item -> copy.add(unescape(item)));
			return copy;
		}
		if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString())
		{
			return new JsonPrimitive(unescape(value.getAsString()));
		}
		return value;
	}

	static String unescape(String text)
	{
		return text.replace("\\n", "\n")
				.replace("\\t", "\t")
				.replace("\\r", "\r")
				.replace("\\\\", "\\")
				.replace("\\\"", "\"")
				.replace("\\'", "'");
	}

	public static String quote(String text)
	{
		return "'" + text.replace("'", "\\'") + "'";
	}

	/**
	 * Single-line rendering: strings quoted, objects as {@code {k:v}}, arrays as {@code [a,b]}.
	 */
	public static String format(JsonElement value)
	{
		if (value == null || value.isJsonNull())
		{
			return "null";
		}
		if (value.isJsonObject())
		{
			List<String> entries = new ArrayList<>();
			for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet())
			{
				entries.add(formatKey(entry.getKey()) + ":" + format(entry.getValue()));
			}
			return "{" + String.join(",", entries) + "}";
		}
		if (value.isJsonArray())
		{
			List<String> items = new ArrayList<>();
			value.getAsJsonArray().forEach(item -> items.add(format(item)));
			return "[" + String.join(",", items) + "]";
		}
		JsonPrimitive primitive = value.getAsJsonPrimitive();
		if (primitive.isString())
		{
			return quote(primitive.getAsString());
		}
		if (primitive.isBoolean())
		{
			return Boolean.toString(primitive.getAsBoolean());
		}
		return primitive.getAsNumber().toString();
	}

	public static String formatKey(String key)
	{
		return Identifiers.isIdentifier(key) ? key : quote(key);
	}

	/**
	 * Node inputs name other nodes' outputs, so identifier and numeric strings stay bare.
	 */
	public static String formatInput(JsonElement value)
	{
		if (value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isString())
		{
			String text = value.getAsString();
			if (Identifiers.isIdentifier(text) || NUMBER.matcher(text).matches())
			{
				return text;
			}
		}
		return format(value);
	}

	/**
	 * Value of a {@code key=value} input: a one-element array collapses to its element,
	 * longer arrays render as a tuple.
	 */
	public static String formatKeyInput(JsonElement value)
	{
		if (value != null && value.isJsonArray())
		{
			JsonArray array = value.getAsJsonArray();
			if (array.size() == 1)
			{
				return formatInput(array.get(0));
			}
			List<String> items = new ArrayList<>();
			array.forEach(item -> items.add(formatInput(item)));
			return "(" + String.join(",", items) + ")";
		}
		return formatInput(value);
	}

	static String stringOrNull(JsonObject object, String member)
	{
		JsonElement value = object.get(member);
		if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString())
		{
			return null;
		}
		return value.getAsString();
	}
}
