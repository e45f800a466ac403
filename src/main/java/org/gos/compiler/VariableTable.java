package org.gos.compiler;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variables bound by {@code var} blocks, keyed by {@code alias.name} or the bare name.
 * Lookups are exact string matches; dotted paths are never evaluated.
 */
public class VariableTable
{
	private final Map<String, JsonElement> variables = new LinkedHashMap<>();

	// last write wins
	public void define(String key, JsonElement value)
	{
		variables.put(key, value);
	}

	public Optional<JsonElement> lookup(String key)
	{
		return Optional.ofNullable(variables.get(key));
	}

	/**
	 * Replaces every string that names a variable by that variable's value, recursing into
	 * arrays and objects. Returns a new element; the argument is left as is.
	 */
	public JsonElement resolve(JsonElement value)
	{
		if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString())
		{
			JsonElement bound = variables.get(value.getAsString());
			return bound == null ? value : bound.deepCopy();
		}
		if (value.isJsonArray())
		{
			JsonArray resolved = new JsonArray();
			for (JsonElement item : value.getAsJsonArray())
			{
				resolved.add(resolve(item));
			}
			return resolved;
		}
		if (value.isJsonObject())
		{
			JsonObject resolved = new JsonObject();
			for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet())
			{
				resolved.add(entry.getKey(), resolve(entry.getValue()));
			}
			return resolved;
		}
		return value;
	}

	public Map<String, JsonElement> asMap()
	{
		return Collections.unmodifiableMap(variables);
	}
}
