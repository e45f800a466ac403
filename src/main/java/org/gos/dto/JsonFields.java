package org.gos.dto;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Collection;
import java.util.Map;

/**
 * Helpers for writing IR objects: absent and empty fields are left out rather than written empty.
 */
final class JsonFields
{
	private JsonFields()
	{
	}

	static void put(JsonObject target, String name, String value)
	{
		if (value != null)
		{
			target.addProperty(name, value);
		}
	}

	static void put(JsonObject target, String name, JsonElement value)
	{
		if (value != null)
		{
			target.add(name, value);
		}
	}

	static void put(JsonObject target, String name, Collection<String> values)
	{
		if (values == null || values.isEmpty())
		{
			return;
		}
		JsonArray array = new JsonArray();
		values.forEach(array::add);
		target.add(name, array);
	}

	static void put(JsonObject target, String name, Map<String, ? extends JsonElement> values)
	{
		if (values == null || values.isEmpty())
		{
			return;
		}
		JsonObject object = new JsonObject();
		values.forEach(object::add);
		target.add(name, object);
	}
}
