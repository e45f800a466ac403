package org.gos.dto;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.LinkedHashMap;
import java.util.Map;

public class OpDict
{
	public Map<String, JsonElement> metas = new LinkedHashMap<>();
	// spec name -> {dtype, length|range, choice, default, ...}
	public Map<String, JsonObject> inputs = new LinkedHashMap<>();
	public Map<String, JsonObject> outputs = new LinkedHashMap<>();
	public Map<String, JsonObject> configs = new LinkedHashMap<>();
	public GraphDict graph;

	public JsonObject toJson()
	{
		JsonObject json = new JsonObject();
		JsonFields.put(json, "metas", metas);
		JsonFields.put(json, "inputs", inputs);
		JsonFields.put(json, "outputs", outputs);
		JsonFields.put(json, "configs", configs);
		if (graph != null)
		{
			json.add("graph", graph.toJson());
		}
		return json;
	}
}
