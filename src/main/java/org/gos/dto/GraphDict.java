package org.gos.dto;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.LinkedHashMap;
import java.util.Map;

public class GraphDict
{
	public Map<String, JsonElement> properties = new LinkedHashMap<>();
	// keyed by the node's first output
	public Map<String, NodeDict> nodes = new LinkedHashMap<>();
	public String alias;
	public String version;
	public String templateGraph;
	public String templateVersion;

	public JsonObject toJson()
	{
		JsonObject json = new JsonObject();
		JsonFields.put(json, "properties", properties);
		if (!nodes.isEmpty())
		{
			JsonObject nodesJson = new JsonObject();
			nodes.forEach((key, node) -> nodesJson.add(key, node.toJson()));
			json.add("nodes", nodesJson);
		}
		JsonFields.put(json, "as", alias);
		JsonFields.put(json, "version", version);
		JsonFields.put(json, "template_graph", templateGraph);
		JsonFields.put(json, "template_version", templateVersion);
		return json;
	}
}
