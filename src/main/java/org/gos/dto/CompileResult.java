package org.gos.dto;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one compile call. Empty sections are reported as absent.
 */
public class CompileResult
{
	public static final String GOS_VERSION = "0.5.2";

	private static final Gson GSON = new GsonBuilder()
			.setPrettyPrinting()
			.serializeNulls()
			.disableHtmlEscaping()
			.create();

	public List<GraphDict> graphs = new ArrayList<>();
	public List<OpDict> ops = new ArrayList<>();
	public Map<String, JsonElement> vars = new LinkedHashMap<>();
	public String gosVersion = GOS_VERSION;
	// only filled when requested through CompileOptions
	public List<String> opNames;
	public List<String> subgraphs;

	public boolean hasGraphs()
	{
		return !graphs.isEmpty();
	}

	public boolean hasOps()
	{
		return !ops.isEmpty();
	}

	public boolean hasVars()
	{
		return !vars.isEmpty();
	}

	public JsonObject toJson()
	{
		JsonObject json = new JsonObject();
		if (hasGraphs())
		{
			JsonArray array = new JsonArray();
			graphs.forEach(graph -> array.add(graph.toJson()));
			json.add("graphs", array);
		}
		if (hasOps())
		{
			JsonArray array = new JsonArray();
			ops.forEach(op -> array.add(op.toJson()));
			json.add("ops", array);
		}
		JsonFields.put(json, "vars", vars);
		json.addProperty("gos_version", gosVersion);
		if (opNames != null)
		{
			JsonArray array = new JsonArray();
			opNames.forEach(array::add);
			json.add("op_names", array);
		}
		if (subgraphs != null)
		{
			JsonArray array = new JsonArray();
			subgraphs.forEach(array::add);
			json.add("subgraphs", array);
		}
		return json;
	}

	public String toJsonString()
	{
		return GSON.toJson(toJson());
	}
}
