package org.gos.dto;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One compiled graph node. Either {@code opName} or {@code refGraph} is set.
 */
public class NodeDict
{
	public String opName;
	public String refGraph;
	public String version;
	public List<String> output = new ArrayList<>();
	// array for positional inputs, object for key=value inputs
	public JsonElement input;
	public List<String> depend = new ArrayList<>();
	public Map<String, JsonElement> with = new LinkedHashMap<>();
	public Map<String, JsonElement> property = new LinkedHashMap<>();
	public Map<String, JsonElement> log = new LinkedHashMap<>();
	public Map<String, JsonElement> metrics = new LinkedHashMap<>();
	public Map<String, JsonElement> funnel = new LinkedHashMap<>();
	public String alias;
	public boolean start;
	public boolean end;
	public JsonElement override;
	public JsonObject forLoop;

	// conditional nodes only
	public String condition;
	public NodeDict trueBranch;
	public NodeDict falseBranch;

	public JsonObject toJson()
	{
		JsonObject json = new JsonObject();
		JsonFields.put(json, "op_name", opName);
		JsonFields.put(json, "ref_graph", refGraph);
		JsonFields.put(json, "version", version);
		JsonFields.put(json, "output", output);
		JsonFields.put(json, "input", input);
		JsonFields.put(json, "depend", depend);
		JsonFields.put(json, "with", with);
		JsonFields.put(json, "property", property);
		JsonFields.put(json, "log", log);
		JsonFields.put(json, "metrics", metrics);
		JsonFields.put(json, "funnel", funnel);
		JsonFields.put(json, "as", alias);
		if (start)
		{
			json.addProperty("start", true);
		}
		if (end)
		{
			json.addProperty("end", true);
		}
		JsonFields.put(json, "override", override);
		JsonFields.put(json, "for_loop", forLoop);
		JsonFields.put(json, "condition", condition);
		if (trueBranch != null)
		{
			json.add("true_branch", trueBranch.toJson());
		}
		if (falseBranch != null)
		{
			json.add("false_branch", falseBranch.toJson());
		}
		return json;
	}
}
