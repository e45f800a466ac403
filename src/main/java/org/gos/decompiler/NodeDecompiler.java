package org.gos.decompiler;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.gos.printer.SourceWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders one IR node as a source statement. Shapes are tried in order: for-loop, conditional,
 * then a plain op or graph call followed by its attribute chain.
 */
class NodeDecompiler
{
	static final String CONDITION_OP = "builtin.conditions.str";

	private static final String[] PARAM_ATTRS = {"property", "with", "log", "metrics", "funnel"};

	private final String key;
	private final JsonObject node;
	private final SourceWriter writer;
	private final int level;

	NodeDecompiler(String key, JsonElement node, SourceWriter writer, int level)
	{
		if (node == null || !node.isJsonObject())
		{
			throw new DecompileException("Node " + key + " must be a JSON object");
		}
		this.key = key;
		this.node = node.getAsJsonObject();
		this.writer = writer;
		this.level = level;
	}

	void decompile()
	{
		JsonElement output = node.get("output");
		if (output == null || !output.isJsonArray())
		{
			throw new DecompileException("Node " + key + " has no output");
		}
		List<String> outputs = new ArrayList<>();
		output.getAsJsonArray().forEach(item -> outputs.add(nameOf(item, "output")));
		boolean aliased = !String.join(",", outputs).equals(key);

		if (aliased)
		{
			List<String> shortNames = new ArrayList<>();
			for (String name : outputs)
			{
				shortNames.add(Identifiers.checkId(name.substring(name.lastIndexOf('.') + 1)));
			}
			writer.writeList(shortNames, ",");
		}
		else
		{
			outputs.forEach(Identifiers::checkId);
			writer.write(key);
		}
		writer.write(" = ");

		String alias = aliased ? key : null;
		JsonElement forLoop = node.get("for_loop");
		if (forLoop != null && forLoop.isJsonObject() && forLoop.getAsJsonObject().has("inputs")
				&& forLoop.getAsJsonObject().has("outputs"))
		{
			writeForLoop(forLoop.getAsJsonObject(), alias);
		}
		else if (CONDITION_OP.equals(JsonValues.stringOrNull(node, "op_name")))
		{
			writeCondition(node);
		}
		else
		{
			writeCall(node, alias);
		}
		writer.write(";");
	}

	private void writeForLoop(JsonObject forLoop, String alias)
	{
		writer.write("[");
		writeCall(node, alias);

		JsonElement loopOutputs = forLoop.get("outputs");
		List<String> names = new ArrayList<>();
		if (loopOutputs.isJsonArray())
		{
			loopOutputs.getAsJsonArray().forEach(item -> names.add(Identifiers.checkId(nameOf(item, "for_loop outputs"))));
		}
		else
		{
			names.add(Identifiers.checkId(nameOf(loopOutputs, "for_loop outputs")));
		}
		String inputs = Identifiers.checkId(nameOf(forLoop.get("inputs"), "for_loop inputs"));
		writer.writeWrapped(" for " + String.join(", ", names) + " in " + inputs, level + 1);

		String condition = JsonValues.stringOrNull(forLoop, "condition");
		if (condition != null)
		{
			writer.writeWrapped(" if " + condition, level + 1);
		}
		writer.write("]");
	}

	/**
	 * {@code condition ? a : b}, where each branch is a bare call or another conditional.
	 */
	private void writeCondition(JsonObject conditional)
	{
		String condition = JsonValues.stringOrNull(conditional, "condition");
		if (condition == null)
		{
			throw new DecompileException("Condition node " + key + " must have string condition");
		}
		JsonElement trueBranch = conditional.get("true_branch");
		if (trueBranch == null || !trueBranch.isJsonObject())
		{
			throw new DecompileException("Condition node " + key + " must have true branch");
		}
		JsonElement falseBranch = conditional.get("false_branch");
		if (falseBranch == null || !falseBranch.isJsonObject())
		{
			throw new DecompileException("Condition node " + key + " must have false branch");
		}

		writer.write(condition + " ? ");
		writeBranch(trueBranch.getAsJsonObject());
		writer.writeWrapped(" : ", level + 1);
		writeBranch(falseBranch.getAsJsonObject());
	}

	private void writeBranch(JsonObject branch)
	{
		if (CONDITION_OP.equals(JsonValues.stringOrNull(branch, "op_name")))
		{
			writeCondition(branch);
		}
		else
		{
			writeCall(branch, null);
		}
	}

	private void writeCall(JsonObject call, String alias)
	{
		String refGraph = JsonValues.stringOrNull(call, "ref_graph");
		String opName = JsonValues.stringOrNull(call, "op_name");
		if (refGraph != null)
		{
			writer.write("ref(" + Identifiers.checkId(refGraph) + ")(");
		}
		else if (opName != null)
		{
			writer.write(Identifiers.checkId(opName) + "(");
		}
		else
		{
			throw new DecompileException("Node " + key + " has no op_name or ref_graph");
		}
		writeInputs(call.get("input"));
		writer.write(")");

		for (String suffix : chainSuffixes(call, alias))
		{
			writer.writeWrapped(suffix, level + 1);
		}
		for (String name : PARAM_ATTRS)
		{
			JsonElement params = call.get(name);
			if (params == null)
			{
				continue;
			}
			String prefix = "." + name + "(";
			if (!writer.fits(prefix.length() + JsonValues.format(params).length()))
			{
				writer.softLine(level + 1);
			}
			writer.write(prefix);
			new ParamFormatter(writer).write(params, "node " + key + " ." + name);
			writer.write(")");
		}
	}

	private void writeInputs(JsonElement input)
	{
		if (input == null || input.isJsonNull())
		{
			return;
		}
		List<String> items = new ArrayList<>();
		if (input.isJsonArray())
		{
			input.getAsJsonArray().forEach(item -> items.add(JsonValues.formatInput(item)));
		}
		else if (input.isJsonObject())
		{
			for (Map.Entry<String, JsonElement> entry : input.getAsJsonObject().entrySet())
			{
				items.add(Identifiers.checkId(entry.getKey()) + "=" + JsonValues.formatKeyInput(entry.getValue()));
			}
		}
		else
		{
			items.add(JsonValues.formatInput(input));
		}
		writer.writeList(items, ",");
	}

	/**
	 * The fixed suffix order: attrs, version, as, start/end markers, depend, override.
	 */
	private List<String> chainSuffixes(JsonObject call, String alias)
	{
		List<String> suffixes = new ArrayList<>();
		JsonElement attrs = call.get("attrs");
		if (attrs != null && attrs.isJsonArray())
		{
			for (JsonElement attr : attrs.getAsJsonArray())
			{
				if (attr.isJsonObject())
				{
					String name = JsonValues.stringOrNull(attr.getAsJsonObject(), "key");
					String value = JsonValues.stringOrNull(attr.getAsJsonObject(), "value");
					if (name != null && value != null)
					{
						suffixes.add("." + Identifiers.checkId(name) + "(" + value + ")");
					}
				}
			}
		}

		String version = JsonValues.stringOrNull(call, "version");
		if (version != null)
		{
			suffixes.add(".version(" + JsonValues.quote(Identifiers.checkVersion(version)) + ")");
		}
		String explicitAlias = JsonValues.stringOrNull(call, "as");
		if (explicitAlias != null)
		{
			suffixes.add(".as(" + Identifiers.checkId(explicitAlias) + ")");
		}
		else if (alias != null)
		{
			suffixes.add(".as(" + Identifiers.checkId(alias) + ")");
		}
		if (isTrue(call.get("start")))
		{
			suffixes.add(".as(start)");
		}
		if (isTrue(call.get("end")))
		{
			suffixes.add(".as(end)");
		}

		JsonElement depend = call.get("depend");
		if (depend != null && depend.isJsonArray())
		{
			List<String> names = new ArrayList<>();
			for (JsonElement name : depend.getAsJsonArray())
			{
				names.add(Identifiers.checkId(nameOf(name, "depend")));
			}
			suffixes.add(".depend(" + String.join(",", names) + ")");
		}

		JsonElement override = call.get("override");
		if (override != null)
		{
			suffixes.add(".override(" + (override.isJsonNull() ? "" : JsonValues.format(override)) + ")");
		}
		return suffixes;
	}

	/**
	 * Names in the IR must be JSON strings.
	 */
	private String nameOf(JsonElement element, String field)
	{
		if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString())
		{
			throw new DecompileException("Node " + key + " has invalid " + field);
		}
		return element.getAsString();
	}

	private static boolean isTrue(JsonElement marker)
	{
		return marker != null && marker.isJsonPrimitive() && marker.getAsJsonPrimitive().isBoolean() && marker.getAsBoolean();
	}

}
