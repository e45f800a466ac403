package org.gos.compiler;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.gos.ast.AstNode;
import org.gos.ast.AstNode.*;
import org.gos.ast.AstNode.Module;
import org.gos.dto.CompileResult;
import org.gos.dto.GraphDict;
import org.gos.dto.NodeDict;
import org.gos.dto.OpDict;
import org.gos.error.GeneralException;
import org.gos.error.InvalidValueException;
import org.gos.error.UnsupportedFeatureException;
import org.gos.format.Formatter;
import org.gos.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Compiles a GOS module into its IR in a single left-to-right pass.
 * <p>
 * Variable blocks feed a {@link VariableTable}; graph properties, node attributes and op specs
 * are converted to IR values and then resolved against the variables bound so far.
 * Imports and comments produce nothing.
 */
public class Compiler
{
	public static final String CONDITION_OP = "builtin.conditions.str";

	private final CompileOptions options;

	public Compiler()
	{
		this(CompileOptions.defaults());
	}

	public Compiler(CompileOptions options)
	{
		this.options = options;
	}

	public CompileResult compile(AstNode root)
	{
		if (!(root instanceof Module module))
		{
			throw new GeneralException("Expected Module as root AST node");
		}
		Debug.logDebug("Compiling module with " + module.children().size() + " top-level statements...");

		CompileResult result = new CompileResult();
		VariableTable variables = new VariableTable();

		for (AstNode child : module.children())
		{
			if (child instanceof VarDef varDef)
			{
				compileVarDef(varDef, variables);
			}
			else if (child instanceof GraphDef graphDef)
			{
				result.graphs.add(compileGraphDef(graphDef, variables));
			}
			else if (child instanceof OpDef opDef)
			{
				result.ops.add(compileOpDef(opDef, variables));
			}
		}

		result.vars.putAll(ordered(variables.asMap()));
		if (options.isReturnOpNames())
		{
			result.opNames = collectOpNames(result.ops);
		}
		if (options.isReturnSubgraphs())
		{
			result.subgraphs = collectSubgraphs(result);
		}

		Debug.logDebug("Compiled " + result.graphs.size() + " graph(s), " + result.ops.size() + " op(s), "
				+ result.vars.size() + " variable(s).");
		return result;
	}

	// --- Variables ---

	private void compileVarDef(VarDef varDef, VariableTable variables)
	{
		String prefix = varDef.alias() == null ? "" : varDef.alias().name().trim() + ".";
		for (AstNode child : varDef.children())
		{
			if (child instanceof AttrDef attr)
			{
				variables.define(prefix + attr.name().name().trim(), ValueConverter.convert(attr.value()));
			}
			else if (child instanceof RefDef ref)
			{
				variables.define(prefix + ref.name().name().trim(), resolveReference(ref, variables));
			}
		}
		if (varDef.alias() != null)
		{
			String alias = varDef.alias().name().trim();
			variables.define(alias + ".as", new JsonPrimitive(alias));
		}
	}

	/**
	 * {@code name = other.attr or default;} takes the bound value, then the default, then the reference text.
	 */
	private JsonElement resolveReference(RefDef ref, VariableTable variables)
	{
		String target = ref.value().name();
		return variables.lookup(target)
				.map(JsonElement::deepCopy)
				.orElseGet(() -> ref.defaultValue() != null
						? variables.resolve(ValueConverter.convert(ref.defaultValue()))
						: new JsonPrimitive(target));
	}

	// --- Graphs ---

	private GraphDict compileGraphDef(GraphDef graphDef, VariableTable variables)
	{
		GraphDict graph = new GraphDict();
		graph.alias = graphDef.alias() == null ? null : graphDef.alias().name();
		graph.version = ValueConverter.asText(graphDef.version());
		graph.templateGraph = graphDef.templateGraph() == null ? null : graphDef.templateGraph().name();
		graph.templateVersion = ValueConverter.asText(graphDef.templateVersion());

		Map<String, JsonElement> properties = new LinkedHashMap<>();
		Map<String, NodeDict> nodes = new LinkedHashMap<>();
		for (AstNode child : graphDef.children())
		{
			if (child instanceof AttrDef attr && isCall(attr.value()))
			{
				// a property bound to a call is a node with a single output
				String name = attr.name().name();
				NodeDict node = compileImplicitNode(attr.value(), variables);
				node.output.add(name);
				nodes.put(name, node);
			}
			else if (child instanceof AttrDef attr)
			{
				properties.put(attr.name().name(), variables.resolve(ValueConverter.convert(attr.value())));
			}
			else if (child instanceof RefDef ref)
			{
				properties.put(ref.name().name(), resolveReference(ref, variables));
			}
			else if (child instanceof NodeDef nodeDef)
			{
				nodes.put(nodeKey(nodeDef.outputs(), nodes.size()), compileNodeDef(nodeDef, variables));
			}
			else if (child instanceof ConditionDef conditionDef)
			{
				NodeDict node = compileCondition(conditionDef.value(), variables);
				conditionDef.outputs().forEach(output -> node.output.add(output.name()));
				nodes.put(nodeKey(conditionDef.outputs(), nodes.size()), node);
			}
		}
		graph.properties.putAll(ordered(properties));
		graph.nodes.putAll(ordered(nodes));
		return graph;
	}

	private static boolean isCall(AstNode value)
	{
		return value instanceof NodeBlock || value instanceof RefGraphBlock;
	}

	private static String nodeKey(List<Symbol> outputs, int index)
	{
		return outputs.isEmpty() ? "node_" + index : outputs.get(0).name();
	}

	private NodeDict compileNodeDef(NodeDef nodeDef, VariableTable variables)
	{
		NodeDict node;
		if (nodeDef.value() instanceof ForLoopBlock loop)
		{
			node = compileCall(loop.node(), variables);
			node.forLoop = compileForLoop(loop);
		}
		else
		{
			node = compileCall(nodeDef.value(), variables);
		}
		for (Symbol output : nodeDef.outputs())
		{
			node.output.add(output.name());
		}
		return node;
	}

	/**
	 * Implicit nodes keep their inputs, and their whole attribute chain lands in {@code with}.
	 */
	private NodeDict compileImplicitNode(AstNode call, VariableTable variables)
	{
		NodeDict node = new NodeDict();
		List<NodeAttr> attrs;
		if (call instanceof RefGraphBlock ref)
		{
			node.refGraph = ref.refName().name();
			node.input = compileInputs(ref.inputs());
			attrs = ref.attrs();
		}
		else
		{
			NodeBlock block = (NodeBlock) call;
			node.opName = block.name().name();
			node.input = compileInputs(block.inputs());
			attrs = block.attrs();
		}
		for (NodeAttr attr : attrs)
		{
			node.with.put(attr.name().name(), variables.resolve(attrValue(attr)));
		}
		return node;
	}

	private NodeDict compileCall(AstNode call, VariableTable variables)
	{
		NodeDict node = new NodeDict();
		List<NodeAttr> attrs;
		if (call instanceof RefGraphBlock ref)
		{
			node.refGraph = ref.refName().name();
			node.input = compileInputs(ref.inputs());
			attrs = ref.attrs();
		}
		else if (call instanceof NodeBlock block)
		{
			node.opName = block.name().name();
			node.input = compileInputs(block.inputs());
			attrs = block.attrs();
		}
		else if (call instanceof ConditionBlock condition)
		{
			return compileCondition(condition, variables);
		}
		else
		{
			throw new UnsupportedFeatureException(ValueConverter.describe(call) + " as a node call",
					call.position().getLine(), call.position().getStartCol());
		}
		for (NodeAttr attr : attrs)
		{
			applyAttr(node, attr, variables);
		}
		return node;
	}

	private void applyAttr(NodeDict node, NodeAttr attr, VariableTable variables)
	{
		String name = attr.name().name();
		switch (name)
		{
			case "version" -> node.version = textOf(variables.resolve(attrValue(attr)));
			case "as" ->
			{
				String alias = textOf(attrValue(attr));
				if ("start".equals(alias))
				{
					node.start = true;
				}
				else if ("end".equals(alias))
				{
					node.end = true;
				}
				else
				{
					node.alias = alias;
				}
			}
			case "override" -> node.override = variables.resolve(attrValue(attr));
			case "depend" ->
			{
				for (AstNode arg : attr.args())
				{
					node.depend.add(textOf(ValueConverter.convert(arg)));
				}
			}
			case "with" -> mergeKeyArgs(node.with, attr, variables);
			case "property" -> mergeKeyArgs(node.property, attr, variables);
			case "log" -> mergeKeyArgs(node.log, attr, variables);
			case "metrics" -> mergeKeyArgs(node.metrics, attr, variables);
			case "funnel" -> mergeKeyArgs(node.funnel, attr, variables);
			default -> node.with.put(name, variables.resolve(attrValue(attr)));
		}
	}

	/**
	 * {@code .with(a=1, b=2)} or {@code .with({"a": 1})}; anything else has no key to land under.
	 */
	private void mergeKeyArgs(Map<String, JsonElement> target, NodeAttr attr, VariableTable variables)
	{
		for (AstNode arg : attr.args())
		{
			if (arg instanceof NodeInputKeyItem item)
			{
				target.put(item.key().name(), variables.resolve(ValueConverter.convert(item.value())));
			}
			else if (arg instanceof DictStatement dict)
			{
				JsonObject entries = variables.resolve(ValueConverter.convert(dict)).getAsJsonObject();
				entries.entrySet().forEach(entry -> target.put(entry.getKey(), entry.getValue()));
			}
			else
			{
				throw new InvalidValueException("." + attr.name().name() + "() expects key=value arguments",
						arg.position().getLine(), arg.position().getStartCol());
			}
		}
	}

	/**
	 * A single plain argument is the value itself; key arguments make an object; several plain
	 * arguments make an array.
	 */
	private static JsonElement attrValue(NodeAttr attr)
	{
		List<AstNode> args = attr.args();
		if (args.size() == 1 && !(args.get(0) instanceof NodeInputKeyItem))
		{
			return ValueConverter.convert(args.get(0));
		}
		if (!args.isEmpty() && args.stream().allMatch(arg -> arg instanceof NodeInputKeyItem))
		{
			JsonObject object = new JsonObject();
			for (AstNode arg : args)
			{
				NodeInputKeyItem item = (NodeInputKeyItem) arg;
				object.add(item.key().name(), ValueConverter.convert(item.value()));
			}
			return object;
		}
		JsonArray array = new JsonArray();
		for (AstNode arg : args)
		{
			if (arg instanceof NodeInputKeyItem item)
			{
				JsonObject pair = new JsonObject();
				pair.add(item.key().name(), ValueConverter.convert(item.value()));
				array.add(pair);
			}
			else
			{
				array.add(ValueConverter.convert(arg));
			}
		}
		return array;
	}

	/**
	 * Inputs name other nodes' outputs, so they are not resolved against variables.
	 */
	private static JsonElement compileInputs(AstNode inputs)
	{
		if (inputs instanceof NodeInputTuple tuple)
		{
			if (tuple.items().isEmpty())
			{
				return null;
			}
			JsonArray array = new JsonArray();
			tuple.items().forEach(item -> array.add(ValueConverter.convert(item)));
			return array;
		}
		if (inputs instanceof NodeInputKeyDef keyDef)
		{
			if (keyDef.items().isEmpty())
			{
				return null;
			}
			JsonObject object = new JsonObject();
			keyDef.items().forEach(item -> object.add(item.key().name(), ValueConverter.convert(item.value())));
			return object;
		}
		return null;
	}

	private static JsonObject compileForLoop(ForLoopBlock loop)
	{
		JsonObject forLoop = new JsonObject();
		forLoop.addProperty("inputs", loop.inputs().name());
		JsonArray outputs = new JsonArray();
		loop.outputs().forEach(output -> outputs.add(output.name()));
		forLoop.add("outputs", outputs);
		if (loop.condition() != null)
		{
			forLoop.addProperty("condition", Formatter.formatInline(loop.condition()));
		}
		return forLoop;
	}

	private NodeDict compileCondition(ConditionBlock block, VariableTable variables)
	{
		NodeDict node = new NodeDict();
		node.opName = CONDITION_OP;
		node.condition = Formatter.formatInline(block.condition());
		node.trueBranch = compileCall(block.trueBranch(), variables);
		node.falseBranch = compileCall(block.falseBranch(), variables);
		return node;
	}

	private static String textOf(JsonElement value)
	{
		if (value == null || value.isJsonNull())
		{
			return null;
		}
		return value.isJsonPrimitive() ? value.getAsString() : value.toString();
	}

	// --- Operations ---

	private OpDict compileOpDef(OpDef opDef, VariableTable variables)
	{
		OpDict op = new OpDict();
		if (opDef.alias() != null)
		{
			op.metas.put("as", new JsonPrimitive(opDef.alias().name()));
		}
		if (opDef.version() != null)
		{
			op.metas.put("version", new JsonPrimitive(opDef.version()));
		}

		for (AstNode child : opDef.children())
		{
			if (child instanceof OpMeta meta)
			{
				for (AstNode item : meta.children())
				{
					if (item instanceof AttrDef attr)
					{
						op.metas.put(attr.name().name(), variables.resolve(ValueConverter.convert(attr.value())));
					}
					else if (item instanceof RefDef ref)
					{
						op.metas.put(ref.name().name(), resolveReference(ref, variables));
					}
				}
			}
			else if (child instanceof OpInput input)
			{
				compileSpecs(input.children(), op.inputs, variables);
			}
			else if (child instanceof OpOutput output)
			{
				compileSpecs(output.children(), op.outputs, variables);
			}
			else if (child instanceof OpConfig config)
			{
				compileSpecs(config.children(), op.configs, variables);
			}
			else if (child instanceof GraphDef graphDef)
			{
				op.graph = compileGraphDef(graphDef, variables);
			}
		}
		if (!options.isKeepOrder())
		{
			Map<String, JsonElement> metas = ordered(op.metas);
			op.metas.clear();
			op.metas.putAll(metas);
		}
		return op;
	}

	private void compileSpecs(List<AstNode> children, Map<String, JsonObject> target, VariableTable variables)
	{
		Map<String, JsonObject> specs = new LinkedHashMap<>();
		for (AstNode child : children)
		{
			if (child instanceof OpSpec spec)
			{
				specs.put(spec.name().name(), compileSpec(spec, variables));
			}
		}
		target.putAll(ordered(specs));
	}

	private static JsonObject compileSpec(OpSpec spec, VariableTable variables)
	{
		JsonObject object = new JsonObject();
		for (OpSpecItem item : spec.items())
		{
			JsonElement value = variables.resolve(ValueConverter.convert(item.value()));
			boolean bounded = item.name().equals("length") || item.name().equals("range");
			if (bounded && item.value() instanceof NumberLiteral)
			{
				JsonObject exact = new JsonObject();
				exact.add("eq", value);
				value = exact;
			}
			object.add(item.name(), value);
		}
		return object;
	}

	// --- Listings ---

	private static List<String> collectOpNames(List<OpDict> ops)
	{
		List<String> names = new ArrayList<>();
		for (OpDict op : ops)
		{
			String alias = textOf(op.metas.get("as"));
			if (alias != null)
			{
				names.add(alias);
			}
		}
		return names;
	}

	private static List<String> collectSubgraphs(CompileResult result)
	{
		Set<String> names = new LinkedHashSet<>();
		List<GraphDict> graphs = new ArrayList<>(result.graphs);
		result.ops.stream().filter(op -> op.graph != null).forEach(op -> graphs.add(op.graph));
		for (GraphDict graph : graphs)
		{
			graph.nodes.values().forEach(node -> collectRefGraphs(node, names));
		}
		return new ArrayList<>(names);
	}

	private static void collectRefGraphs(NodeDict node, Set<String> names)
	{
		if (node == null)
		{
			return;
		}
		if (node.refGraph != null)
		{
			names.add(node.refGraph);
		}
		collectRefGraphs(node.trueBranch, names);
		collectRefGraphs(node.falseBranch, names);
	}

	private <V> Map<String, V> ordered(Map<String, V> map)
	{
		return options.isKeepOrder() ? map : new TreeMap<>(map);
	}
}
