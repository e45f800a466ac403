package org.gos.compiler;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.gos.ast.AstNode.AttrDef;
import org.gos.ast.AstNode.Module;
import org.gos.ast.AstNode.NullLiteral;
import org.gos.ast.AstNode.NumberLiteral;
import org.gos.ast.AstNode.Symbol;
import org.gos.ast.AstNode.VarDef;
import org.gos.ast.Position;
import org.gos.dto.CompileResult;
import org.gos.error.GeneralException;
import org.gos.parser.AntlrSourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompilerTest
{
	private static CompileResult compile(String source)
	{
		return new Compiler().compile(new AntlrSourceParser().parse(source));
	}

	private static JsonObject node(CompileResult result, String key)
	{
		return result.graphs.get(0).nodes.get(key).toJson();
	}

	@Test
	void emptyModuleOnlyCarriesVersion()
	{
		CompileResult result = new Compiler().compile(new Module(Position.synthetic(), List.of()));

		assertThat(result.toJson()).isEqualTo(JsonParser.parseString("{\"gos_version\": \"0.5.2\"}"));
	}

	@Test
	void rejectsNonModuleRoot()
	{
		assertThatThrownBy(() -> new Compiler().compile(new NullLiteral(Position.synthetic())))
				.isInstanceOf(GeneralException.class)
				.hasMessage("Parse error: Expected Module as root AST node");
	}

	@Test
	void aliasedVariablesArePrefixed()
	{
		CompileResult result = compile("""
				var {
				    name = "test";
				    value = 42;
				} as config;
				""");

		assertThat(result.vars.get("config.name").getAsString()).isEqualTo("test");
		assertThat(result.vars.get("config.value").getAsLong()).isEqualTo(42L);
		assertThat(result.vars.get("config.as").getAsString()).isEqualTo("config");
	}

	@Test
	void trimsVariableBlockAliasInKeys()
	{
		AttrDef attr = new AttrDef(Position.synthetic(), new Symbol(Position.synthetic(), " a "),
				new NumberLiteral(Position.synthetic(), "1", 1));
		VarDef varDef = new VarDef(Position.synthetic(), List.of(attr), new Symbol(Position.synthetic(), " cfg "));

		CompileResult result = new Compiler().compile(new Module(Position.synthetic(), List.of(varDef)));

		assertThat(result.vars).containsOnlyKeys("cfg.a", "cfg.as");
		assertThat(result.vars.get("cfg.a").getAsLong()).isEqualTo(1L);
		assertThat(result.vars.get("cfg.as").getAsString()).isEqualTo("cfg");
	}

	@Test
	void referencesFallBackToDefault()
	{
		CompileResult result = compile("""
				var { base = 1; }
				var { a = base or 5; b = missing or 7; }
				""");

		assertThat(result.vars.get("a").getAsLong()).isEqualTo(1L);
		assertThat(result.vars.get("b").getAsLong()).isEqualTo(7L);
	}

	@Test
	void nodeAttributesResolveVariables()
	{
		CompileResult result = compile("var { lr = 0.1; } graph { n = op.train().with(rate=lr); }");

		assertThat(node(result, "n")).isEqualTo(JsonParser.parseString("""
				{"op_name": "op.train", "output": ["n"], "with": {"rate": 0.1}}"""));
	}

	@Test
	void compilesGraphPropertiesAndNodeChain()
	{
		CompileResult result = compile("""
				graph {
				    description = 'pipeline';
				    loader = data.load(path).version('1.0.0');
				    model = ml.train(data=loader).with(epochs=10).depend(loader).as(start);
				    left, right = data.split(model).as(halves);
				} as pipeline.version('2.0.0');
				""");

		JsonObject graph = result.graphs.get(0).toJson();
		assertThat(graph.get("as").getAsString()).isEqualTo("pipeline");
		assertThat(graph.get("version").getAsString()).isEqualTo("2.0.0");
		assertThat(graph.getAsJsonObject("properties").get("description").getAsString()).isEqualTo("pipeline");

		assertThat(node(result, "loader")).isEqualTo(JsonParser.parseString("""
				{"op_name": "data.load", "version": "1.0.0", "output": ["loader"], "input": ["path"]}"""));
		assertThat(node(result, "model")).isEqualTo(JsonParser.parseString("""
				{"op_name": "ml.train", "output": ["model"], "input": {"data": "loader"},
				 "depend": ["loader"], "with": {"epochs": 10}, "start": true}"""));
		assertThat(node(result, "left")).isEqualTo(JsonParser.parseString("""
				{"op_name": "data.split", "output": ["left", "right"], "input": ["model"], "as": "halves"}"""));
	}

	@Test
	void compilesConditionalAndLoopNodes()
	{
		CompileResult result = compile("""
				graph {
				    picked = retries > 1 ? ml.a(model) : ml.b(model);
				    each = [ml.score(x) for x in rows if x != null];
				}
				""");

		assertThat(node(result, "picked")).isEqualTo(JsonParser.parseString("""
				{"op_name": "builtin.conditions.str", "output": ["picked"], "condition": "retries > 1",
				 "true_branch": {"op_name": "ml.a", "input": ["model"]},
				 "false_branch": {"op_name": "ml.b", "input": ["model"]}}"""));
		assertThat(node(result, "each").getAsJsonObject("for_loop")).isEqualTo(JsonParser.parseString("""
				{"inputs": "rows", "outputs": ["x"], "condition": "x != null"}"""));
	}

	@Test
	void compilesOperationSpecs()
	{
		CompileResult result = compile("""
				op {
				    meta { description = 'Scores rows'; }
				    input {
				        rows: (dtype=string, length=[1, 100]);
				        limit: (dtype=int, range=(0, 10], length=5);
				    }
				    output { score: float; }
				} as scorer.version('1.0.0');
				""");

		assertThat(result.ops.get(0).toJson()).isEqualTo(JsonParser.parseString("""
				{"metas": {"as": "scorer", "version": "1.0.0", "description": "Scores rows"},
				 "inputs": {
				   "rows": {"dtype": "string", "length": {"ge": 1, "le": 100}},
				   "limit": {"dtype": "int", "range": {"gt": 0, "le": 10}, "length": {"eq": 5}}
				 },
				 "outputs": {"score": {"dtype": "float"}}}"""));
	}

	@Test
	void listsOpNamesAndSubgraphsOnRequest()
	{
		String source = """
				graph { a = ref(sub)(x); }
				op { output { y: int; } } as scorer;
				""";
		CompileOptions options = CompileOptions.builder().returnOpNames(true).returnSubgraphs(true).build();

		CompileResult result = new Compiler(options).compile(new AntlrSourceParser().parse(source));

		assertThat(result.opNames).containsExactly("scorer");
		assertThat(result.subgraphs).containsExactly("sub");
		assertThat(compile(source).toJson().has("op_names")).isFalse();
	}

	@Test
	void sortsMapsWhenOrderIsNotKept()
	{
		String source = "var { b = 2; a = 1; }";
		CompileOptions options = CompileOptions.builder().keepOrder(false).build();

		CompileResult sorted = new Compiler(options).compile(new AntlrSourceParser().parse(source));

		assertThat(sorted.vars.keySet()).containsExactly("a", "b");
		assertThat(compile(source).vars.keySet()).containsExactly("b", "a");
	}

	@Test
	void serializesPrettyJson()
	{
		String json = compile("var { a = 'x<y'; }").toJsonString();

		assertThat(json).isEqualTo("""
				{
				  "vars": {
				    "a": "x<y"
				  },
				  "gos_version": "0.5.2"
				}""");
	}
}
