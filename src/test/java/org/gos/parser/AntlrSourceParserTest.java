package org.gos.parser;

import org.gos.ast.AstNode;
import org.gos.ast.AstNode.*;
import org.gos.ast.AstNode.Module;
import org.gos.ast.Position;
import org.gos.ast.SymbolKind;
import org.gos.error.DeprecatedFeatureException;
import org.gos.error.DuplicateDefinitionException;
import org.gos.error.InvalidValueException;
import org.gos.error.LexicalException;
import org.gos.error.SyntaxException;
import org.gos.util.ErrorHandler;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AntlrSourceParserTest
{
	private final AntlrSourceParser parser = new AntlrSourceParser();

	private VarDef firstVar(String source)
	{
		return (VarDef) parser.parse(source).children().get(0);
	}

	@Test
	void emptySourceGivesEmptyModule()
	{
		Module module = parser.parse("");

		assertThat(module.children()).isEmpty();
		assertThat(module.position()).isEqualTo(Position.synthetic());
	}

	@Test
	void varBlockSpansAndSymbolKinds()
	{
		Module module = parser.parse("\nvar {\n    name = \"test\";\n    value = 42;\n} as config;\n");

		VarDef var = (VarDef) module.children().get(0);
		assertThat(var.position()).isEqualTo(new Position(2, 5, 1, 12));
		assertThat(module.position()).isEqualTo(new Position(2, 5, 1, 12));

		AttrDef name = (AttrDef) var.children().get(0);
		assertThat(name.position()).isEqualTo(new Position(3, 3, 5, 18));
		assertThat(name.name().position()).isEqualTo(new Position(3, 3, 5, 9));
		assertThat(name.name().kind()).isEqualTo(SymbolKind.VAR_ATTR);
		assertThat(name.value()).isEqualTo(new StringLiteral(new Position(3, 3, 12, 18), "test", "\"test\""));

		AttrDef value = (AttrDef) var.children().get(1);
		assertThat(value.value()).isEqualTo(new NumberLiteral(new Position(4, 4, 13, 15), "42", 42));

		assertThat(var.alias().name()).isEqualTo("config");
		assertThat(var.alias().position()).isEqualTo(new Position(5, 5, 6, 12));
		assertThat(var.alias().kind()).isEqualTo(SymbolKind.VAR_AS_NAME);
	}

	@Test
	void versionedAliasIsSplit()
	{
		GraphDef graph = (GraphDef) parser.parse("graph {\n    n = op.x();\n} as complex_pipeline.version(\"1.0.0\");").children().get(0);

		assertThat(graph.alias().name()).isEqualTo("complex_pipeline");
		assertThat(graph.alias().position()).isEqualTo(new Position(3, 3, 6, 22));
		assertThat(graph.alias().kind()).isEqualTo(SymbolKind.GRAPH_AS_NAME);
		assertThat(graph.version()).isEqualTo(new StringLiteral(new Position(3, 3, 31, 38), "1.0.0", "\"1.0.0\""));
	}

	@Test
	void nodeDefinitionWithoutInputs()
	{
		GraphDef graph = (GraphDef) parser.parse("graph {\n    input_node = data_loader();\n}").children().get(0);

		NodeDef node = (NodeDef) graph.children().get(0);
		assertThat(node.outputs()).hasSize(1);
		assertThat(node.outputs().get(0).position()).isEqualTo(new Position(2, 2, 5, 15));
		assertThat(node.outputs().get(0).kind()).isEqualTo(SymbolKind.NODE_OUTPUT);

		NodeBlock call = (NodeBlock) node.value();
		assertThat(call.position()).isEqualTo(new Position(2, 2, 18, 31));
		assertThat(call.name().name()).isEqualTo("data_loader");
		assertThat(call.name().position()).isEqualTo(new Position(2, 2, 18, 29));
		assertThat(call.name().kind()).isEqualTo(SymbolKind.NODE_NAME);
		assertThat(call.inputs()).isNull();
		assertThat(call.attrs()).isEmpty();
	}

	@Test
	void nodeInputsAndAttributes()
	{
		GraphDef graph = (GraphDef) parser.parse("graph { m = ml.train(data=loader).depend(prep).with(rate=0.5); }").children().get(0);

		NodeBlock call = (NodeBlock) ((NodeDef) graph.children().get(0)).value();
		NodeInputKeyDef inputs = (NodeInputKeyDef) call.inputs();
		assertThat(inputs.items().get(0).key().kind()).isEqualTo(SymbolKind.NODE_INPUT_KEY);
		assertThat(((Symbol) inputs.items().get(0).value()).kind()).isEqualTo(SymbolKind.NODE_INPUT);

		assertThat(call.attrs()).extracting(attr -> attr.name().name()).containsExactly("depend", "with");
		assertThat(((Symbol) call.attrs().get(0).args().get(0)).kind()).isEqualTo(SymbolKind.NODE_DEPEND);
		assertThat(call.attrs().get(1).args().get(0)).isInstanceOf(NodeInputKeyItem.class);
	}

	@Test
	void conditionalAndLoopNodes()
	{
		GraphDef graph = (GraphDef) parser.parse("""
				graph {
				    picked = retries > 1 ? ml.a(m) : ml.b(m);
				    each = [ml.score(x) for x, y in rows if x != null];
				}
				""").children().get(0);

		ConditionDef conditional = (ConditionDef) graph.children().get(0);
		ConditionStatement condition = (ConditionStatement) conditional.value().condition();
		assertThat(condition.operator()).isEqualTo(">");
		assertThat(conditional.value().falseBranch()).isInstanceOf(NodeBlock.class);

		ForLoopBlock loop = (ForLoopBlock) ((NodeDef) graph.children().get(1)).value();
		assertThat(loop.outputs()).extracting(Symbol::name).containsExactly("x", "y");
		assertThat(loop.inputs().name()).isEqualTo("rows");
		assertThat(loop.inputs().kind()).isEqualTo(SymbolKind.FOR_LOOP_INPUTS);
		assertThat(loop.condition()).isInstanceOf(ConditionStatement.class);
	}

	@Test
	void referenceWithDefault()
	{
		AstNode attr = firstVar("var { a = other.x or 5; }").children().get(0);

		assertThat(attr).isInstanceOf(RefDef.class);
		RefDef ref = (RefDef) attr;
		assertThat(ref.value().name()).isEqualTo("other.x");
		assertThat(ref.value().kind()).isEqualTo(SymbolKind.VAR_REF);
		assertThat(ref.defaultValue()).isInstanceOf(NumberLiteral.class);
	}

	@Test
	void attributeLineExpands()
	{
		VarDef var = firstVar("var { a = 1, b = 'two'; }");

		assertThat(var.children()).extracting(child -> ((AttrDef) child).name().name()).containsExactly("a", "b");
	}

	@Test
	void opSectionsAndSpecs()
	{
		OpDef op = (OpDef) parser.parse("""
				op {
				    meta { description = 'x'; }
				    input { limit: (dtype=int, range=(0, 10], shape=[2, 3]); }
				    output { y: float; }
				} as scorer.version('1.0.0');
				""").children().get(0);

		assertThat(op.alias().name()).isEqualTo("scorer");
		assertThat(op.version()).isEqualTo("1.0.0");
		assertThat(op.children()).hasExactlyElementsOfTypes(OpMeta.class, OpInput.class, OpOutput.class);

		OpSpec limit = (OpSpec) ((OpInput) op.children().get(1)).children().get(0);
		assertThat(limit.name().kind()).isEqualTo(SymbolKind.OP_INPUT_ATTR);
		MixInterval range = (MixInterval) limit.items().get(1).value();
		assertThat(range.ge()).isNull();
		assertThat(range.gt().value()).isEqualTo(0);
		assertThat(range.le().value()).isEqualTo(10);
		assertThat(range.lt()).isNull();
		assertThat(limit.items().get(2).value()).isInstanceOf(ListStatement.class);

		OpSpec y = (OpSpec) ((OpOutput) op.children().get(2)).children().get(0);
		assertThat(y.items()).hasSize(1);
		assertThat(y.items().get(0).name()).isEqualTo("dtype");
		assertThat(((Symbol) y.items().get(0).value()).kind()).isEqualTo(SymbolKind.OP_SPEC_DTYPE);
	}

	@Test
	void valuesAndEscapes()
	{
		VarDef var = firstVar("var { s = 'a\\'b\\n'; t = [1, 2.5, true, null,]; d = {'k': 1,}; größe = 1; }");

		assertThat(((StringLiteral) ((AttrDef) var.children().get(0)).value()).value()).isEqualTo("a'b\n");
		ListStatement list = (ListStatement) ((AttrDef) var.children().get(1)).value();
		assertThat(list.items()).hasExactlyElementsOfTypes(NumberLiteral.class, FloatLiteral.class, BoolLiteral.class, NullLiteral.class);
		assertThat(((AttrDef) var.children().get(2)).value()).isInstanceOf(DictStatement.class);
		assertThat(((AttrDef) var.children().get(3)).name().name()).isEqualTo("größe");
	}

	@Test
	void datetimeIsDeprecatedButParsed()
	{
		ErrorHandler errorHandler = new ErrorHandler();
		Module module = parser.parse("var { t = datetime('2024-01-02 03:04:05'); }", errorHandler);

		DateTimeLiteral value = (DateTimeLiteral) ((AttrDef) ((VarDef) module.children().get(0)).children().get(0)).value();
		assertThat(value.value()).isEqualTo(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
		assertThat(errorHandler.getWarnings()).hasSize(1).first().isInstanceOf(DeprecatedFeatureException.class);
		assertThat(errorHandler.hasErrors()).isFalse();
	}

	@Test
	void commentsBecomeSiblings()
	{
		Module module = parser.parse("# header\nvar {\n    # inside\n    a = 1; # trailing\n    b = 2;\n} as cfg; // after\n");

		assertThat(module.children()).hasExactlyElementsOfTypes(Comment.class, VarDef.class, Comment.class);
		assertThat(((Comment) module.children().get(0)).value()).isEqualTo("# header");
		assertThat(((Comment) module.children().get(2)).value()).isEqualTo("// after");

		VarDef var = (VarDef) module.children().get(1);
		assertThat(var.children()).hasExactlyElementsOfTypes(Comment.class, AttrDef.class, Comment.class, AttrDef.class);
		assertThat(((Comment) var.children().get(2)).position()).isEqualTo(new Position(4, 4, 12, 22));
	}

	@Test
	void syntaxErrorsAreReported()
	{
		assertThatThrownBy(() -> parser.parse(";;;")).isInstanceOf(SyntaxException.class);
		assertThatThrownBy(() -> parser.parse("import;")).isInstanceOf(SyntaxException.class);
		assertThatThrownBy(() -> parser.parse("var { a = [1, 2, , 4]; }")).isInstanceOf(SyntaxException.class);
		assertThatThrownBy(() -> parser.parse("var { a = 1; ")).isInstanceOf(SyntaxException.class);
		assertThatThrownBy(() -> parser.parse("var { var { a = 1; } }")).isInstanceOf(SyntaxException.class);
	}

	@Test
	void syntaxErrorCarriesPosition()
	{
		assertThatThrownBy(() -> parser.parse("var {\n  a = ;\n}"))
				.isInstanceOfSatisfying(SyntaxException.class, e ->
				{
					assertThat(e.getLine()).hasValue(2);
					assertThat(e.getMessage()).startsWith("Syntax error at line 2, column 7: parsing error, ");
				});
	}

	@Test
	void unterminatedStringIsLexicalError()
	{
		assertThatThrownBy(() -> parser.parse("var { a = \"abc; }"))
				.isInstanceOfSatisfying(LexicalException.class, e -> assertThat(e.getCharacter()).isEqualTo('"'));
	}

	@Test
	void semanticChecksOnAliasesAndInputs()
	{
		assertThatThrownBy(() -> parser.parse("graph {} as g; graph {} as g;"))
				.isInstanceOf(DuplicateDefinitionException.class)
				.hasMessageContaining("graph as 'g'");
		assertThatThrownBy(() -> parser.parse("op {} as o; op {} as o;"))
				.isInstanceOf(DuplicateDefinitionException.class);
		assertThatThrownBy(() -> parser.parse("import a as x, b as x;"))
				.isInstanceOf(DuplicateDefinitionException.class);
		assertThat(parser.parse("var { a = 1; } as v; var { b = 2; } as v;").children()).hasSize(2);

		assertThatThrownBy(() -> parser.parse("graph { n = op.x(a, b=c); }"))
				.isInstanceOf(SyntaxException.class)
				.hasMessageContaining("cannot mix positional and keyword node inputs");
		assertThatThrownBy(() -> parser.parse("op { inputs { a: int; } }"))
				.isInstanceOf(SyntaxException.class)
				.hasMessageContaining("unknown op section 'inputs'");
	}

	@Test
	void invalidValuesAreRejected()
	{
		assertThatThrownBy(() -> parser.parse("var { a = 99999999999999999999; }"))
				.isInstanceOf(InvalidValueException.class);
		assertThatThrownBy(() -> parser.parse("op { input { a: (dtype=int, shape=[, 3]); } }"))
				.isInstanceOf(InvalidValueException.class)
				.hasMessageContaining("empty element in 'shape'");
	}
}
