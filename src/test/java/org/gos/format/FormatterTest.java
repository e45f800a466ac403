package org.gos.format;

import org.gos.ast.AstNode.AttrDef;
import org.gos.ast.AstNode.ConditionStatement;
import org.gos.ast.AstNode.NumberLiteral;
import org.gos.ast.AstNode.OpSpec;
import org.gos.ast.AstNode.StringLiteral;
import org.gos.ast.AstNode.Symbol;
import org.gos.ast.Position;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatterTest
{
	@Test
	void blocksAreSeparatedByBlankLine()
	{
		assertThat(Formatter.formatSource("var { a = 1; }\ngraph { n = op.x(); }"))
				.isEqualTo("var {\n    a = 1;\n};\n\ngraph {\n    n = op.x();\n};\n");
	}

	@Test
	void emptyModuleFormatsToNothing()
	{
		assertThat(Formatter.formatSource("")).isEmpty();
	}

	@Test
	void commentsArePreserved()
	{
		String source = "# header\nvar {\n    # inside\n    a = 1; # trailing\n    b = 2;\n} as cfg; // after\n";

		assertThat(Formatter.formatSource(source)).isEqualTo(source);
	}

	@Test
	void normalizesSpacingOfStatements()
	{
		String source = """
				import   a.b,c as  d;
				graph:base.version('1.0.0'){
				  x=1 ;
				  n=op.x( a,b ).version( '1.0.0' );
				  p = x>1 ? op.a( ) : op.b();
				}as g.version('2.0.0')
				""";

		assertThat(Formatter.formatSource(source)).isEqualTo("""
				import a.b, c as d;

				graph : base.version('1.0.0') {
				    x = 1;
				    n = op.x(a, b).version('1.0.0');
				    p = x > 1 ? op.a() : op.b();
				} as g.version('2.0.0');
				""");
	}

	@Test
	void formatsOperations()
	{
		String source = "op { meta { description = 'x'; } input { a: (dtype=int, range=(0, 10]); } output { y: float; } } as o.version('1.0.0');";

		assertThat(Formatter.formatSource(source)).isEqualTo("""
				op {
				    meta {
				        description = 'x';
				    };
				    input {
				        a: (dtype=int, range=(0, 10]);
				    };
				    output {
				        y: float;
				    };
				} as o.version('1.0.0');
				""");
	}

	@Test
	void compactModeKeepsOneStatementPerLine()
	{
		FormatOptions options = FormatOptions.builder().indent(0).build();

		assertThat(Formatter.formatSource("var { a = 1; b = [1, 2]; } as c;", options))
				.isEqualTo("var {\na = 1;\nb = [1, 2];\n} as c;\n");
	}

	@Test
	void longCollectionsBreakOpen()
	{
		FormatOptions options = FormatOptions.builder().maxCol(30).build();
		String formatted = Formatter.formatSource("var { names = ['alpha', 'beta', 'gamma', 'delta']; }", options);

		assertThat(formatted).isEqualTo("""
				var {
				    names = [
				                'alpha',
				                'beta',
				                'gamma',
				                'delta'
				            ];
				};
				""");
		assertThat(Formatter.formatSource(formatted, options)).isEqualTo(formatted);
	}

	@Test
	void synthesizedStringsAreQuoted()
	{
		AttrDef attr = new AttrDef(Position.synthetic(), new Symbol(Position.synthetic(), "s"),
				new StringLiteral(Position.synthetic(), "it's", null));

		assertThat(Formatter.format(attr)).isEqualTo("s = 'it\\'s';");
	}

	@Test
	void inlineConditionText()
	{
		ConditionStatement condition = new ConditionStatement(Position.synthetic(),
				new Symbol(Position.synthetic(), "x"), new NumberLiteral(Position.synthetic(), "1", 1), ">");

		assertThat(Formatter.formatInline(condition)).isEqualTo("x > 1");
	}

	@Test
	void specWithoutItemsCannotBeFormatted()
	{
		OpSpec spec = new OpSpec(Position.synthetic(), new Symbol(Position.synthetic(), "a"), List.of());

		assertThatThrownBy(() -> Formatter.format(spec))
				.isInstanceOf(FormatException.class)
				.hasMessage("Op spec a has no items");
	}

	@Test
	void formatsFiles(@TempDir Path dir) throws Exception
	{
		Path file = dir.resolve("a.gos");
		Files.writeString(file, "var{a=1;}");

		assertThat(Formatter.formatFile(file, FormatOptions.defaults())).isEqualTo("var {\n    a = 1;\n};\n");
		assertThatThrownBy(() -> Formatter.formatFile(Paths.get(""), FormatOptions.defaults()))
				.isInstanceOf(FormatException.class)
				.hasMessage("Filename cannot be empty");
		assertThatThrownBy(() -> Formatter.formatFile(dir.resolve("missing.gos"), FormatOptions.defaults()))
				.isInstanceOf(FormatException.class)
				.hasMessageStartingWith("File ")
				.hasMessageEndingWith("missing.gos not found");
	}

	@Test
	void rejectsInvalidOptions()
	{
		assertThatThrownBy(() -> FormatOptions.builder().indent(-1).build()).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> FormatOptions.builder().maxCol(0).build()).isInstanceOf(IllegalArgumentException.class);
	}
}
