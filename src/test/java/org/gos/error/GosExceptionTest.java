package org.gos.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class GosExceptionTest
{
	@Test
	void positionedDiagnosticsReportLocation()
	{
		SemanticException semantic = new SemanticException(3, 7, "unknown graph 'g'");

		assertThat(semantic.getMessage()).isEqualTo("Semantic error at line 3, column 7: unknown graph 'g'");
		assertThat(semantic.getLine()).hasValue(3);
		assertThat(semantic.getColumn()).hasValue(7);

		assertThat(new LexicalException(1, 2, '~').getMessage())
				.isEqualTo("Lexical error at line 1, column 2: illegal character '~'");
		assertThat(new InvalidValueException("bad", 4, 1).getMessage())
				.isEqualTo("Invalid value: bad at line 4, column 1");
		assertThat(new UnsupportedFeatureException("ref in loop", 2, 9).getFeature()).isEqualTo("ref in loop");
		assertThat(DuplicateDefinitionException.graphAlias("g", 5, 13).getMessage())
				.isEqualTo("Duplicate definition: graph as 'g' at line 5, column 13");
	}

	@Test
	void deprecationCarriesSuggestion()
	{
		DeprecatedFeatureException deprecated = DeprecatedFeatureException.datetimeLiteral(2, 11);

		assertThat(deprecated.getFeature()).isEqualTo("datetime literal");
		assertThat(deprecated.getSuggestion()).contains("date(");
		assertThat(deprecated.getMessage()).startsWith("Deprecated feature: datetime literal at line 2, column 11.");
	}

	@Test
	void stageErrorsHaveNoPosition()
	{
		GosException general = new GeneralException("Expected Module as root AST node");
		IOException cause = new IOException("disk full");
		GosException io = new GosIoException("cannot write out.json", cause);

		assertThat(general.getMessage()).isEqualTo("Parse error: Expected Module as root AST node");
		assertThat(general.getLine()).isEmpty();
		assertThat(io.getMessage()).isEqualTo("IO error: cannot write out.json");
		assertThat(io.getCause()).isSameAs(cause);
		assertThat(io.getColumn()).isEmpty();
	}
}
