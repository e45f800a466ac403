package org.gos.util;

import org.gos.error.DeprecatedFeatureException;
import org.gos.error.LexicalException;
import org.gos.error.SyntaxException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorHandlerTest
{
	@Test
	void warningsAloneDoNotFail()
	{
		ErrorHandler handler = new ErrorHandler();
		handler.logWarning(DeprecatedFeatureException.datetimeLiteral(1, 5));

		assertThat(handler.hasWarnings()).isTrue();
		assertThat(handler.hasErrors()).isFalse();
		assertThatCode(handler::throwIfErrors).doesNotThrowAnyException();
	}

	@Test
	void throwsTheFirstError()
	{
		ErrorHandler handler = new ErrorHandler();
		SyntaxException first = new SyntaxException(1, 2, "first");
		handler.logError(first);
		handler.logError(new LexicalException(3, 4, '?'));

		assertThat(handler.getErrors()).hasSize(2);
		assertThatThrownBy(handler::throwIfErrors).isSameAs(first);
	}

	@Test
	void describesCollectedDiagnostics()
	{
		ErrorHandler handler = new ErrorHandler();
		assertThat(handler.isEmpty()).isTrue();
		handler.logError(new SyntaxException(3, 20, "bad"));

		assertThat(handler.toString()).contains("Errors:").contains("Syntax error at line 3, column 20: bad");
	}
}
