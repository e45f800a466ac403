package org.gos.decompiler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifiersTest
{
	@Test
	void acceptsIdentifierCharacters()
	{
		assertThat(Identifiers.checkId("valid-id")).isEqualTo("valid-id");
		assertThat(Identifiers.checkId("valid$id")).isEqualTo("valid$id");
		assertThat(Identifiers.checkId("_private.path.x1")).isEqualTo("_private.path.x1");
		assertThat(Identifiers.isIdentifier("%tmp@2")).isTrue();
	}

	@Test
	void rejectsLeadingDigitAndSpaces()
	{
		assertThatThrownBy(() -> Identifiers.checkId("123invalid"))
				.isInstanceOf(DecompileException.class)
				.hasMessage("Invalid identifier: 123invalid");
		assertThat(Identifiers.isIdentifier("has space")).isFalse();
		assertThat(Identifiers.isIdentifier("")).isFalse();
		assertThat(Identifiers.isIdentifier(null)).isFalse();
	}

	@Test
	void anyVersionStringIsKept()
	{
		assertThat(Identifiers.checkVersion("1.0.0")).isEqualTo("1.0.0");
		assertThat(Identifiers.checkVersion("1.0")).isEqualTo("1.0");
	}
}
