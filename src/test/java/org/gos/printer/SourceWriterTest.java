package org.gos.printer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceWriterTest
{
	@Test
	void tracksColumnAcrossNewlines()
	{
		SourceWriter writer = new SourceWriter(4, 100);
		writer.write("ab\ncd");
		assertThat(writer.column()).isEqualTo(2);
		writer.line(2);
		assertThat(writer.column()).isEqualTo(8);
		assertThat(writer.toString()).isEqualTo("ab\ncd\n        ");
	}

	@Test
	void fitsUpToMaxColumnInclusive()
	{
		SourceWriter writer = new SourceWriter(4, 10);
		writer.write("12345");
		assertThat(writer.fits(5)).isTrue();
		assertThat(writer.fits(6)).isFalse();
	}

	@Test
	void listStaysOnOneLineWhenItFits()
	{
		SourceWriter writer = new SourceWriter(4, 20);
		writer.write("x = ");
		writer.writeList(List.of("aaa", "bbb"), ", ");
		assertThat(writer.toString()).isEqualTo("x = aaa, bbb");
	}

	@Test
	void listBreaksOneItemPerLineAlignedToItsStart()
	{
		SourceWriter writer = new SourceWriter(4, 10);
		writer.write("f(");
		writer.writeList(List.of("aaaa", "bbbb", "cccc"), ", ");
		assertThat(writer.toString()).isEqualTo("f(aaaa,\n  bbbb,\n  cccc");
	}

	@Test
	void compactModeNeverWraps()
	{
		SourceWriter writer = new SourceWriter(0, 5);
		writer.write("f(");
		writer.writeList(List.of("aaaa", "bbbb", "cccc"), ", ");
		writer.softLine(3);
		writer.writeWrapped(".x()", 1);
		assertThat(writer.toString()).isEqualTo("f(aaaa, bbbb, cccc.x()");
	}

	@Test
	void compactModeKeepsHardLinesWithoutIndentation()
	{
		SourceWriter writer = new SourceWriter(0, 100);
		writer.write("a");
		writer.line(3);
		writer.write("b");
		assertThat(writer.toString()).isEqualTo("a\nb");
	}

	@Test
	void wrappedSuffixMovesToContinuationLine()
	{
		SourceWriter writer = new SourceWriter(4, 10);
		writer.write("abcdefgh");
		writer.writeWrapped(" .x()", 1);
		assertThat(writer.toString()).isEqualTo("abcdefgh\n    .x()");
	}

	@Test
	void rejectsInvalidSettings()
	{
		assertThatThrownBy(() -> new SourceWriter(-1, 10)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new SourceWriter(4, 0)).isInstanceOf(IllegalArgumentException.class);
	}
}
