package org.gos;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest
{
	@Test
	void compilesToOutputFile(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("config.gos");
		Path target = dir.resolve("config.json");
		Files.writeString(source, "var { a = 1; } as cfg;");

		assertThat(Main.run(new String[] {"compile", source.toString(), "-o", target.toString()})).isZero();
		assertThat(Files.readString(target)).contains("\"cfg.a\": 1").endsWith("}\n");
	}

	@Test
	void decompilesToOutputFile(@TempDir Path dir) throws Exception
	{
		Path ir = dir.resolve("ir.json");
		Path target = dir.resolve("out.gos");
		Files.writeString(ir, "{\"nodes\": {\"n\": {\"op_name\": \"x.op\", \"output\": [\"n\"]}}}");

		assertThat(Main.run(new String[] {"decompile", ir.toString(), "--output", target.toString()})).isZero();
		assertThat(Files.readString(target)).isEqualTo("n = x.op();\n");
	}

	@Test
	void formatsInPlace(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("a.gos");
		Files.writeString(source, "var{a=1;}");

		assertThat(Main.run(new String[] {"format", "-w", source.toString()})).isZero();
		assertThat(Files.readString(source)).isEqualTo("var {\n    a = 1;\n};\n");
	}

	@Test
	void failuresGiveExitCodeOne(@TempDir Path dir) throws Exception
	{
		Path broken = dir.resolve("broken.gos");
		Files.writeString(broken, "var { a = ; }");

		assertThat(Main.run(new String[] {"compile", broken.toString()})).isEqualTo(1);
		assertThat(Main.run(new String[] {"compile", dir.resolve("missing.gos").toString()})).isEqualTo(1);
		assertThat(Main.run(new String[] {"explode", "x"})).isEqualTo(1);
	}

	@Test
	void helpAndVersionSucceed()
	{
		assertThat(Main.run(new String[] {"--help"})).isZero();
		assertThat(Main.run(new String[] {"--version"})).isZero();
	}
}
