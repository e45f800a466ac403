package org.gos;

import com.google.gson.JsonObject;
import org.gos.compiler.Compiler;
import org.gos.decompiler.Decompiler;
import org.gos.format.Formatter;
import org.gos.parser.AntlrSourceParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Source compiled to IR, decompiled and compiled again must give the same graphs and ops.
 */
class RoundTripTest
{
	private static final String SOURCE = """
			graph {
			    description = 'Nightly scoring';
			    retries = 3;
			    loader = data.load(path).version('1.0.0');
			    model = ml.train(data=loader).with(epochs=10, lr=0.5).depend(loader);
			    picked = retries > 1 ? ml.a(model) : ml.b(model);
			    each = [ml.score(x) for x in model];
			} as pipeline.version('2.0.0');

			op {
			    meta { description = 'Scores rows'; }
			    input {
			        rows: (dtype=string, length=[1, 100]);
			        mode: (dtype=string, choice=('fast', 'slow'));
			    }
			    output { score: float; }
			} as scorer.version('1.0.0');
			""";

	private static JsonObject compile(String source)
	{
		return new Compiler().compile(new AntlrSourceParser().parse(source)).toJson();
	}

	@Test
	void decompiledSourceCompilesToSameIr()
	{
		JsonObject first = compile(SOURCE);
		String decompiled = new Decompiler().decompile(first);
		JsonObject second = compile(decompiled);

		assertThat(second.get("graphs")).isEqualTo(first.get("graphs"));
		assertThat(second.get("ops")).isEqualTo(first.get("ops"));
	}

	@Test
	void formattedSourceCompilesToSameIr()
	{
		String formatted = Formatter.formatSource(SOURCE);

		assertThat(compile(formatted)).isEqualTo(compile(SOURCE));
		assertThat(Formatter.formatSource(formatted)).isEqualTo(formatted);
	}
}
