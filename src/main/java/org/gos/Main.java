package org.gos;

import org.gos.compiler.Compiler;
import org.gos.decompiler.DecompileException;
import org.gos.decompiler.DecompileOptions;
import org.gos.decompiler.Decompiler;
import org.gos.dto.CompileResult;
import org.gos.error.GosException;
import org.gos.format.FormatException;
import org.gos.format.FormatOptions;
import org.gos.format.Formatter;
import org.gos.parser.AntlrSourceParser;
import org.gos.util.Debug;
import org.gos.util.ErrorHandler;
import org.gos.util.FileUtils;
import org.gos.util.GosArguments;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line front end: {@code gosc compile|decompile|format <file>}.
 */
public class Main
{
	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * Runs one command and returns the process exit code.
	 */
	public static int run(String[] args)
	{
		try
		{
			GosArguments arguments = GosArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				GosArguments.printUsage();
				return 0;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("gosc (GOS toolchain) version " + CompileResult.GOS_VERSION);
				return 0;
			}

			Path input = arguments.getInputFile();
			String output = switch (arguments.getCommand())
			{
				case COMPILE -> compile(input);
				case DECOMPILE -> decompile(arguments, input);
				case FORMAT -> format(arguments, input);
			};

			Path target = arguments.isWriteInPlace() ? input : arguments.getOutputPath();
			if (target == null)
			{
				System.out.print(output);
			}
			else
			{
				FileUtils.write(target, output);
				Debug.logInfo("Wrote " + target);
			}
			return 0;
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Invalid command line: " + e.getMessage());
			return 1;
		}
		catch (GosException | DecompileException | FormatException e)
		{
			Debug.logError(e.getMessage());
			return 1;
		}
	}

	private static String compile(Path input)
	{
		if (!Files.isRegularFile(input))
		{
			throw new IllegalArgumentException("Input file not found: " + input);
		}
		Debug.logDebug("Compiling " + input);
		ErrorHandler errorHandler = new ErrorHandler();
		CompileResult result = new Compiler().compile(new AntlrSourceParser().parse(FileUtils.read(input), errorHandler));
		return result.toJsonString() + "\n";
	}

	private static String decompile(GosArguments arguments, Path input)
	{
		DecompileOptions.Builder options = DecompileOptions.builder()
				.unescape(arguments.isUnescape())
				.keepOrder(arguments.isKeepOrder());
		if (arguments.getIndent() != null)
		{
			options.indent(arguments.getIndent());
		}
		if (arguments.getMaxCol() != null)
		{
			options.maxCol(arguments.getMaxCol());
		}
		String source = new Decompiler(options.build()).decompileFile(input);
		return source.endsWith("\n") ? source : source + "\n";
	}

	private static String format(GosArguments arguments, Path input)
	{
		FormatOptions.Builder options = FormatOptions.builder();
		if (arguments.getIndent() != null)
		{
			options.indent(arguments.getIndent());
		}
		if (arguments.getMaxCol() != null)
		{
			options.maxCol(arguments.getMaxCol());
		}
		return Formatter.formatFile(input, options.build());
	}
}
