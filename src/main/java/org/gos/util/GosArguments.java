package org.gos.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds the command line of {@code gosc}: one command ({@code compile},
 * {@code decompile} or {@code format}), one input file and the options of that command.
 */
public class GosArguments
{
	public enum Command
	{
		COMPILE, DECOMPILE, FORMAT
	}

	private Command command = null;
	private Path inputFile = null;
	private Path outputPath = null;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean writeInPlace = false;
	private boolean unescape = false;
	private boolean keepOrder = false;
	private Integer indent = null;
	private Integer maxCol = null;

	// use parse()
	private GosArguments()
	{
	}

	/**
	 * @throws IllegalArgumentException for an unknown option, a missing value or a missing command
	 */
	public static GosArguments parse(String[] args)
	{
		GosArguments parsedArgs = new GosArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true;
			return parsedArgs;
		}

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];

			// --- Flags with no argument ---
			if (arg.equals("-h") || arg.equals("--help"))
			{
				parsedArgs.helpFlag = true;
				return parsedArgs;
			}
			if (arg.equals("--version"))
			{
				parsedArgs.versionFlag = true;
				return parsedArgs;
			}
			if (arg.equals("-v") || arg.equals("--verbose"))
			{
				parsedArgs.verboseFlag = true;
				Debug.ENABLE_DEBUG = true;
				continue;
			}
			if (arg.equals("-w") || arg.equals("--write"))
			{
				parsedArgs.writeInPlace = true;
				continue;
			}
			if (arg.equals("--unescape"))
			{
				parsedArgs.unescape = true;
				continue;
			}
			if (arg.equals("--keep-order"))
			{
				parsedArgs.keepOrder = true;
				continue;
			}

			// --- Flags with one argument ---
			if (arg.equals("-o") || arg.equals("--output"))
			{
				parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
				continue;
			}
			if (arg.equals("--indent"))
			{
				parsedArgs.indent = parseInt(getNextArg(args, ++i, arg), arg);
				continue;
			}
			if (arg.equals("--max-col"))
			{
				parsedArgs.maxCol = parseInt(getNextArg(args, ++i, arg), arg);
				continue;
			}

			if (arg.startsWith("-"))
			{
				throw new IllegalArgumentException("Unknown option: " + arg);
			}

			// first positional is the command, the second the input file
			if (parsedArgs.command == null)
			{
				parsedArgs.command = parseCommand(arg);
			}
			else if (parsedArgs.inputFile == null)
			{
				parsedArgs.inputFile = Paths.get(arg);
			}
			else
			{
				throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (parsedArgs.command == null)
		{
			throw new IllegalArgumentException("No command given. Use -h for help.");
		}
		if (parsedArgs.inputFile == null)
		{
			throw new IllegalArgumentException("No input file provided. Use -h for help.");
		}
		return parsedArgs;
	}

	private static Command parseCommand(String arg)
	{
		return switch (arg)
		{
			case "compile" -> Command.COMPILE;
			case "decompile" -> Command.DECOMPILE;
			case "format" -> Command.FORMAT;
			default -> throw new IllegalArgumentException("Unknown command: " + arg);
		};
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	private static int parseInt(String value, String flag)
	{
		try
		{
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid number for " + flag + ": " + value);
		}
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Toolchain for the GOS graph configuration language.");
		System.out.println("\nUSAGE: gosc [options] <command> <file>");
		System.out.println("\nCOMMANDS:");
		System.out.println("  compile <file.gos>        Compile source to JSON IR.");
		System.out.println("  decompile <file.json>     Render JSON IR back to source.");
		System.out.println("  format <file.gos>         Pretty-print source, keeping comments.");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show the toolchain version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -o, --output <file>       Write the result to <file> instead of stdout.");
		System.out.println("  -w, --write               format: rewrite the input file in place.");
		System.out.println("  --indent <n>              Spaces per level (0 = compact). Default 4.");
		System.out.println("  --max-col <n>             Column budget for wrapping. Default 100.");
		System.out.println("  --unescape                decompile: unescape \\n, \\t, ... in strings first.");
		System.out.println("  --keep-order              decompile: keep node order instead of sorting by key.");
	}

	// --- Getters ---

	public Command getCommand()
	{
		return command;
	}

	public Path getInputFile()
	{
		return inputFile;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isWriteInPlace()
	{
		return writeInPlace;
	}

	public boolean isUnescape()
	{
		return unescape;
	}

	public boolean isKeepOrder()
	{
		return keepOrder;
	}

	/**
	 * {@code null} when not given on the command line.
	 */
	public Integer getIndent()
	{
		return indent;
	}

	public Integer getMaxCol()
	{
		return maxCol;
	}
}
