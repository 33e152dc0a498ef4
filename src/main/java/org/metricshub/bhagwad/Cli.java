package org.metricshub.bhagwad;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Bhagwad
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.metricshub.bhagwad.frontend.Token;
import org.metricshub.bhagwad.util.AstDumper;
import org.metricshub.bhagwad.util.BhagwadLogger;
import org.metricshub.bhagwad.util.ScriptFileSource;
import org.metricshub.bhagwad.util.ScriptSource;
import org.metricshub.bhagwad.util.TranslatorSettings;
import org.slf4j.Logger;

/**
 * Command-line interface for the Bhagwad translator.
 */
public final class Cli {

	private static final Logger LOG = BhagwadLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "bhagwad.jar";
		}
		JAR_NAME = myName;
	}

	private final TranslatorSettings settings = new TranslatorSettings();
	private final PrintStream out;

	private ScriptSource scriptSource;
	private Path outputFile;
	private boolean compileNextToScript;
	private boolean dumpTokens;
	private boolean dumpSyntaxTree;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance using the supplied stream.
	 *
	 * @param out stream where the generated code, dumps and usage are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
	}

	/**
	 * Returns the mutable {@link TranslatorSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public TranslatorSettings getSettings() {
		return settings;
	}

	/**
	 * @return the script specified on the command line, {@code null} before parsing
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * @return the file the generated code is written to, or {@code null} for the standard output
	 */
	public Path getOutputFile() {
		return outputFile;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException if the arguments are invalid
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// script file name
				setScriptSource(new ScriptFileSource(arg), arg);
			} else if (arg.equals("-e")) {
				// -e source : script given on the command line
				checkParameterHasArgument(args, argIdx);
				setScriptSource(ScriptSource.fromString(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, args[++argIdx]), arg);
			} else if (arg.equals("-c")) {
				// -c file.bhagwad : write file.py next to the script
				checkParameterHasArgument(args, argIdx);
				setScriptSource(new ScriptFileSource(args[++argIdx]), arg);
				compileNextToScript = true;
			} else if (arg.equals("-o")) {
				// -o filename : write the generated code to a file
				checkParameterHasArgument(args, argIdx);
				outputFile = Paths.get(args[++argIdx]);
			} else if (arg.equals("--dump-tokens")) {
				dumpTokens = true;
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("--no-annotations")) {
				settings.setEmitAnnotations(false);
			} else if (arg.equals("--no-header")) {
				settings.setEmitHeader(false);
			} else if (arg.equals("--indent")) {
				// --indent n : number of spaces per indentation level
				checkParameterHasArgument(args, argIdx);
				String value = args[++argIdx];
				try {
					settings.setIndent(Integer.parseInt(value));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid indentation: " + value, e);
				}
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			throw new IllegalArgumentException("Bhagwad script not provided.");
		}
		if (compileNextToScript) {
			if (outputFile != null) {
				throw new IllegalArgumentException("-c and -o cannot be used together.");
			}
			outputFile = ((ScriptFileSource) scriptSource).getDefaultOutputPath();
		}
	}

	private void setScriptSource(ScriptSource source, String arg) {
		if (scriptSource != null) {
			throw new IllegalArgumentException("Only one script can be translated, unexpected: " + arg);
		}
		scriptSource = source;
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the script cannot be read or the output cannot be written
	 * @throws TranslationException if the script is invalid
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}

		LOG.debug("Settings:\n{}", settings.toDescriptionString());
		Bhagwad bhagwad = new Bhagwad(settings);

		if (dumpTokens || dumpSyntaxTree) {
			String script = scriptSource.readScript();
			try {
				List<Token> tokens = bhagwad.tokenize(script);
				if (dumpTokens) {
					out.print(AstDumper.dumpTokens(tokens));
				}
				if (dumpSyntaxTree) {
					out.print(AstDumper.dump(bhagwad.parse(tokens)));
				}
			} catch (TranslationException e) {
				throw e.withSourceDescription(scriptSource.getDescription());
			}
			return;
		}

		String python = bhagwad.translate(scriptSource);
		if (outputFile == null) {
			out.print(python);
		} else {
			Files.write(outputFile, python.getBytes(StandardCharsets.UTF_8));
			LOG.info("Wrote {} to {}", scriptSource.getDescription(), outputFile);
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-o output-filename]" +
								" [--dump-tokens]" +
								" [--dump-syntax]" +
								" [--no-annotations]" +
								" [--no-header]" +
								" [--indent n]" +
								" (script.bhagwad | -c script.bhagwad | -e script)");
		dest.println();
		dest.println(" -e script = Translate the script given on the command line.");
		dest.println(" -c filename = Translate filename.bhagwad into filename.py, next to it.");
		dest.println(" -o filename = Write the Python code to filename instead of the standard output.");
		dest.println();
		dest.println(" --dump-tokens = Print the tokens instead of the Python code.");
		dest.println(" --dump-syntax = Print the syntax tree instead of the Python code.");
		dest.println(" --no-annotations = Do not add comments naming the Bhagwad constructs.");
		dest.println(" --no-header = Do not add the shebang line and the module docstring.");
		dest.println(" --indent n = Indent the Python code with n spaces (4 by default).");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Formats a translation error for the standard error.
	 *
	 * @param e the error
	 * @return {@code Name (line L, column C): message}, or {@code Name: message}
	 *         if the position is unknown
	 */
	static String formatError(TranslationException e) {
		StringBuilder text = new StringBuilder(e.getClass().getSimpleName());
		if (e.getLineNumber() >= 0) {
			text.append(" (line ").append(e.getLineNumber());
			if (e.getColumnNumber() >= 0) {
				text.append(", column ").append(e.getColumnNumber());
			}
			text.append(')');
		}
		return text.append(": ").append(e.getMessage()).toString();
	}

	/**
	 * Parses the arguments and executes the CLI, reporting errors on the
	 * specified error stream.
	 *
	 * @param args command-line arguments
	 * @param out stream for the generated code
	 * @param err stream for error messages
	 * @return the exit status: 0 on success, 1 on failure
	 */
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		try {
			Cli cli = new Cli(out);
			cli.parse(args);
			cli.run();
			return 0;
		} catch (TranslationException e) {
			err.println(formatError(e));
			return 1;
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			return 1;
		} catch (IOException e) {
			err.println(e.getClass().getSimpleName() + ": " + e.getMessage());
			return 1;
		}
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		System.exit(execute(args, System.out, System.err));
	}
}
