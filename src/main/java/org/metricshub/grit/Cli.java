package org.metricshub.grit;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Grit
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
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
import java.util.List;
import org.metricshub.grit.frontend.Token;
import org.metricshub.grit.frontend.ast.LexerException;
import org.metricshub.grit.frontend.ast.ParserException;
import org.metricshub.grit.frontend.ast.Program;
import org.metricshub.grit.frontend.ast.Statement;
import org.metricshub.grit.util.GritLogger;
import org.metricshub.grit.util.GritSettings;
import org.metricshub.grit.util.ScriptFileSource;
import org.metricshub.grit.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Grit.
 * <p>
 * By default, prints the tokens, the syntax tree and the generated Rust code
 * of one script file, each in its own section.
 */
public final class Cli {

	private static final Logger LOG = GritLogger.getLogger(Cli.class);

	private static final String SECTION_INDENT = "  ";

	private final GritSettings settings = new GritSettings();

	private ScriptSource scriptSource;
	private boolean dumpTokens;
	private boolean dumpSyntaxTree;
	private boolean emitCode;
	private File outputFile;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams. The error stream is
	 * currently unused, errors are reported by {@link #execute(String[], PrintStream, PrintStream)}.
	 *
	 * @param out stream where the translation report is written
	 * @param err stream where error messages could be written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, @SuppressWarnings("unused") PrintStream err) {
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link GritSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public GritSettings getSettings() {
		return settings;
	}

	/**
	 * @return the script to translate, or <code>null</code> before parsing or when printing usage
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// file name
				if (scriptSource != null) {
					throw new IllegalArgumentException("Only one script file may be given: " + arg);
				}
				scriptSource = new ScriptFileSource(arg);
			} else if (arg.equals("-f")) {
				// -f filename : same as a bare file name
				checkParameterHasArgument(args, argIdx);
				if (scriptSource != null) {
					throw new IllegalArgumentException("Only one script file may be given: " + args[argIdx + 1]);
				}
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("--tokens")) {
				dumpTokens = true;
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("--emit")) {
				emitCode = true;
			} else if (arg.equals("-o")) {
				// -o filename : write the generated code to a file
				checkParameterHasArgument(args, argIdx);
				outputFile = new File(args[++argIdx]);
			} else if (arg.equals("--indent")) {
				// --indent n : spaces per indentation level
				checkParameterHasArgument(args, argIdx);
				String width = args[++argIdx];
				try {
					settings.setIndentWidth(Integer.parseInt(width));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid indentation width: " + width, e);
				}
			} else if (arg.equals("-h") || arg.equals("-?") || arg.equals("--help")) {
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
			throw new IllegalArgumentException("Grit script file not provided.");
		}
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
	 * Translates the script based on the previously parsed arguments.
	 *
	 * @throws IOException if the script cannot be read or the output file cannot be written
	 * @throws LexerException on a character that starts no token
	 * @throws ParserException when the script does not follow the grammar
	 */
	public void run() throws IOException, LexerException, ParserException {
		PrintStream out = settings.getOutputStream();
		if (printUsage) {
			usage(out);
			return;
		}
		LOG.debug("Translating {} with settings:\n{}", scriptSource, settings.toDescriptionString());

		String source;
		try {
			source = scriptSource.readFully();
		} catch (IOException e) {
			throw new IOException("Error reading file '" + scriptSource.getDescription() + "': " + e.getMessage(), e);
		}

		// no section switch: print every section
		boolean defaultReport = !dumpTokens && !dumpSyntaxTree && !emitCode && outputFile == null;
		Grit grit = new Grit(settings);

		List<Token> tokens = grit.tokenize(source);
		if (dumpTokens || defaultReport) {
			out.println("Tokens:");
			for (Token token : tokens) {
				out.println(SECTION_INDENT + token);
			}
		}

		if (defaultReport && source.trim().isEmpty()) {
			out.println();
			out.println("Empty input - nothing to parse");
			return;
		}

		Program program = grit.parse(tokens);
		if (dumpSyntaxTree || defaultReport) {
			if (dumpTokens || defaultReport) {
				out.println();
			}
			out.println("AST:");
			for (Statement statement : program.getStatements()) {
				out.println(SECTION_INDENT + statement);
			}
		}

		String code = grit.generate(program);
		if (outputFile != null) {
			Files.write(outputFile.toPath(), code.getBytes(StandardCharsets.UTF_8));
			LOG.debug("Wrote generated code to {}", outputFile);
		} else if (emitCode) {
			out.print(code);
		} else if (defaultReport) {
			out.println();
			out.println("Generated Rust code:");
			for (String line : code.split("\n")) {
				out.println(line.isEmpty() ? "" : SECTION_INDENT + line);
			}
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage: grit [--tokens] [--dump-syntax] [--emit] [-o output-filename] [--indent n] <file.grit>");
		dest.println();
		dest.println(" <file.grit> or -f filename = Grit script to translate.");
		dest.println(" --tokens = Print the tokens.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println(" --emit = Print only the generated Rust code.");
		dest.println(" -o filename = Write the generated Rust code to filename.");
		dest.println(" --indent n = Indent the generated code by n spaces per level (default 4).");
		dest.println();
		dest.println(" Without any of the switches above, the tokens, the syntax tree and the");
		dest.println(" generated code are all printed.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses the arguments and translates the script, reporting failures on the
	 * error stream.
	 *
	 * @param args command-line arguments
	 * @param out stream for the translation report
	 * @param err stream for usage and error messages
	 * @return the process exit code: <code>0</code> on success, <code>1</code> on any failure
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		Cli cli = new Cli(out, err);
		try {
			cli.parse(args);
			cli.run();
			return 0;
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			usage(err);
			return 1;
		} catch (LexerException e) {
			err.println("Lexical error: " + e.getMessage());
			return 1;
		} catch (ParserException e) {
			err.println("Parse error: " + e.getMessage());
			return 1;
		} catch (IOException e) {
			err.println(e.getMessage());
			return 1;
		} catch (RuntimeException e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			LOG.debug("Translation failed", e);
			return 1;
		}
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		int exitCode = execute(args, System.out, System.err);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}
}
