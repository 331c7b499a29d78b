package org.metricshub.bmsflow;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * BmsFlow
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.bmsflow.backend.Diagnostic;
import org.metricshub.bmsflow.backend.Resolution;
import org.metricshub.bmsflow.frontend.Token;
import org.metricshub.bmsflow.frontend.TreeDumper;
import org.metricshub.bmsflow.frontend.UnitExtractor;
import org.metricshub.bmsflow.frontend.ast.ControlFlowTree;
import org.metricshub.bmsflow.frontend.ast.LexerException;
import org.metricshub.bmsflow.jrt.BmsRuntimeException;
import org.metricshub.bmsflow.jrt.BsdRandomSource;
import org.metricshub.bmsflow.jrt.FixedRandomSource;
import org.metricshub.bmsflow.util.ChartFileSource;
import org.metricshub.bmsflow.util.ChartSource;
import org.metricshub.bmsflow.util.ResolverSettings;

/**
 * Command-line interface for BmsFlow.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "bmsflow.jar";
		}
		JAR_NAME = myName;
	}

	private final ResolverSettings settings = new ResolverSettings();
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;

	private final List<String> chartFiles = new ArrayList<String>();
	private boolean readStdin;

	private boolean dumpTree;
	private boolean extract;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which a chart is read when no file is given
	 * @param out stream where the resolved tokens are written
	 * @param err stream where diagnostics are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.in = in;
		this.out = out;
		this.err = err;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link ResolverSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ResolverSettings getSettings() {
		return settings;
	}

	/**
	 * @return the chart files given with {@code -f} or as positional arguments
	 */
	public List<String> getChartFiles() {
		return new ArrayList<String>(chartFiles);
	}

	public boolean isDumpTree() {
		return dumpTree;
	}

	public boolean isExtract() {
		return extract;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
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
			if (arg.equals("-")) {
				// - : read the chart from stdin
				readStdin = true;
			} else if (arg.charAt(0) != '-') {
				chartFiles.add(arg);
			} else if (arg.equals("-f")) {
				// -f filename : read the chart from a file
				checkParameterHasArgument(args, argIdx);
				chartFiles.add(args[++argIdx]);
			} else if (arg.equals("--seed")) {
				// --seed n : reproducible random values
				checkParameterHasArgument(args, argIdx);
				settings.setRandomSource(new BsdRandomSource(parseSeed(args[++argIdx])));
			} else if (arg.equals("--values")) {
				// --values 1,2,3 : force the random values
				checkParameterHasArgument(args, argIdx);
				settings.setRandomSource(FixedRandomSource.parse(args[++argIdx]));
			} else if (arg.equals("--encoding")) {
				checkParameterHasArgument(args, argIdx);
				settings.setCharset(parseCharset(args[++argIdx]));
			} else if (arg.equals("--tree")) {
				settings.setTreeMode(true);
			} else if (arg.equals("--strict-lex")) {
				settings.setRelaxed(false);
			} else if (arg.equals("--dump-tree")) {
				dumpTree = true;
			} else if (arg.equals("--extract")) {
				extract = true;
			} else if (arg.equals("--fail-on-warnings")) {
				settings.setFailOnWarnings(true);
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

		if (dumpTree && extract) {
			throw new IllegalArgumentException("--dump-tree and --extract cannot be used together.");
		}
		if (chartFiles.isEmpty()) {
			readStdin = true;
		} else if (readStdin) {
			throw new IllegalArgumentException("Cannot read charts from both stdin and files.");
		}
	}

	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static int parseSeed(String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Seed must be an integer: " + value, e);
		}
	}

	private static Charset parseCharset(String name) {
		try {
			return Charset.forName(name);
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			throw new IllegalArgumentException("Unknown encoding: " + name, e);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if a chart cannot be read
	 * @throws ExitException with code {@link ExitException#WARNINGS} when
	 *         diagnostics were reported and {@code --fail-on-warnings} is set
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		BmsFlow flow = new BmsFlow(settings);
		List<ChartSource> sources = chartSources();
		List<Diagnostic> diagnostics;
		if (dumpTree || extract) {
			ControlFlowTree tree = flow.buildTree(flow.lex(sources));
			if (dumpTree) {
				TreeDumper.dump(tree.getUnits(), out);
			} else {
				for (Token token : UnitExtractor.extract(tree.getUnits())) {
					out.println(token.getText());
				}
				out.flush();
			}
			diagnostics = tree.getDiagnostics();
		} else {
			Resolution resolution = flow.invoke(sources);
			diagnostics = resolution.getDiagnostics();
		}
		for (Diagnostic diagnostic : diagnostics) {
			err.println(diagnostic);
		}
		if (settings.isFailOnWarnings() && !diagnostics.isEmpty()) {
			throw new ExitException(ExitException.WARNINGS, diagnostics.size() + " warning(s) reported");
		}
	}

	private List<ChartSource> chartSources() {
		List<ChartSource> sources = new ArrayList<ChartSource>();
		if (readStdin) {
			sources.add(new ChartSource(ChartSource.DESCRIPTION_STDIN, new InputStreamReader(in, settings.getCharset())));
		}
		for (String file : chartFiles) {
			sources.add(new ChartFileSource(file, settings.getCharset()));
		}
		return sources;
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
								" [--seed n | --values v1,v2,...]" +
								" [--tree]" +
								" [--strict-lex]" +
								" [--encoding charset]" +
								" [--dump-tree | --extract]" +
								" [--fail-on-warnings]" +
								" [-f chart-filename]..." +
								" [chart-filename | -]...");
		dest.println();
		dest.println(" -f filename = Read the chart from filename.");
		dest.println(" - = Read the chart from the standard input (default when no file is given).");
		dest.println(" --seed n = Draw #RANDOM and #SWITCH values from a generator seeded with n.");
		dest.println(" --values v1,v2,... = Use the given values, in order, for #RANDOM and #SWITCH.");
		dest.println(" --tree = Resolve #SWITCH branches in isolation (no fallthrough).");
		dest.println(" --strict-lex = Do not accept #RONDAM, #IFEND, #END IF, #RANDOM5 and full-width #.");
		dest.println(" --encoding charset = Encoding of the chart files (UTF-8 by default).");
		dest.println(" --dump-tree = Print the control-flow tree instead of resolving it.");
		dest.println(" --extract = Print all the tokens of the control-flow tree, every branch included.");
		dest.println(" --fail-on-warnings = Exit with code " + ExitException.WARNINGS + " when warnings are reported.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for the chart when no file is given
	 * @param os output stream for the resolved tokens
	 * @param es error stream for diagnostics
	 * @return configured and executed CLI instance
	 * @throws IOException if a chart cannot be read
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		System.exit(execute(args, System.in, System.out, System.err));
	}

	/**
	 * Runs the command line and converts failures into an exit code.
	 *
	 * @param args command-line arguments
	 * @param is input stream for the chart when no file is given
	 * @param os output stream for the resolved tokens
	 * @param es error stream for diagnostics and errors
	 * @return the exit code: {@code 0} on success, {@code 1} on error,
	 *         {@link ExitException#WARNINGS} for warnings with {@code --fail-on-warnings}
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	static int execute(String[] args, InputStream is, PrintStream os, PrintStream es) {
		try {
			create(args, is, os, es);
			return 0;
		} catch (ExitException e) {
			es.println(e.getMessage());
			return e.getCode();
		} catch (BmsRuntimeException e) {
			if (e.getLineNumber() >= 0) {
				es.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				es.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			return 1;
		} catch (LexerException e) {
			es.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return 1;
		} catch (IllegalArgumentException e) {
			es.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			es.println(e.getMessage());
			return 1;
		} catch (Exception e) {
			es.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return 1;
		}
	}
}
