package org.metricshub.bmsflow;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.bmsflow.backend.Diagnostic;
import org.metricshub.bmsflow.backend.Resolution;
import org.metricshub.bmsflow.backend.WarningKind;
import org.metricshub.bmsflow.frontend.Token;
import org.metricshub.bmsflow.jrt.FixedRandomSource;
import org.metricshub.bmsflow.util.ResolverSettings;

/**
 * Reusable helpers for BmsFlow tests. The fluent builders
 * ({@link #flowTest(String)} and {@link #cliTest(String)}) let tests describe
 * a chart, the random values to use and the expected result before running
 * it, either through the {@link BmsFlow} API or through the {@link Cli}.
 */
public final class BmsTestSupport {

	private static final Path SHARED_TEMP_DIR;

	static {
		try {
			SHARED_TEMP_DIR = Files.createTempDirectory("bmsflow-shared");
			SHARED_TEMP_DIR.toFile().deleteOnExit();
		} catch (IOException ex) {
			throw new ExceptionInInitializerError(ex);
		}
	}

	private BmsTestSupport() {}

	/**
	 * @param description human readable description used in assertion messages
	 * @return a builder resolving a chart with the {@link BmsFlow} API
	 */
	public static FlowTestBuilder flowTest(String description) {
		return new FlowTestBuilder(description);
	}

	/**
	 * @param description human readable description used in assertion messages
	 * @return a builder running the {@link Cli}
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Joins chart lines with {@code \n}.
	 *
	 * @param lines chart lines
	 * @return the chart text
	 */
	public static String chart(String... lines) {
		return String.join("\n", lines) + "\n";
	}

	/**
	 * @param tokens resolved tokens
	 * @return their source text
	 */
	public static List<String> texts(List<Token> tokens) {
		List<String> texts = new ArrayList<String>();
		for (Token token : tokens) {
			texts.add(token.getText());
		}
		return texts;
	}

	/**
	 * @param diagnostics diagnostics of a resolution
	 * @return their kinds, in order
	 */
	public static List<WarningKind> kinds(List<Diagnostic> diagnostics) {
		List<WarningKind> kinds = new ArrayList<WarningKind>();
		for (Diagnostic diagnostic : diagnostics) {
			kinds.add(diagnostic.getKind());
		}
		return kinds;
	}

	/**
	 * Builder for tests going through {@link BmsFlow}.
	 */
	public static final class FlowTestBuilder {
		private final String description;
		private String chart = "";
		private FixedRandomSource values;
		private boolean tree;
		private List<String> expectedLines;
		private List<WarningKind> expectedDiagnostics = Collections.emptyList();

		private FlowTestBuilder(String description) {
			this.description = description;
		}

		public FlowTestBuilder chart(String... lines) {
			this.chart = BmsTestSupport.chart(lines);
			return this;
		}

		/**
		 * Values returned, in a loop, for each {@code #RANDOM} and {@code #SWITCH}.
		 */
		public FlowTestBuilder values(long... randomValues) {
			this.values = FixedRandomSource.of(randomValues);
			return this;
		}

		/**
		 * Resolve through the control-flow tree (isolated switch branches).
		 */
		public FlowTestBuilder tree() {
			this.tree = true;
			return this;
		}

		public FlowTestBuilder expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return this;
		}

		public FlowTestBuilder expectDiagnostics(WarningKind... kinds) {
			this.expectedDiagnostics = Arrays.asList(kinds);
			return this;
		}

		/**
		 * Resolves the chart without asserting anything.
		 *
		 * @return the resolution
		 * @throws IOException when the chart cannot be lexed
		 */
		public Resolution run() throws IOException {
			ResolverSettings settings = new ResolverSettings();
			if (values != null) {
				settings.setRandomSource(values);
			}
			settings.setTreeMode(tree);
			return new BmsFlow(settings).resolve(chart);
		}

		public Resolution runAndAssert() throws IOException {
			Resolution resolution = run();
			if (expectedLines != null) {
				assertEquals(description, expectedLines, texts(resolution.getTokens()));
			}
			assertEquals(description + " (diagnostics)", expectedDiagnostics, kinds(resolution.getDiagnostics()));
			return resolution;
		}
	}

	/**
	 * Outcome of a CLI run.
	 */
	public static final class CliResult {
		private final int exitCode;
		private final String output;
		private final String error;

		CliResult(int exitCode, String output, String error) {
			this.exitCode = exitCode;
			this.output = output;
			this.error = error;
		}

		public int exitCode() {
			return exitCode;
		}

		public String output() {
			return output;
		}

		public String error() {
			return error;
		}

		/**
		 * @return stdout split into lines, Windows line endings normalized
		 */
		public List<String> lines() {
			String normalized = output.replace("\r\n", "\n");
			if (normalized.isEmpty()) {
				return Collections.emptyList();
			}
			if (normalized.endsWith("\n")) {
				normalized = normalized.substring(0, normalized.length() - 1);
			}
			return Arrays.asList(normalized.split("\n", -1));
		}
	}

	/**
	 * Builder for tests going through {@link Cli}.
	 */
	public static final class CliTestBuilder {
		private final String description;
		private final List<String> args = new ArrayList<String>();
		private String stdin = "";
		private List<String> expectedLines;
		private int expectedExitCode;

		private CliTestBuilder(String description) {
			this.description = description;
		}

		public CliTestBuilder args(String... arguments) {
			args.addAll(Arrays.asList(arguments));
			return this;
		}

		public CliTestBuilder stdin(String... lines) {
			this.stdin = BmsTestSupport.chart(lines);
			return this;
		}

		/**
		 * Writes a chart to a temporary file and appends its path to the arguments.
		 */
		public CliTestBuilder chartFile(String... lines) throws IOException {
			Path file = Files.createTempFile(SHARED_TEMP_DIR, "chart", ".bms");
			file.toFile().deleteOnExit();
			Files.write(file, BmsTestSupport.chart(lines).getBytes(StandardCharsets.UTF_8));
			args.add(file.toString());
			return this;
		}

		public CliTestBuilder expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return this;
		}

		public CliTestBuilder expectExitCode(int code) {
			this.expectedExitCode = code;
			return this;
		}

		public CliResult run() {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			int code;
			try (PrintStream os = new PrintStream(out, true, "UTF-8");
					PrintStream es = new PrintStream(err, true, "UTF-8")) {
				code = Cli
						.execute(
								args.toArray(new String[0]),
								new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
								os,
								es);
			} catch (IOException e) {
				throw new IllegalStateException(e);
			}
			return new CliResult(
					code,
					new String(out.toByteArray(), StandardCharsets.UTF_8),
					new String(err.toByteArray(), StandardCharsets.UTF_8));
		}

		public CliResult runAndAssert() {
			CliResult result = run();
			assertEquals(description + " (exit code), stderr: " + result.error(), expectedExitCode, result.exitCode());
			if (expectedLines != null) {
				assertEquals(description, expectedLines, result.lines());
			}
			return result;
		}
	}
}
