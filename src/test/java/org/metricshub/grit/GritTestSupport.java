package org.metricshub.grit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

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
import org.metricshub.grit.util.GritSettings;

/**
 * Reusable helpers for building and executing Grit tests. Tests describe the
 * script, the settings or command-line arguments and the expectations with a
 * fluent builder ({@link #gritTest(String)} for the {@link Grit} API,
 * {@link #cliTest(String)} for the {@link Cli} entry point), then run and
 * assert in one call.
 */
public final class GritTestSupport {

	private static final Path SHARED_TEMP_DIR;

	static {
		try {
			SHARED_TEMP_DIR = Files.createTempDirectory("grit-shared");
			SHARED_TEMP_DIR.toFile().deleteOnExit();
		} catch (IOException ex) {
			throw new ExceptionInInitializerError(ex);
		}
	}

	private GritTestSupport() {}

	/**
	 * Creates a builder for a test that translates a script with the {@link Grit} API.
	 * The captured output is the generated Rust code.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static GritTestBuilder gritTest(String description) {
		return new GritTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that invokes {@link Cli#execute(String[], PrintStream, PrintStream)}.
	 * The script, when given, is written to a temporary file whose path is passed
	 * as the last argument.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * @return the temporary directory that builders write script files into
	 */
	public static Path sharedTempDirectory() {
		return SHARED_TEMP_DIR;
	}

	/**
	 * A fully configured test case produced by one of the builders.
	 */
	public interface ConfiguredTest {
		/**
		 * @return the description defined by the builder
		 */
		String description();

		/**
		 * Executes the configured test case and returns the captured result
		 * without asserting it.
		 *
		 * @return the captured output, exit code, and expected values
		 * @throws Exception when executing the test fails unexpectedly
		 */
		TestResult run() throws Exception;

		/**
		 * Executes the configured test case and asserts the result against the
		 * configured expectations.
		 *
		 * @throws Exception when executing the test fails unexpectedly
		 */
		default void runAndAssert() throws Exception {
			run().assertExpected();
		}
	}

	/**
	 * Outcome of one execution, with the expectations it is checked against.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final String errorOutput;
		private final int exitCode;
		private final Expectations expectations;
		private final Throwable thrownException;

		TestResult(
				String description,
				String output,
				String errorOutput,
				int exitCode,
				Expectations expectations,
				Throwable thrownException) {
			this.description = description;
			this.output = output;
			this.errorOutput = errorOutput;
			this.exitCode = exitCode;
			this.expectations = expectations;
			this.thrownException = thrownException;
		}

		public String output() {
			return output;
		}

		public String errorOutput() {
			return errorOutput;
		}

		public int exitCode() {
			return exitCode;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * Returns the captured output split into individual lines, ignoring the
		 * trailing newline.
		 *
		 * @return the output lines
		 */
		public List<String> lines() {
			return normalizeOutputLines(output);
		}

		/**
		 * Verifies the captured output, exit code, error output or thrown exception
		 * against the expectations defined in the builder.
		 */
		public void assertExpected() {
			if (expectations.exception != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception "
									+ expectations.exception.getName()
									+ " for "
									+ description
									+ " but execution completed successfully");
				}
				if (!expectations.exception.isInstance(thrownException)) {
					throw new AssertionError(
							"Expected exception "
									+ expectations.exception.getName()
									+ " for "
									+ description
									+ " but got "
									+ thrownException.getClass().getName(),
							thrownException);
				}
				return;
			}
			if (thrownException != null) {
				throw new AssertionError("Unexpected exception for " + description, thrownException);
			}
			if (expectations.lines != null) {
				assertEquals("Unexpected output for " + description, expectations.lines, lines());
			} else if (expectations.output != null) {
				assertEquals("Unexpected output for " + description, expectations.output, output);
			}
			if (expectations.errorFragment != null) {
				assertTrue(
						"Error output of " + description + " should contain '" + expectations.errorFragment + "' but was: "
								+ errorOutput,
						errorOutput.contains(expectations.errorFragment));
			}
			int expectedExit = expectations.exitCode != null ? expectations.exitCode.intValue() : 0;
			assertEquals("Unexpected exit code for " + description, expectedExit, exitCode);
		}

		private static List<String> normalizeOutputLines(String output) {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = output.replace("\r\n", "\n");
			if (normalized.endsWith("\n")) {
				normalized = normalized.substring(0, normalized.length() - 1);
			}
			return Arrays.asList(normalized.split("\n", -1));
		}
	}

	/**
	 * Expected values recorded by a builder; <code>null</code> means "not checked".
	 */
	private static final class Expectations {
		private String output;
		private List<String> lines;
		private String errorFragment;
		private Integer exitCode;
		private Class<? extends Throwable> exception;
	}

	/**
	 * Fluent builder for tests that go through the {@link Grit} API.
	 */
	public static final class GritTestBuilder extends BaseTestBuilder<GritTestBuilder> {
		private GritSettings settings = new GritSettings();

		private GritTestBuilder(String description) {
			super(description);
		}

		/**
		 * Uses the given settings instead of the defaults.
		 *
		 * @param customSettings settings passed to {@link Grit}
		 * @return this builder for method chaining
		 */
		public GritTestBuilder withSettings(GritSettings customSettings) {
			this.settings = customSettings;
			return this;
		}

		@Override
		public ConfiguredTest build() {
			return new GritTestCase(this);
		}
	}

	/**
	 * Fluent builder for tests that go through the command line.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> arguments = new ArrayList<>();

		private CliTestBuilder(String description) {
			super(description);
		}

		/**
		 * Adds command-line arguments, placed before the script file.
		 *
		 * @param args arguments to append
		 * @return this builder for method chaining
		 */
		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		/**
		 * Expects the error stream to contain the given text.
		 *
		 * @param fragment text the error output must contain
		 * @return this builder for method chaining
		 */
		public CliTestBuilder expectError(String fragment) {
			expectations.errorFragment = fragment;
			return this;
		}

		@Override
		public ConfiguredTest build() {
			return new CliTestCase(this);
		}
	}

	private abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		protected final String description;
		protected final Expectations expectations = new Expectations();
		protected String script;

		BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		private B self() {
			return (B) this;
		}

		/**
		 * @param scriptText Grit source to translate
		 * @return this builder for method chaining
		 */
		public B script(String scriptText) {
			this.script = scriptText;
			return self();
		}

		/**
		 * @param expected exact expected output
		 * @return this builder for method chaining
		 */
		public B expect(String expected) {
			expectations.output = expected;
			return self();
		}

		/**
		 * @param lines expected output lines, without line terminators
		 * @return this builder for method chaining
		 */
		public B expectLines(String... lines) {
			expectations.lines = Arrays.asList(lines);
			return self();
		}

		/**
		 * @param code expected exit code
		 * @return this builder for method chaining
		 */
		public B expectExit(int code) {
			expectations.exitCode = code;
			return self();
		}

		/**
		 * @param exceptionClass type of the exception the execution must throw
		 * @return this builder for method chaining
		 */
		public B expectThrow(Class<? extends Throwable> exceptionClass) {
			expectations.exception = exceptionClass;
			return self();
		}

		public abstract ConfiguredTest build();

		public TestResult run() throws Exception {
			return build().run();
		}

		public void runAndAssert() throws Exception {
			build().runAndAssert();
		}
	}

	private static final class GritTestCase implements ConfiguredTest {
		private final String description;
		private final String script;
		private final GritSettings settings;
		private final Expectations expectations;

		GritTestCase(GritTestBuilder builder) {
			this.description = builder.description;
			this.script = builder.script;
			this.settings = builder.settings;
			this.expectations = builder.expectations;
		}

		@Override
		public String description() {
			return description;
		}

		@Override
		public TestResult run() throws Exception {
			String output = "";
			Throwable thrown = null;
			try {
				output = new Grit(settings).translate(script);
			} catch (Exception e) {
				if (expectations.exception == null) {
					throw e;
				}
				thrown = e;
			}
			return new TestResult(description, output, "", 0, expectations, thrown);
		}
	}

	private static final class CliTestCase implements ConfiguredTest {
		private final String description;
		private final String script;
		private final List<String> arguments;
		private final Expectations expectations;

		CliTestCase(CliTestBuilder builder) {
			this.description = builder.description;
			this.script = builder.script;
			this.arguments = new ArrayList<>(builder.arguments);
			this.expectations = builder.expectations;
		}

		@Override
		public String description() {
			return description;
		}

		@Override
		public TestResult run() throws Exception {
			List<String> args = new ArrayList<>(arguments);
			Path scriptFile = null;
			if (script != null) {
				scriptFile = Files.createTempFile(SHARED_TEMP_DIR, "script", ".grit");
				Files.write(scriptFile, script.getBytes(StandardCharsets.UTF_8));
				args.add(scriptFile.toString());
			}
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			int exitCode;
			try (PrintStream outStream = new PrintStream(out, true, "UTF-8");
					PrintStream errStream = new PrintStream(err, true, "UTF-8")) {
				exitCode = Cli.execute(args.toArray(new String[0]), outStream, errStream);
			} finally {
				if (scriptFile != null) {
					Files.deleteIfExists(scriptFile);
				}
			}
			return new TestResult(
					description,
					new String(out.toByteArray(), StandardCharsets.UTF_8),
					new String(err.toByteArray(), StandardCharsets.UTF_8),
					exitCode,
					expectations,
					null);
		}
	}
}
