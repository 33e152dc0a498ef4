package org.metricshub.bhagwad;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.bhagwad.util.TranslatorSettings;

/**
 * Reusable helpers for building and executing translator tests. The class
 * exposes fluent builders ({@link #translatorTest(String)} and
 * {@link #cliTest(String)}) that let tests describe their scripts and
 * expectations declaratively before running and asserting the results of
 * either {@link Bhagwad} or {@link Cli}.
 */
public final class TranslatorTestSupport {

	private TranslatorTestSupport() {}

	/**
	 * Creates a builder for a test that translates a script with the
	 * {@link Bhagwad} API. The header is disabled by default, so that
	 * expectations only list the lines of the script itself.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static TranslatorTestBuilder translatorTest(String description) {
		return new TranslatorTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that exercises the {@link Cli} entry point.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Splits an output into lines. One trailing newline is ignored.
	 *
	 * @param output the output
	 * @return the lines, empty if there is no output
	 */
	public static List<String> lines(String output) {
		if (output.isEmpty()) {
			return Collections.emptyList();
		}
		String normalized = output.replace("\r\n", "\n");
		if (normalized.endsWith("\n")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return Arrays.asList(normalized.split("\n", -1));
	}

	/**
	 * Captures the outcome of a configured test, and the expectations to
	 * assert it against.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final String errorOutput;
		private final int exitCode;
		private final Expectations expected;
		private final Throwable thrownException;

		TestResult(
				String description,
				String output,
				String errorOutput,
				int exitCode,
				Expectations expected,
				Throwable thrownException) {
			this.description = description;
			this.output = output;
			this.errorOutput = errorOutput;
			this.exitCode = exitCode;
			this.expected = expected;
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

		public List<String> lines() {
			return TranslatorTestSupport.lines(output);
		}

		/**
		 * Verifies that the captured output, exit code, or thrown exception match
		 * the expectations defined in the builder.
		 */
		public void assertExpected() {
			if (expected.exception != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception "
									+ expected.exception.getName()
									+ " for "
									+ description
									+ " but execution completed successfully");
				}
				if (!expected.exception.isInstance(thrownException)) {
					throw new AssertionError(
							"Expected exception "
									+ expected.exception.getName()
									+ " for "
									+ description
									+ " but got "
									+ thrownException.getClass().getName(),
							thrownException);
				}
				if (expected.exceptionMessage != null) {
					assertEquals("Unexpected message for " + description, expected.exceptionMessage, thrownException.getMessage());
				}
				return;
			}
			if (thrownException != null) {
				throw new AssertionError("Unexpected exception for " + description, thrownException);
			}
			if (expected.lines != null) {
				assertEquals("Unexpected output for " + description, expected.lines, lines());
			} else if (expected.output != null) {
				assertEquals("Unexpected output for " + description, expected.output, output);
			}
			for (String fragment : expected.errorFragments) {
				assertTrue(
						"Error output of " + description + " should contain '" + fragment + "' but was: " + errorOutput,
						errorOutput.contains(fragment));
			}
			assertEquals("Unexpected exit code for " + description, expected.exitCode, exitCode);
		}
	}

	/**
	 * What a test expects, filled by the builders.
	 */
	static final class Expectations {
		private String output;
		private List<String> lines;
		private Class<? extends Throwable> exception;
		private String exceptionMessage;
		private final List<String> errorFragments = new ArrayList<>();
		private int exitCode;
	}

	/**
	 * Common part of the builders.
	 *
	 * @param <B> type of the concrete builder
	 */
	public abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		protected final String description;
		protected final Expectations expected = new Expectations();

		BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		protected B self() {
			return (B) this;
		}

		/**
		 * @param output the exact expected output
		 * @return this builder for method chaining
		 */
		public B expect(String output) {
			expected.output = output;
			return self();
		}

		/**
		 * @param lines the expected output lines
		 * @return this builder for method chaining
		 */
		public B expectLines(String... lines) {
			expected.lines = Arrays.asList(lines);
			return self();
		}

		/**
		 * @param exception the type of exception the execution must throw
		 * @return this builder for method chaining
		 */
		public B expectThrow(Class<? extends Throwable> exception) {
			expected.exception = exception;
			return self();
		}

		/**
		 * @param exception the type of exception the execution must throw
		 * @param message its expected message
		 * @return this builder for method chaining
		 */
		public B expectThrow(Class<? extends Throwable> exception, String message) {
			expected.exception = exception;
			expected.exceptionMessage = message;
			return self();
		}

		/**
		 * Executes the test and asserts the expectations.
		 *
		 * @throws Exception when the test cannot be executed
		 */
		public void runAndAssert() throws Exception {
			run().assertExpected();
		}

		/**
		 * Executes the test without asserting anything.
		 *
		 * @return the captured result
		 * @throws Exception when the test cannot be executed
		 */
		public abstract TestResult run() throws Exception;
	}

	/**
	 * Fluent builder for tests that translate a script with {@link Bhagwad}.
	 */
	public static final class TranslatorTestBuilder extends BaseTestBuilder<TranslatorTestBuilder> {
		private final StringBuilder script = new StringBuilder();
		private final TranslatorSettings settings = new TranslatorSettings();

		private TranslatorTestBuilder(String description) {
			super(description);
			settings.setEmitHeader(false);
			settings.setEmitAnnotations(false);
		}

		/**
		 * Appends lines to the script.
		 *
		 * @param lines lines of Bhagwad code
		 * @return this builder for method chaining
		 */
		public TranslatorTestBuilder script(String... lines) {
			for (String line : lines) {
				script.append(line).append('\n');
			}
			return this;
		}

		public TranslatorTestBuilder withHeader() {
			settings.setEmitHeader(true);
			return this;
		}

		public TranslatorTestBuilder withAnnotations() {
			settings.setEmitAnnotations(true);
			return this;
		}

		public TranslatorTestBuilder indent(int spaces) {
			settings.setIndent(spaces);
			return this;
		}

		@Override
		public TestResult run() {
			String output = "";
			Throwable thrown = null;
			try {
				output = new Bhagwad(settings).translate(script.toString());
			} catch (TranslationException e) {
				thrown = e;
			}
			return new TestResult(description, output, "", 0, expected, thrown);
		}
	}

	/**
	 * Fluent builder for tests that exercise the {@link Cli} entry point.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> arguments = new ArrayList<>();

		private CliTestBuilder(String description) {
			super(description);
		}

		/**
		 * @param args command-line arguments to add
		 * @return this builder for method chaining
		 */
		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		/**
		 * @param exitCode the expected exit status
		 * @return this builder for method chaining
		 */
		public CliTestBuilder expectExitCode(int exitCode) {
			expected.exitCode = exitCode;
			return this;
		}

		/**
		 * @param fragment text the error output must contain
		 * @return this builder for method chaining
		 */
		public CliTestBuilder expectError(String fragment) {
			expected.errorFragments.add(fragment);
			return this;
		}

		@Override
		public TestResult run() {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			int exitCode;
			try (PrintStream outStream = new PrintStream(out, true, StandardCharsets.UTF_8);
					PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8)) {
				exitCode = Cli.execute(arguments.toArray(new String[0]), outStream, errStream);
			}
			return new TestResult(
					description,
					new String(out.toByteArray(), StandardCharsets.UTF_8),
					new String(err.toByteArray(), StandardCharsets.UTF_8),
					exitCode,
					expected,
					null);
		}
	}
}
