package org.metricshub.grit;

import static org.junit.Assert.*;
import static org.metricshub.grit.GritTestSupport.cliTest;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.grit.util.ScriptFileSource;

public class CliTest {

	@Rule
	public TemporaryFolder temp = new TemporaryFolder();

	@Test
	public void testDefaultReport() throws Exception {
		cliTest("tokens, syntax tree and code")
				.script("x = 5")
				.expectLines(
						"Tokens:",
						"  Token { type: Identifier(\"x\"), line: 1, column: 1 }",
						"  Token { type: Equals, line: 1, column: 3 }",
						"  Token { type: Integer(5), line: 1, column: 5 }",
						"  Token { type: Eof, line: 1, column: 6 }",
						"",
						"AST:",
						"  x = 5",
						"",
						"Generated Rust code:",
						"  fn main() {",
						"      let x = 5;",
						"  }")
				.runAndAssert();
	}

	@Test
	public void testDefaultReportWithFunction() throws Exception {
		GritTestSupport.TestResult result = cliTest("blank lines of the code section")
				.script("fn one {\n  1\n}\n")
				.run();
		assertEquals(0, result.exitCode());
		String output = result.output();
		assertTrue(output, output.contains("AST:\n  fn one()\n"));
		assertTrue(output, output.contains("Generated Rust code:\n  fn one() -> i64 {\n      1\n  }\n\n  fn main() {\n  }\n"));
	}

	@Test
	public void testEmptyInput() throws Exception {
		cliTest("empty script")
				.script("")
				.expectLines("Tokens:", "  Token { type: Eof, line: 1, column: 1 }", "", "Empty input - nothing to parse")
				.runAndAssert();
	}

	@Test
	public void testEmitOnly() throws Exception {
		cliTest("--emit")
				.argument("--emit")
				.script("x = 5")
				.expect("fn main() {\n    let x = 5;\n}\n")
				.runAndAssert();
		cliTest("--emit on empty script")
				.argument("--emit")
				.script("\n")
				.expect("fn main() {\n}\n")
				.runAndAssert();
	}

	@Test
	public void testTokensOnly() throws Exception {
		cliTest("--tokens")
				.argument("--tokens")
				.script("1")
				.expectLines("Tokens:", "  Token { type: Integer(1), line: 1, column: 1 }", "  Token { type: Eof, line: 1, column: 2 }")
				.runAndAssert();
	}

	@Test
	public void testSyntaxTreeOnly() throws Exception {
		cliTest("--dump-syntax")
				.argument("--dump-syntax")
				.script("class Point\nwhile x < 3 {\n  x = x + 1\n}\n")
				.expectLines("AST:", "  class Point", "  while (x < 3)")
				.runAndAssert();
	}

	@Test
	public void testIndentOption() throws Exception {
		cliTest("--indent 2")
				.argument("--indent", "2", "--emit")
				.script("x = 5")
				.expect("fn main() {\n  let x = 5;\n}\n")
				.runAndAssert();
		cliTest("--indent with a bad value")
				.argument("--indent", "two")
				.script("x = 5")
				.expectExit(1)
				.expectError("Invalid indentation width: two")
				.runAndAssert();
	}

	@Test
	public void testOutputFile() throws Exception {
		Path target = temp.getRoot().toPath().resolve("out.rs");
		cliTest("-o")
				.argument("-o", target.toString())
				.script("5")
				.expect("")
				.runAndAssert();
		assertEquals(
				"fn main() {\n    let result = 5;\n    println!(\"{}\", result);\n}\n",
				new String(Files.readAllBytes(target), StandardCharsets.UTF_8));
	}

	@Test
	public void testFileOption() throws Exception {
		Path script = temp.newFile("script.grit").toPath();
		Files.write(script, "print(1)".getBytes(StandardCharsets.UTF_8));
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		int exitCode = Cli
				.execute(
						new String[] { "--emit", "-f", script.toString() },
						new PrintStream(out, true, "UTF-8"),
						new PrintStream(err, true, "UTF-8"));
		assertEquals(0, exitCode);
		assertEquals("fn main() {\n    println!(\"{}\", 1);\n}\n", new String(out.toByteArray(), StandardCharsets.UTF_8));
		assertEquals("", new String(err.toByteArray(), StandardCharsets.UTF_8));
	}

	@Test
	public void testParseArguments() {
		Cli cli = new Cli();
		cli.parse(new String[] { "--indent", "8", "demo.grit" });
		assertEquals(8, cli.getSettings().getIndentWidth());
		assertTrue(cli.getScriptSource() instanceof ScriptFileSource);
		assertEquals("demo.grit", ((ScriptFileSource) cli.getScriptSource()).getFilePath());
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "a.grit", "b.grit" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-o" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "" }));
	}

	@Test
	public void testMissingScript() throws Exception {
		GritTestSupport.TestResult result = cliTest("no arguments").expectExit(1).expectError("Grit script file not provided.").run();
		result.assertExpected();
		assertTrue(result.errorOutput(), result.errorOutput().contains("Usage: grit"));
		assertEquals("", result.output());
	}

	@Test
	public void testUnknownOption() throws Exception {
		cliTest("unknown option")
				.argument("--fast")
				.script("x = 1")
				.expectExit(1)
				.expectError("Unknown parameter: --fast")
				.runAndAssert();
	}

	@Test
	public void testUnreadableFile() throws Exception {
		String missing = temp.getRoot().toPath().resolve("missing.grit").toString();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		int exitCode = Cli
				.execute(new String[] { missing }, new PrintStream(new ByteArrayOutputStream()), new PrintStream(err, true, "UTF-8"));
		assertEquals(1, exitCode);
		String message = new String(err.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(message, message.startsWith("Error reading file '" + missing + "': "));
	}

	@Test
	public void testHelp() throws Exception {
		GritTestSupport.TestResult result = cliTest("-h").argument("-h").run();
		assertEquals(0, result.exitCode());
		assertTrue(result.output(), result.output().startsWith("Usage: grit "));
		cliTest("-h with other arguments").argument("-h", "--emit").expectExit(1).runAndAssert();
	}

	@Test
	public void testParseError() throws Exception {
		cliTest("parse error")
				.argument("--emit")
				.script("x = )")
				.expectExit(1)
				.expect("")
				.expectError("Parse error: Invalid expression at line 1, column 5")
				.runAndAssert();
	}

	@Test
	public void testLexicalError() throws Exception {
		GritTestSupport.TestResult result = cliTest("lexical error").script("x = @").expectExit(1).expectError("Lexical error: Unexpected character '@' at line 1, column 5").run();
		result.assertExpected();
		assertFalse("no partial report", result.output().contains("Tokens:"));
	}

	@Test
	public void testParseErrorAfterTokens() throws Exception {
		GritTestSupport.TestResult result = cliTest("parse error in default report").script("fn {").expectExit(1).run();
		result.assertExpected();
		assertTrue(result.output(), result.output().startsWith("Tokens:\n"));
		assertFalse(result.output(), result.output().contains("AST:"));
		assertTrue(result.errorOutput(), result.errorOutput().startsWith("Parse error: Expected function or class name"));
	}
}
