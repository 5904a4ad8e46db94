package org.metricshub.grit;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.grit.frontend.TokenType;
import org.metricshub.grit.frontend.ast.GritSyntaxException;
import org.metricshub.grit.frontend.ast.ParserException;

public class ParserErrorTest {

	private static ParserException parseError(String source) {
		return assertThrows(ParserException.class, () -> new Grit().parse(source));
	}

	@Test
	public void testMissingFunctionName() {
		ParserException e = parseError("fn {");
		assertEquals(ParserException.Kind.UNEXPECTED_TOKEN, e.getKind());
		assertEquals("function or class name", e.getExpected());
		assertEquals(TokenType.LEFT_BRACE, e.getFound().getType());
		assertEquals("Expected function or class name but found LeftBrace at line 1, column 4", e.getMessage());
	}

	@Test
	public void testMissingComma() {
		ParserException e = parseError("print(1 2)");
		assertEquals(ParserException.Kind.UNEXPECTED_TOKEN, e.getKind());
		assertEquals("Expected ',' or ')' but found Integer(2) at line 1, column 9", e.getMessage());
		assertEquals(1, e.getLine());
		assertEquals(9, e.getColumn());
	}

	@Test
	public void testMissingValue() {
		ParserException e = parseError("x = ");
		assertEquals(ParserException.Kind.UNEXPECTED_EOF, e.getKind());
		assertEquals("Unexpected end of file, expected expression", e.getMessage());
	}

	@Test
	public void testInvalidExpression() {
		ParserException e = parseError("x = )");
		assertEquals(ParserException.Kind.INVALID_EXPRESSION, e.getKind());
		assertEquals("Invalid expression at line 1, column 5", e.getMessage());
		assertEquals(TokenType.RIGHT_PAREN, e.getFound().getType());
	}

	@Test
	public void testKeywordCannotStartExpression() {
		assertEquals(ParserException.Kind.INVALID_EXPRESSION, parseError("x = else").getKind());
		assertEquals(ParserException.Kind.INVALID_EXPRESSION, parseError("1 + ,").getKind());
	}

	@Test
	public void testUnclosedGroup() {
		ParserException e = parseError("(1 + 2");
		assertEquals(ParserException.Kind.UNEXPECTED_EOF, e.getKind());
		assertEquals("Unexpected end of file, expected ')'", e.getMessage());
	}

	@Test
	public void testUnclosedArguments() {
		assertEquals("Unexpected end of file, expected ')'", parseError("print(1, 2").getMessage());
	}

	@Test
	public void testUnclosedBlock() {
		ParserException e = parseError("fn f {\n  x\n");
		assertEquals(ParserException.Kind.UNEXPECTED_EOF, e.getKind());
		assertEquals("'}'", e.getExpected());
	}

	@Test
	public void testMissingBlock() {
		ParserException e = parseError("while x\ny = 1");
		assertEquals(ParserException.Kind.UNEXPECTED_TOKEN, e.getKind());
		assertEquals("'{'", e.getExpected());
		assertEquals(2, e.getLine());
	}

	@Test
	public void testMissingMethodName() {
		assertEquals("method name", parseError("fn Point > (x) {\n}").getExpected());
	}

	@Test
	public void testBadParameterList() {
		assertEquals("Expected parameter name but found Integer(1) at line 1, column 9", parseError("fn f(a, 1) {\n}").getMessage());
		ParserException e = parseError("fn f(a b) {\n}");
		assertEquals("',' or ')'", e.getExpected());
		assertEquals("Unexpected end of file, expected ')' or parameter name", parseError("fn f(a,").getMessage());
	}

	@Test
	public void testErrorsAreSyntaxExceptions() {
		GritSyntaxException e = parseError("x = ");
		assertTrue(e instanceof Exception);
		assertEquals(1, e.getLine());
		assertEquals(5, e.getColumn());
	}
}
