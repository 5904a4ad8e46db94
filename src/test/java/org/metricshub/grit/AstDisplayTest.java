package org.metricshub.grit;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.grit.frontend.ast.BinaryOperator;
import org.metricshub.grit.frontend.ast.Expr;
import org.metricshub.grit.frontend.ast.Program;
import org.metricshub.grit.frontend.ast.Statement;

public class AstDisplayTest {

	private static String display(String source) throws Exception {
		return new Grit().parse(source).toString();
	}

	@Test
	public void testStatementSummaries() throws Exception {
		assertEquals("x = 42", display("x = 42"));
		assertEquals("self.x = x", display("self.x = x"));
		assertEquals("fn add(x, y)", display("fn add(x, y) {\n  x + y\n}"));
		assertEquals("fn main()", display("fn main {\n}"));
		assertEquals("class Point", display("class Point"));
		assertEquals("fn Point > new(x, y)", display("fn Point > new(x, y) {\n}"));
		assertEquals("while (x < 10)", display("while x < 10 {\n}"));
	}

	@Test
	public void testIfSummary() throws Exception {
		assertEquals("if x", display("if x {\n}"));
		assertEquals("if x + 1 elif(s) + else", display("if x {\n} elif y {\n} else {\n}"));
		assertEquals("if (a == b) + 2 elif(s)", display("if a == b {\n} elif c {\n} elif d {\n}"));
	}

	@Test
	public void testExpressionDisplay() throws Exception {
		assertEquals("print('hi', x)", display("print('hi', x)"));
		assertEquals("p.move(1, 2)", display("p.move(1, 2)"));
		assertEquals("((1 + 2))", display("(1 + 2)"));
		assertEquals("2.5", display("2.5"));
		assertEquals("self.x", new Expr.FieldAccess(new Expr.Identifier("self"), "x").toString());
		assertEquals("+", BinaryOperator.ADD.toString());
	}

	@Test
	public void testProgramJoinsStatements() throws Exception {
		assertEquals("x = 1\ny = (x * 2)\nprint(y)", display("x = 1\ny = x * 2\nprint(y)"));
		assertEquals("", new Program(Collections.<Statement>emptyList()).toString());
	}

	@Test
	public void testStructuralEquality() throws Exception {
		Statement.FunctionDef first = new Statement.FunctionDef(
				"f",
				Arrays.asList("a"),
				Collections.<Statement>singletonList(new Statement.ExpressionStatement(new Expr.Identifier("a"))));
		Statement.FunctionDef second = (Statement.FunctionDef) new Grit().parse("fn f(a) {\n  a\n}").getStatements().get(0);
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertNotEquals(first, new Statement.FunctionDef("f", Arrays.asList("b"), first.getBody()));
	}

	@Test
	public void testNodesAreImmutable() throws Exception {
		Program program = new Grit().parse("fn f(a) {\n  a\n}");
		assertThrows(UnsupportedOperationException.class, () -> program.getStatements().clear());
		Statement.FunctionDef function = (Statement.FunctionDef) program.getStatements().get(0);
		assertThrows(UnsupportedOperationException.class, () -> function.getParams().add("b"));
		assertThrows(UnsupportedOperationException.class, () -> function.getBody().clear());
	}
}
