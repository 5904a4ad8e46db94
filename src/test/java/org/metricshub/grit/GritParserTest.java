package org.metricshub.grit;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.grit.frontend.GritParser;
import org.metricshub.grit.frontend.GritTokenizer;
import org.metricshub.grit.frontend.Token;
import org.metricshub.grit.frontend.TokenType;
import org.metricshub.grit.frontend.ast.BinaryOperator;
import org.metricshub.grit.frontend.ast.Expr;
import org.metricshub.grit.frontend.ast.Program;
import org.metricshub.grit.frontend.ast.Statement;

public class GritParserTest {

	private static final Grit GRIT = new Grit();

	private static Expr expression(String source) throws Exception {
		return GRIT.parseExpression(source);
	}

	private static List<Statement> statements(String source) throws Exception {
		return GRIT.parse(source).getStatements();
	}

	private static Expr.IntegerLiteral num(long value) {
		return new Expr.IntegerLiteral(value);
	}

	private static Expr.Identifier id(String name) {
		return new Expr.Identifier(name);
	}

	@Test
	public void testPrecedence() throws Exception {
		assertEquals("(1 + (2 * 3))", expression("1 + 2 * 3").toString());
		assertEquals("((1 * 2) + 3)", expression("1 * 2 + 3").toString());
		assertEquals("(a < (b + 1))", expression("a < b + 1").toString());
		assertEquals("((a + b) == (c * d))", expression("a + b == c * d").toString());
	}

	@Test
	public void testLeftAssociativity() throws Exception {
		assertEquals("((10 - 3) - 2)", expression("10 - 3 - 2").toString());
		assertEquals("((8 / 4) / 2)", expression("8 / 4 / 2").toString());
		assertEquals("((1 < 2) < 3)", expression("1 < 2 < 3").toString());
	}

	@Test
	public void testGroupingIsKept() throws Exception {
		Expr expected = new Expr.BinaryOp(
				new Expr.Grouped(new Expr.BinaryOp(num(1), BinaryOperator.ADD, num(2))),
				BinaryOperator.MULTIPLY,
				num(3));
		assertEquals(expected, expression("(1 + 2) * 3"));
	}

	@Test
	public void testExpressionStopsBeforeTrailingTokens() throws Exception {
		assertEquals(num(1), new GritParser(new GritTokenizer("1 )").tokenize()).parseExpression());
	}

	@Test
	public void testSimpleAssignment() throws Exception {
		assertEquals(Collections.singletonList(new Statement.Assignment("x", num(42))), statements("x = 42"));
	}

	@Test
	public void testFieldAssignment() throws Exception {
		Statement.Assignment assignment = (Statement.Assignment) statements("self.total = 0").get(0);
		assertTrue(assignment.isFieldAssignment());
		assertEquals("self.total", assignment.getName());
		assertEquals("total", assignment.getFieldName());
		assertFalse(new Statement.Assignment("total", num(0)).isFieldAssignment());
	}

	@Test
	public void testFunctionCall() throws Exception {
		assertEquals(
				new Expr.FunctionCall("add", Arrays.<Expr>asList(num(1), new Expr.BinaryOp(num(2), BinaryOperator.MULTIPLY, num(3)))),
				expression("add(1, 2 * 3)"));
		assertEquals(new Expr.FunctionCall("f", Collections.<Expr>emptyList()), expression("f()"));
	}

	@Test
	public void testDotAlwaysMakesMethodCall() throws Exception {
		assertEquals(new Expr.MethodCall(id("p"), "x", Collections.<Expr>emptyList()), expression("p.x"));
		assertEquals(new Expr.MethodCall(id("self"), "count", Collections.<Expr>emptyList()), expression("self.count"));
		assertEquals(
				new Expr.MethodCall(
						new Expr.MethodCall(id("a"), "b", Collections.<Expr>singletonList(num(1))),
						"c",
						Collections.<Expr>emptyList()),
				expression("a.b(1).c()"));
	}

	@Test
	public void testMethodCallBindsTighterThanOperators() throws Exception {
		assertEquals("(p.sum() * 2)", expression("p.sum() * 2").toString());
	}

	@Test
	public void testIntegerFollowedByMethod() throws Exception {
		assertEquals(new Expr.MethodCall(num(42), "foo", Collections.<Expr>emptyList()), expression("42.foo"));
	}

	@Test
	public void testFunctionDefinition() throws Exception {
		Statement.FunctionDef function = (Statement.FunctionDef) statements("fn add(x, y) {\n    x + y\n}").get(0);
		assertEquals("add", function.getName());
		assertEquals(Arrays.asList("x", "y"), function.getParams());
		assertEquals(
				Collections.singletonList(new Statement.ExpressionStatement(new Expr.BinaryOp(id("x"), BinaryOperator.ADD, id("y")))),
				function.getBody());
	}

	@Test
	public void testParametersAcrossLines() throws Exception {
		Statement.FunctionDef function = (Statement.FunctionDef) statements("fn add(\n  a,\n  b\n)\n{\n  a + b\n}").get(0);
		assertEquals(Arrays.asList("a", "b"), function.getParams());
	}

	@Test
	public void testFunctionWithoutParentheses() throws Exception {
		Statement.FunctionDef function = (Statement.FunctionDef) statements("fn answer {\n  42\n}").get(0);
		assertTrue(function.getParams().isEmpty());
		assertEquals(1, function.getBody().size());
	}

	@Test
	public void testClassAndMethods() throws Exception {
		List<Statement> statements = statements(
				"class Point\n"
						+ "fn Point > new(x, y) {\n"
						+ "    self.x = x\n"
						+ "    self.y = y\n"
						+ "}\n"
						+ "fn Point > sum {\n"
						+ "    self.x + self.y\n"
						+ "}\n");
		assertEquals(3, statements.size());
		assertEquals(new Statement.ClassDef("Point"), statements.get(0));
		Statement.MethodDef constructor = (Statement.MethodDef) statements.get(1);
		assertEquals("Point", constructor.getClassName());
		assertEquals("new", constructor.getMethodName());
		assertEquals(Arrays.asList("x", "y"), constructor.getParams());
		assertEquals(2, constructor.getBody().size());
		Statement.MethodDef sum = (Statement.MethodDef) statements.get(2);
		assertEquals("sum", sum.getMethodName());
		assertTrue(sum.getParams().isEmpty());
	}

	@Test
	public void testIfElifElse() throws Exception {
		Statement.If statement = (Statement.If) statements(
				"if x > 3 {\n"
						+ "    print('big')\n"
						+ "} elif x > 1 {\n"
						+ "    print('medium')\n"
						+ "}\n"
						+ "elif x > 0 {\n"
						+ "}\n"
						+ "\n"
						+ "else {\n"
						+ "    print('small')\n"
						+ "}").get(0);
		assertEquals(new Expr.BinaryOp(id("x"), BinaryOperator.GREATER_THAN, num(3)), statement.getCondition());
		assertEquals(1, statement.getThenBranch().size());
		assertEquals(2, statement.getElifBranches().size());
		assertTrue(statement.getElifBranches().get(1).getBody().isEmpty());
		assertTrue(statement.hasElse());
		assertEquals(1, statement.getElseBranch().size());
	}

	@Test
	public void testIfWithoutElse() throws Exception {
		List<Statement> statements = statements("if x {\n  y = 1\n}\nz = 2");
		assertEquals(2, statements.size());
		Statement.If statement = (Statement.If) statements.get(0);
		assertFalse(statement.hasElse());
		assertNull(statement.getElseBranch());
		assertTrue(statement.getElifBranches().isEmpty());
		assertEquals(new Statement.Assignment("z", num(2)), statements.get(1));
	}

	@Test
	public void testWhile() throws Exception {
		Statement.While loop = (Statement.While) statements("while i < 10 {\n  i = i + 1\n}").get(0);
		assertEquals(new Expr.BinaryOp(id("i"), BinaryOperator.LESS_THAN, num(10)), loop.getCondition());
		assertEquals(
				Collections.singletonList(new Statement.Assignment("i", new Expr.BinaryOp(id("i"), BinaryOperator.ADD, num(1)))),
				loop.getBody());
	}

	@Test
	public void testBlankLinesAreIgnored() throws Exception {
		assertTrue(GRIT.parse("").isEmpty());
		assertTrue(GRIT.parse("\n\n\n").isEmpty());
		assertEquals(2, statements("\n\nx = 1\n\n\ny = 2\n\n").size());
	}

	@Test
	public void testMissingEofIsAppended() throws Exception {
		List<Token> tokens = Arrays.asList(Token.identifier("x", 1, 1), Token.of(TokenType.EQUALS, 1, 3), Token.integer(1, 1, 5));
		Program program = new GritParser(tokens).parse();
		assertEquals(Collections.singletonList(new Statement.Assignment("x", num(1))), program.getStatements());
		assertTrue(new GritParser(Collections.<Token>emptyList()).parse().isEmpty());
	}

	@Test
	public void testNestedDefinitions() throws Exception {
		Statement.FunctionDef outer = (Statement.FunctionDef) statements("fn outer {\n  fn inner(a) {\n    a\n  }\n  inner(1)\n}").get(0);
		assertEquals(2, outer.getBody().size());
		assertTrue(outer.getBody().get(0) instanceof Statement.FunctionDef);
	}
}
