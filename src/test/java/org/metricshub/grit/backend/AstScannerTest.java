package org.metricshub.grit.backend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.grit.Grit;
import org.metricshub.grit.frontend.ast.Expr;
import org.metricshub.grit.frontend.ast.Statement;

public class AstScannerTest {

	private static List<Statement> body(String source) throws Exception {
		return new Grit().parse(source).getStatements();
	}

	@Test
	public void testExpressionsReachDotAccessChildren() {
		Expr call = new Expr.MethodCall(
				new Expr.FieldAccess(new Expr.Identifier("a"), "b"),
				"m",
				Arrays.<Expr>asList(new Expr.IntegerLiteral(1), new Expr.Identifier("c")));
		List<String> seen = new ArrayList<String>();
		AstScanner.forEachExpr(call, expr -> seen.add(expr.getClass().getSimpleName() + ":" + expr));
		assertEquals(5, seen.size());
		assertTrue(seen.toString(), seen.get(0).startsWith("MethodCall:"));
		assertTrue(seen.toString(), seen.get(1).startsWith("FieldAccess:"));
		assertEquals("Identifier:a", seen.get(2));
		assertEquals("IntegerLiteral:1", seen.get(3));
		assertEquals("Identifier:c", seen.get(4));
	}

	@Test
	public void testStatementsIncludeEveryBranch() throws Exception {
		List<Statement> program = body("if a {\n  x = 1\n} elif b {\n  y = 2\n} else {\n  while c {\n    z = 3\n  }\n}\n");
		List<String> locals = new ArrayList<String>();
		AstScanner.forEachStatement(program, statement -> {
			String local = AstScanner.assignedLocal(statement);
			if (local != null) {
				locals.add(local);
			}
		});
		assertEquals(Arrays.asList("x", "y", "z"), locals);

		List<String> identifiers = new ArrayList<String>();
		AstScanner.forEachExpr(program, expr -> {
			if (expr instanceof Expr.Identifier) {
				identifiers.add(((Expr.Identifier) expr).getName());
			}
		});
		assertEquals(Arrays.asList("a", "b", "c"), identifiers);
	}

	@Test
	public void testDefinitionsAreSeparateScopes() throws Exception {
		List<Statement> program = body("fn f(p) {\n  inner = p\n}\nfn K > m {\n  other = 1\n}\n");
		for (Statement statement : program) {
			assertEquals(Collections.emptyList(), AstScanner.nestedBodies(statement));
			assertEquals(Collections.emptyList(), AstScanner.expressionsOf(statement));
		}
	}

	@Test
	public void testStatementPredicates() throws Exception {
		List<Statement> program = body("self.v = 1\nw = 2\nprint(w)\n");
		assertTrue(AstScanner.isFieldAssignment(program.get(0)));
		assertNull(AstScanner.assignedLocal(program.get(0)));
		assertFalse(AstScanner.isFieldAssignment(program.get(1)));
		assertEquals("w", AstScanner.assignedLocal(program.get(1)));
		assertTrue(AstScanner.isPrintCall(program.get(2)));
		assertFalse(AstScanner.isPrintCall(program.get(1)));
	}
}
