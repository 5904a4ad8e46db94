package org.metricshub.grit.backend;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import org.metricshub.grit.frontend.ast.Expr;
import org.metricshub.grit.frontend.ast.Statement;

/**
 * Recursive walks over statement bodies and expression trees, shared by the
 * class layout and the code generator analyses.
 * <p>
 * Statement walks descend into <code>if</code>, <code>elif</code>,
 * <code>else</code> and <code>while</code> bodies but not into nested
 * function or method definitions, which are separate scopes.
 */
final class AstScanner {

	private static final NestedBodies NESTED_BODIES = new NestedBodies();
	private static final OwnExpressions OWN_EXPRESSIONS = new OwnExpressions();
	private static final Children CHILDREN = new Children();

	private AstScanner() {
		// utility class
	}

	/**
	 * Visits every statement of the body, nested control-flow bodies included, in source order.
	 */
	static void forEachStatement(List<Statement> body, Consumer<Statement> action) {
		for (Statement statement : body) {
			action.accept(statement);
			for (List<Statement> nested : nestedBodies(statement)) {
				forEachStatement(nested, action);
			}
		}
	}

	/**
	 * Visits every expression node reachable from the body, pre-order, in source order.
	 */
	static void forEachExpr(List<Statement> body, Consumer<Expr> action) {
		forEachStatement(body, statement -> {
			for (Expr root : expressionsOf(statement)) {
				forEachExpr(root, action);
			}
		});
	}

	/**
	 * Visits the expression and all its subexpressions, pre-order.
	 */
	static void forEachExpr(Expr expr, Consumer<Expr> action) {
		action.accept(expr);
		for (Expr child : expr.accept(CHILDREN)) {
			forEachExpr(child, action);
		}
	}

	/**
	 * @return the bodies nested directly in a control-flow statement
	 */
	static List<List<Statement>> nestedBodies(Statement statement) {
		return statement.accept(NESTED_BODIES);
	}

	/**
	 * @return the expressions a statement evaluates itself, not those of nested bodies
	 */
	static List<Expr> expressionsOf(Statement statement) {
		return statement.accept(OWN_EXPRESSIONS);
	}

	/**
	 * @return whether the expression is the receiver keyword <code>self</code>
	 */
	static boolean isSelf(Expr expr) {
		return expr instanceof Expr.Identifier && "self".equals(((Expr.Identifier) expr).getName());
	}

	/**
	 * @return whether the statement is a <code>print(...)</code> call
	 */
	static boolean isPrintCall(Statement statement) {
		if (!(statement instanceof Statement.ExpressionStatement)) {
			return false;
		}
		Expr expr = ((Statement.ExpressionStatement) statement).getExpression();
		return expr instanceof Expr.FunctionCall && "print".equals(((Expr.FunctionCall) expr).getName());
	}

	/**
	 * @return whether the statement assigns <code>self.field</code>
	 */
	static boolean isFieldAssignment(Statement statement) {
		return statement instanceof Statement.Assignment && ((Statement.Assignment) statement).isFieldAssignment();
	}

	/**
	 * @return the local variable a statement assigns, or <code>null</code>
	 */
	static String assignedLocal(Statement statement) {
		if (statement instanceof Statement.Assignment && !((Statement.Assignment) statement).isFieldAssignment()) {
			return ((Statement.Assignment) statement).getName();
		}
		return null;
	}

	private static final class NestedBodies implements Statement.Visitor<List<List<Statement>>> {

		@Override
		public List<List<Statement>> visitAssignment(Statement.Assignment stmt) {
			return Collections.emptyList();
		}

		@Override
		public List<List<Statement>> visitExpressionStatement(Statement.ExpressionStatement stmt) {
			return Collections.emptyList();
		}

		@Override
		public List<List<Statement>> visitFunctionDef(Statement.FunctionDef stmt) {
			// separate scope
			return Collections.emptyList();
		}

		@Override
		public List<List<Statement>> visitClassDef(Statement.ClassDef stmt) {
			return Collections.emptyList();
		}

		@Override
		public List<List<Statement>> visitMethodDef(Statement.MethodDef stmt) {
			// separate scope
			return Collections.emptyList();
		}

		@Override
		public List<List<Statement>> visitIf(Statement.If stmt) {
			List<List<Statement>> bodies = new ArrayList<List<Statement>>();
			bodies.add(stmt.getThenBranch());
			for (Statement.ElifBranch elif : stmt.getElifBranches()) {
				bodies.add(elif.getBody());
			}
			if (stmt.hasElse()) {
				bodies.add(stmt.getElseBranch());
			}
			return bodies;
		}

		@Override
		public List<List<Statement>> visitWhile(Statement.While stmt) {
			return Collections.singletonList(stmt.getBody());
		}
	}

	private static final class OwnExpressions implements Statement.Visitor<List<Expr>> {

		@Override
		public List<Expr> visitAssignment(Statement.Assignment stmt) {
			return Collections.singletonList(stmt.getValue());
		}

		@Override
		public List<Expr> visitExpressionStatement(Statement.ExpressionStatement stmt) {
			return Collections.singletonList(stmt.getExpression());
		}

		@Override
		public List<Expr> visitFunctionDef(Statement.FunctionDef stmt) {
			return Collections.emptyList();
		}

		@Override
		public List<Expr> visitClassDef(Statement.ClassDef stmt) {
			return Collections.emptyList();
		}

		@Override
		public List<Expr> visitMethodDef(Statement.MethodDef stmt) {
			return Collections.emptyList();
		}

		@Override
		public List<Expr> visitIf(Statement.If stmt) {
			List<Expr> conditions = new ArrayList<Expr>();
			conditions.add(stmt.getCondition());
			for (Statement.ElifBranch elif : stmt.getElifBranches()) {
				conditions.add(elif.getCondition());
			}
			return conditions;
		}

		@Override
		public List<Expr> visitWhile(Statement.While stmt) {
			return Collections.singletonList(stmt.getCondition());
		}
	}

	private static final class Children implements Expr.Visitor<List<Expr>> {

		@Override
		public List<Expr> visitIntegerLiteral(Expr.IntegerLiteral expr) {
			return Collections.emptyList();
		}

		@Override
		public List<Expr> visitFloatLiteral(Expr.FloatLiteral expr) {
			return Collections.emptyList();
		}

		@Override
		public List<Expr> visitStringLiteral(Expr.StringLiteral expr) {
			return Collections.emptyList();
		}

		@Override
		public List<Expr> visitIdentifier(Expr.Identifier expr) {
			return Collections.emptyList();
		}

		@Override
		public List<Expr> visitBinaryOp(Expr.BinaryOp expr) {
			List<Expr> children = new ArrayList<Expr>(2);
			children.add(expr.getLeft());
			children.add(expr.getRight());
			return children;
		}

		@Override
		public List<Expr> visitGrouped(Expr.Grouped expr) {
			return Collections.singletonList(expr.getInner());
		}

		@Override
		public List<Expr> visitFunctionCall(Expr.FunctionCall expr) {
			return expr.getArgs();
		}

		@Override
		public List<Expr> visitFieldAccess(Expr.FieldAccess expr) {
			return Collections.singletonList(expr.getObject());
		}

		@Override
		public List<Expr> visitMethodCall(Expr.MethodCall expr) {
			List<Expr> children = new ArrayList<Expr>(expr.getArgs().size() + 1);
			children.add(expr.getObject());
			children.addAll(expr.getArgs());
			return children;
		}
	}
}
