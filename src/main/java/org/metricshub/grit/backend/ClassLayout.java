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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.grit.frontend.ast.Expr;
import org.metricshub.grit.frontend.ast.Program;
import org.metricshub.grit.frontend.ast.Statement;

/**
 * What the code generator knows about one Grit class: its methods, the
 * fields inferred from their bodies, and which methods mutate the receiver.
 * <p>
 * Grit never declares fields. A field is any name a method assigns through
 * <code>self.name = ...</code>, reads through <code>self.name</code> (a dot
 * access with no arguments that does not name a method of the class), or,
 * outside the constructor, reads as a bare identifier that is neither a
 * parameter, a class name, nor a local variable already assigned at that point
 * of the method. Fields are listed in the order they are first seen, scanning
 * methods in source order.
 */
public final class ClassLayout {

	/** Name of the method lowered to the associated constructor function. */
	public static final String CONSTRUCTOR = "new";

	private final String name;
	private final List<Statement.MethodDef> methods = new ArrayList<Statement.MethodDef>();
	private final Set<String> methodNames = new HashSet<String>();
	private final Set<String> fields = new LinkedHashSet<String>();
	private final Set<String> mutatingMethods = new HashSet<String>();
	private final SelfFieldRead selfFieldRead = new SelfFieldRead();

	private ClassLayout(String name) {
		this.name = name;
	}

	/**
	 * Gathers every class of the program, with the methods attached to it.
	 * Class and method definitions are found at any depth. A method whose class
	 * is never declared with <code>class</code> still defines that class.
	 *
	 * @param program parsed program
	 * @return the classes, in order of first appearance
	 */
	public static Map<String, ClassLayout> collect(Program program) {
		Map<String, ClassLayout> classes = new LinkedHashMap<String, ClassLayout>();
		register(program.getStatements(), classes);
		Set<String> classNames = Collections.unmodifiableSet(classes.keySet());
		for (ClassLayout layout : classes.values()) {
			layout.inferFields(classNames);
			layout.inferMutatingMethods();
		}
		return classes;
	}

	private static void register(List<Statement> body, Map<String, ClassLayout> classes) {
		Registrar registrar = new Registrar(classes);
		for (Statement statement : body) {
			statement.accept(registrar);
		}
	}

	private void inferFields(Set<String> classNames) {
		for (Statement.MethodDef method : methods) {
			FieldCollector collector = new FieldCollector(method, classNames, new HashSet<String>());
			for (Statement statement : method.getBody()) {
				statement.accept(collector);
			}
		}
	}

	/**
	 * Marks methods that assign a field, or call a mutating method on
	 * <code>self</code>, until no more methods change.
	 */
	private void inferMutatingMethods() {
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Statement.MethodDef method : methods) {
				if (isConstructor(method) || mutatingMethods.contains(method.getMethodName())) {
					continue;
				}
				if (mutatesReceiver(method.getBody())) {
					mutatingMethods.add(method.getMethodName());
					changed = true;
				}
			}
		}
	}

	private boolean mutatesReceiver(List<Statement> body) {
		boolean[] found = new boolean[1];
		AstScanner.forEachStatement(body, statement -> {
			if (AstScanner.isFieldAssignment(statement)) {
				found[0] = true;
			}
		});
		AstScanner.forEachExpr(body, expr -> {
			if (expr instanceof Expr.MethodCall) {
				Expr.MethodCall call = (Expr.MethodCall) expr;
				if (AstScanner.isSelf(call.getObject()) && mutatingMethods.contains(call.getMethod())) {
					found[0] = true;
				}
			}
		});
		return found[0];
	}

	static boolean isConstructor(Statement.MethodDef method) {
		return CONSTRUCTOR.equals(method.getMethodName());
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the methods in source order
	 */
	public List<Statement.MethodDef> getMethods() {
		return Collections.unmodifiableList(methods);
	}

	/**
	 * @return the inferred fields, in order of first use
	 */
	public List<String> getFields() {
		return Collections.unmodifiableList(new ArrayList<String>(fields));
	}

	public boolean hasField(String field) {
		return fields.contains(field);
	}

	public boolean hasMethod(String method) {
		return methodNames.contains(method);
	}

	/**
	 * @param method method name
	 * @return whether the method needs <code>&amp;mut self</code>
	 */
	public boolean isMutating(String method) {
		return mutatingMethods.contains(method);
	}

	@Override
	public String toString() {
		return "class " + name + " " + fields;
	}
	/**
	 * Files class and method definitions found at any depth, function and method
	 * bodies included.
	 */
	private static final class Registrar implements Statement.Visitor<Void> {

		private final Map<String, ClassLayout> classes;

		Registrar(Map<String, ClassLayout> classes) {
			this.classes = classes;
		}

		private void walk(List<Statement> body) {
			for (Statement statement : body) {
				statement.accept(this);
			}
		}

		@Override
		public Void visitAssignment(Statement.Assignment stmt) {
			return null;
		}

		@Override
		public Void visitExpressionStatement(Statement.ExpressionStatement stmt) {
			return null;
		}

		@Override
		public Void visitFunctionDef(Statement.FunctionDef stmt) {
			walk(stmt.getBody());
			return null;
		}

		@Override
		public Void visitClassDef(Statement.ClassDef stmt) {
			classes.computeIfAbsent(stmt.getName(), ClassLayout::new);
			return null;
		}

		@Override
		public Void visitMethodDef(Statement.MethodDef stmt) {
			ClassLayout layout = classes.computeIfAbsent(stmt.getClassName(), ClassLayout::new);
			layout.methods.add(stmt);
			layout.methodNames.add(stmt.getMethodName());
			walk(stmt.getBody());
			return null;
		}

		@Override
		public Void visitIf(Statement.If stmt) {
			for (List<Statement> nested : AstScanner.nestedBodies(stmt)) {
				walk(nested);
			}
			return null;
		}

		@Override
		public Void visitWhile(Statement.While stmt) {
			walk(stmt.getBody());
			return null;
		}
	}

	/**
	 * Adds to the layout the fields one method body touches. A bare identifier
	 * only names a field where no local of that name has been assigned yet,
	 * following statement order and block nesting.
	 */
	private final class FieldCollector implements Statement.Visitor<Void> {

		private final boolean constructor;
		private final List<String> params;
		private final Set<String> classNames;
		private final Set<String> declared;

		FieldCollector(Statement.MethodDef method, Set<String> classNames, Set<String> declared) {
			this.constructor = isConstructor(method);
			this.params = method.getParams();
			this.classNames = classNames;
			this.declared = declared;
		}

		private FieldCollector(FieldCollector outer) {
			this.constructor = outer.constructor;
			this.params = outer.params;
			this.classNames = outer.classNames;
			this.declared = new HashSet<String>(outer.declared);
		}

		private void nested(List<Statement> body) {
			FieldCollector inner = new FieldCollector(this);
			for (Statement statement : body) {
				statement.accept(inner);
			}
		}

		private void reads(Expr root) {
			AstScanner.forEachExpr(root, expr -> {
				String field = expr.accept(selfFieldRead);
				if (field != null) {
					fields.add(field);
				} else if (!constructor && expr instanceof Expr.Identifier && isFree(((Expr.Identifier) expr).getName())) {
					fields.add(((Expr.Identifier) expr).getName());
				}
			});
		}

		private boolean isFree(String identifier) {
			return !"self".equals(identifier)
					&& !params.contains(identifier)
					&& !declared.contains(identifier)
					&& !classNames.contains(identifier);
		}

		@Override
		public Void visitAssignment(Statement.Assignment stmt) {
			if (stmt.isFieldAssignment()) {
				fields.add(stmt.getFieldName());
			}
			reads(stmt.getValue());
			if (!stmt.isFieldAssignment()) {
				declared.add(stmt.getName());
			}
			return null;
		}

		@Override
		public Void visitExpressionStatement(Statement.ExpressionStatement stmt) {
			reads(stmt.getExpression());
			return null;
		}

		@Override
		public Void visitFunctionDef(Statement.FunctionDef stmt) {
			// separate scope
			return null;
		}

		@Override
		public Void visitClassDef(Statement.ClassDef stmt) {
			return null;
		}

		@Override
		public Void visitMethodDef(Statement.MethodDef stmt) {
			// separate scope
			return null;
		}

		@Override
		public Void visitIf(Statement.If stmt) {
			reads(stmt.getCondition());
			nested(stmt.getThenBranch());
			for (Statement.ElifBranch elif : stmt.getElifBranches()) {
				reads(elif.getCondition());
				nested(elif.getBody());
			}
			if (stmt.hasElse()) {
				nested(stmt.getElseBranch());
			}
			return null;
		}

		@Override
		public Void visitWhile(Statement.While stmt) {
			reads(stmt.getCondition());
			nested(stmt.getBody());
			return null;
		}
	}

	/**
	 * Finds the field a <code>self.name</code> access reads. A dot access with no
	 * arguments reads a field unless it names a method of the class.
	 */
	private final class SelfFieldRead implements Expr.Visitor<String> {

		@Override
		public String visitIntegerLiteral(Expr.IntegerLiteral expr) {
			return null;
		}

		@Override
		public String visitFloatLiteral(Expr.FloatLiteral expr) {
			return null;
		}

		@Override
		public String visitStringLiteral(Expr.StringLiteral expr) {
			return null;
		}

		@Override
		public String visitIdentifier(Expr.Identifier expr) {
			return null;
		}

		@Override
		public String visitBinaryOp(Expr.BinaryOp expr) {
			return null;
		}

		@Override
		public String visitGrouped(Expr.Grouped expr) {
			return null;
		}

		@Override
		public String visitFunctionCall(Expr.FunctionCall expr) {
			return null;
		}

		@Override
		public String visitFieldAccess(Expr.FieldAccess expr) {
			return AstScanner.isSelf(expr.getObject()) ? expr.getField() : null;
		}

		@Override
		public String visitMethodCall(Expr.MethodCall expr) {
			if (AstScanner.isSelf(expr.getObject()) && expr.getArgs().isEmpty() && !methodNames.contains(expr.getMethod())) {
				return expr.getMethod();
			}
			return null;
		}
	}
}
