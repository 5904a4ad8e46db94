package org.metricshub.grit.frontend.ast;

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
import java.util.Objects;

/**
 * Statement node of the Grit syntax tree.
 * <p>
 * Bodies are ordered, unmodifiable lists. <code>toString()</code> gives the
 * one-line summary used by the AST dump; it does not render bodies.
 */
public abstract class Statement {

	/**
	 * Operation over every kind of statement.
	 *
	 * @param <R> result type
	 */
	public interface Visitor<R> {
		R visitAssignment(Assignment stmt);

		R visitExpressionStatement(ExpressionStatement stmt);

		R visitFunctionDef(FunctionDef stmt);

		R visitClassDef(ClassDef stmt);

		R visitMethodDef(MethodDef stmt);

		R visitIf(If stmt);

		R visitWhile(While stmt);
	}

	/** Prefix of assignment targets that mutate a field of the receiver. */
	public static final String SELF_FIELD_PREFIX = "self.";

	Statement() {}

	public abstract <R> R accept(Visitor<R> visitor);

	static <T> List<T> copyOf(List<T> list, String what) {
		return Collections.unmodifiableList(new ArrayList<T>(Objects.requireNonNull(list, what)));
	}

	/**
	 * <code>name = value</code>. A name of the form <code>self.field</code>
	 * assigns a field of the receiver.
	 */
	public static final class Assignment extends Statement {
		private final String name;
		private final Expr value;

		public Assignment(String name, Expr value) {
			this.name = Objects.requireNonNull(name, "name");
			this.value = Objects.requireNonNull(value, "value");
		}

		public String getName() {
			return name;
		}

		public Expr getValue() {
			return value;
		}

		public boolean isFieldAssignment() {
			return name.startsWith(SELF_FIELD_PREFIX);
		}

		/**
		 * @return the field name of a <code>self.field</code> target
		 * @throws IllegalStateException for a plain variable assignment
		 */
		public String getFieldName() {
			if (!isFieldAssignment()) {
				throw new IllegalStateException(name + " is not a field assignment");
			}
			return name.substring(SELF_FIELD_PREFIX.length());
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAssignment(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Assignment)) {
				return false;
			}
			Assignment that = (Assignment) o;
			return name.equals(that.name) && value.equals(that.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, value);
		}

		@Override
		public String toString() {
			return name + " = " + value;
		}
	}

	/** An expression evaluated for its effect or, last in a body, its value. */
	public static final class ExpressionStatement extends Statement {
		private final Expr expression;

		public ExpressionStatement(Expr expression) {
			this.expression = Objects.requireNonNull(expression, "expression");
		}

		public Expr getExpression() {
			return expression;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExpressionStatement(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof ExpressionStatement && ((ExpressionStatement) o).expression.equals(expression);
		}

		@Override
		public int hashCode() {
			return expression.hashCode();
		}

		@Override
		public String toString() {
			return expression.toString();
		}
	}

	/** <code>fn name(params) { body }</code>. */
	public static final class FunctionDef extends Statement {
		private final String name;
		private final List<String> params;
		private final List<Statement> body;

		public FunctionDef(String name, List<String> params, List<Statement> body) {
			this.name = Objects.requireNonNull(name, "name");
			this.params = copyOf(params, "params");
			this.body = copyOf(body, "body");
		}

		public String getName() {
			return name;
		}

		public List<String> getParams() {
			return params;
		}

		public List<Statement> getBody() {
			return body;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFunctionDef(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof FunctionDef)) {
				return false;
			}
			FunctionDef that = (FunctionDef) o;
			return name.equals(that.name) && params.equals(that.params) && body.equals(that.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, params, body);
		}

		@Override
		public String toString() {
			return "fn " + name + "(" + String.join(", ", params) + ")";
		}
	}

	/** <code>class Name</code>. Methods are attached by separate {@link MethodDef}s. */
	public static final class ClassDef extends Statement {
		private final String name;

		public ClassDef(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		public String getName() {
			return name;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitClassDef(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof ClassDef && ((ClassDef) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return "class " + name;
		}
	}

	/** <code>fn Class &gt; method(params) { body }</code>. */
	public static final class MethodDef extends Statement {
		private final String className;
		private final String methodName;
		private final List<String> params;
		private final List<Statement> body;

		public MethodDef(String className, String methodName, List<String> params, List<Statement> body) {
			this.className = Objects.requireNonNull(className, "className");
			this.methodName = Objects.requireNonNull(methodName, "methodName");
			this.params = copyOf(params, "params");
			this.body = copyOf(body, "body");
		}

		public String getClassName() {
			return className;
		}

		public String getMethodName() {
			return methodName;
		}

		public List<String> getParams() {
			return params;
		}

		public List<Statement> getBody() {
			return body;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitMethodDef(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof MethodDef)) {
				return false;
			}
			MethodDef that = (MethodDef) o;
			return className.equals(that.className)
					&& methodName.equals(that.methodName)
					&& params.equals(that.params)
					&& body.equals(that.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(className, methodName, params, body);
		}

		@Override
		public String toString() {
			return "fn " + className + " > " + methodName + "(" + String.join(", ", params) + ")";
		}
	}

	/** One <code>elif condition { body }</code> clause. */
	public static final class ElifBranch {
		private final Expr condition;
		private final List<Statement> body;

		public ElifBranch(Expr condition, List<Statement> body) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.body = copyOf(body, "body");
		}

		public Expr getCondition() {
			return condition;
		}

		public List<Statement> getBody() {
			return body;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof ElifBranch)) {
				return false;
			}
			ElifBranch that = (ElifBranch) o;
			return condition.equals(that.condition) && body.equals(that.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(condition, body);
		}

		@Override
		public String toString() {
			return "elif " + condition;
		}
	}

	/** <code>if</code> with any number of <code>elif</code> clauses and an optional <code>else</code>. */
	public static final class If extends Statement {
		private final Expr condition;
		private final List<Statement> thenBranch;
		private final List<ElifBranch> elifBranches;
		private final List<Statement> elseBranch;

		/**
		 * @param condition condition of the <code>if</code> clause
		 * @param thenBranch body of the <code>if</code> clause
		 * @param elifBranches <code>elif</code> clauses in source order
		 * @param elseBranch body of the <code>else</code> clause, <code>null</code> when absent
		 */
		public If(Expr condition, List<Statement> thenBranch, List<ElifBranch> elifBranches, List<Statement> elseBranch) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.thenBranch = copyOf(thenBranch, "thenBranch");
			this.elifBranches = copyOf(elifBranches, "elifBranches");
			this.elseBranch = elseBranch == null ? null : copyOf(elseBranch, "elseBranch");
		}

		public Expr getCondition() {
			return condition;
		}

		public List<Statement> getThenBranch() {
			return thenBranch;
		}

		public List<ElifBranch> getElifBranches() {
			return elifBranches;
		}

		public boolean hasElse() {
			return elseBranch != null;
		}

		/**
		 * @return the <code>else</code> body, or <code>null</code> when there is no <code>else</code>
		 */
		public List<Statement> getElseBranch() {
			return elseBranch;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIf(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof If)) {
				return false;
			}
			If that = (If) o;
			return condition.equals(that.condition)
					&& thenBranch.equals(that.thenBranch)
					&& elifBranches.equals(that.elifBranches)
					&& Objects.equals(elseBranch, that.elseBranch);
		}

		@Override
		public int hashCode() {
			return Objects.hash(condition, thenBranch, elifBranches, elseBranch);
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder("if ").append(condition);
			if (!elifBranches.isEmpty()) {
				sb.append(" + ").append(elifBranches.size()).append(" elif(s)");
			}
			if (elseBranch != null) {
				sb.append(" + else");
			}
			return sb.toString();
		}
	}

	/** <code>while condition { body }</code>. */
	public static final class While extends Statement {
		private final Expr condition;
		private final List<Statement> body;

		public While(Expr condition, List<Statement> body) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.body = copyOf(body, "body");
		}

		public Expr getCondition() {
			return condition;
		}

		public List<Statement> getBody() {
			return body;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitWhile(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof While)) {
				return false;
			}
			While that = (While) o;
			return condition.equals(that.condition) && body.equals(that.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(condition, body);
		}

		@Override
		public String toString() {
			return "while " + condition;
		}
	}
}
