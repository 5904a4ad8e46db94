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
import java.util.stream.Collectors;

/**
 * Expression node of the Grit syntax tree.
 * <p>
 * Nodes are immutable and compare structurally. Their <code>toString()</code>
 * gives a compact, fully parenthesized rendering used by the AST dump.
 */
public abstract class Expr {

	/**
	 * Operation over every kind of expression.
	 *
	 * @param <R> result type
	 */
	public interface Visitor<R> {
		R visitIntegerLiteral(IntegerLiteral expr);

		R visitFloatLiteral(FloatLiteral expr);

		R visitStringLiteral(StringLiteral expr);

		R visitIdentifier(Identifier expr);

		R visitBinaryOp(BinaryOp expr);

		R visitGrouped(Grouped expr);

		R visitFunctionCall(FunctionCall expr);

		R visitFieldAccess(FieldAccess expr);

		R visitMethodCall(MethodCall expr);
	}

	Expr() {}

	public abstract <R> R accept(Visitor<R> visitor);

	private static List<Expr> copyOf(List<Expr> args) {
		return Collections.unmodifiableList(new ArrayList<Expr>(Objects.requireNonNull(args, "args")));
	}

	private static String joinArguments(List<Expr> args) {
		return args.stream().map(Expr::toString).collect(Collectors.joining(", "));
	}

	/** 64-bit signed integer literal. */
	public static final class IntegerLiteral extends Expr {
		private final long value;

		public IntegerLiteral(long value) {
			this.value = value;
		}

		public long getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIntegerLiteral(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof IntegerLiteral && ((IntegerLiteral) o).value == value;
		}

		@Override
		public int hashCode() {
			return Long.hashCode(value);
		}

		@Override
		public String toString() {
			return Long.toString(value);
		}
	}

	/** 64-bit floating point literal. */
	public static final class FloatLiteral extends Expr {
		private final double value;

		public FloatLiteral(double value) {
			this.value = value;
		}

		public double getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFloatLiteral(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof FloatLiteral && Double.compare(((FloatLiteral) o).value, value) == 0;
		}

		@Override
		public int hashCode() {
			return Double.hashCode(value);
		}

		@Override
		public String toString() {
			return Double.toString(value);
		}
	}

	/** String literal, already escape-decoded. */
	public static final class StringLiteral extends Expr {
		private final String value;

		public StringLiteral(String value) {
			this.value = Objects.requireNonNull(value, "value");
		}

		public String getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitStringLiteral(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof StringLiteral && ((StringLiteral) o).value.equals(value);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public String toString() {
			return "'" + value + "'";
		}
	}

	/** Variable, parameter or field name. <code>self</code> is an identifier too. */
	public static final class Identifier extends Expr {
		private final String name;

		public Identifier(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		public String getName() {
			return name;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIdentifier(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Identifier && ((Identifier) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/** <code>left operator right</code>. */
	public static final class BinaryOp extends Expr {
		private final Expr left;
		private final BinaryOperator operator;
		private final Expr right;

		public BinaryOp(Expr left, BinaryOperator operator, Expr right) {
			this.left = Objects.requireNonNull(left, "left");
			this.operator = Objects.requireNonNull(operator, "operator");
			this.right = Objects.requireNonNull(right, "right");
		}

		public Expr getLeft() {
			return left;
		}

		public BinaryOperator getOperator() {
			return operator;
		}

		public Expr getRight() {
			return right;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBinaryOp(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof BinaryOp)) {
				return false;
			}
			BinaryOp that = (BinaryOp) o;
			return operator == that.operator && left.equals(that.left) && right.equals(that.right);
		}

		@Override
		public int hashCode() {
			return Objects.hash(left, operator, right);
		}

		@Override
		public String toString() {
			return "(" + left + " " + operator.getSymbol() + " " + right + ")";
		}
	}

	/** Parentheses written in the source. */
	public static final class Grouped extends Expr {
		private final Expr inner;

		public Grouped(Expr inner) {
			this.inner = Objects.requireNonNull(inner, "inner");
		}

		public Expr getInner() {
			return inner;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitGrouped(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Grouped && ((Grouped) o).inner.equals(inner);
		}

		@Override
		public int hashCode() {
			return 31 * inner.hashCode() + 7;
		}

		@Override
		public String toString() {
			return "(" + inner + ")";
		}
	}

	/** Call of a free function or builtin: <code>name(args)</code>. */
	public static final class FunctionCall extends Expr {
		private final String name;
		private final List<Expr> args;

		public FunctionCall(String name, List<Expr> args) {
			this.name = Objects.requireNonNull(name, "name");
			this.args = copyOf(args);
		}

		public String getName() {
			return name;
		}

		public List<Expr> getArgs() {
			return args;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFunctionCall(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof FunctionCall)) {
				return false;
			}
			FunctionCall that = (FunctionCall) o;
			return name.equals(that.name) && args.equals(that.args);
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, args);
		}

		@Override
		public String toString() {
			return name + "(" + joinArguments(args) + ")";
		}
	}

	/**
	 * <code>object.field</code>. The parser never builds this node since a dot
	 * always reads as a method call; code that builds trees directly may use it.
	 */
	public static final class FieldAccess extends Expr {
		private final Expr object;
		private final String field;

		public FieldAccess(Expr object, String field) {
			this.object = Objects.requireNonNull(object, "object");
			this.field = Objects.requireNonNull(field, "field");
		}

		public Expr getObject() {
			return object;
		}

		public String getField() {
			return field;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFieldAccess(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof FieldAccess)) {
				return false;
			}
			FieldAccess that = (FieldAccess) o;
			return object.equals(that.object) && field.equals(that.field);
		}

		@Override
		public int hashCode() {
			return Objects.hash(object, field);
		}

		@Override
		public String toString() {
			return object + "." + field;
		}
	}

	/** <code>object.method(args)</code>; the argument list may be empty. */
	public static final class MethodCall extends Expr {
		private final Expr object;
		private final String method;
		private final List<Expr> args;

		public MethodCall(Expr object, String method, List<Expr> args) {
			this.object = Objects.requireNonNull(object, "object");
			this.method = Objects.requireNonNull(method, "method");
			this.args = copyOf(args);
		}

		public Expr getObject() {
			return object;
		}

		public String getMethod() {
			return method;
		}

		public List<Expr> getArgs() {
			return args;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitMethodCall(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof MethodCall)) {
				return false;
			}
			MethodCall that = (MethodCall) o;
			return object.equals(that.object) && method.equals(that.method) && args.equals(that.args);
		}

		@Override
		public int hashCode() {
			return Objects.hash(object, method, args);
		}

		@Override
		public String toString() {
			return object + "." + method + "(" + joinArguments(args) + ")";
		}
	}
}
