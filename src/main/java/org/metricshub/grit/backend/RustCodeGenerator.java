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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.metricshub.grit.frontend.ast.BinaryOperator;
import org.metricshub.grit.frontend.ast.Expr;
import org.metricshub.grit.frontend.ast.Program;
import org.metricshub.grit.frontend.ast.Statement;
import org.metricshub.grit.util.GritLogger;
import org.metricshub.grit.util.GritSettings;
import org.slf4j.Logger;

/**
 * Generates Rust source code from a Grit syntax tree.
 * <p>
 * The output is laid out as follows:
 * <ul>
 * <li>one <code>struct</code> and one <code>impl</code> block per class, in order of first appearance;
 * <li>the free functions, in source order;
 * <li>a <code>fn main()</code> holding every other top-level statement, in source order.
 * </ul>
 * A program made of a single expression (other than a call) is instead wrapped
 * in a <code>main</code> that binds its value and prints it.
 * <p>
 * All numbers are <code>i64</code> in signatures and fields; float literals and
 * <code>to_float()</code> produce <code>f64</code> values inside expressions.
 * <p>
 * Generation never fails and keeps no state between calls, so one instance may
 * be shared.
 */
public class RustCodeGenerator {

	private static final Logger LOG = GritLogger.getLogger(RustCodeGenerator.class);

	/**
	 * Preferred name of the receiver while a constructor builds the instance step
	 * by step. Underscores are appended while the body already uses the name.
	 */
	static final String CONSTRUCTOR_RECEIVER = "instance";

	private static final int NO_PARENT = -1;

	/** Binds tighter than every binary operator: method receivers and cast operands. */
	private static final int POSTFIX = 3;

	private final GritSettings settings;

	/**
	 * Creates a generator with the default settings.
	 */
	public RustCodeGenerator() {
		this(new GritSettings());
	}

	/**
	 * <p>
	 * Constructor for RustCodeGenerator.
	 * </p>
	 *
	 * @param settings indentation and naming settings
	 */
	public RustCodeGenerator(GritSettings settings) {
		this.settings = settings;
	}

	/**
	 * Generates a complete Rust program.
	 *
	 * @param program parsed Grit program
	 * @return Rust source code, ending with a newline
	 */
	public String generateProgram(Program program) {
		return new ProgramWriter(program).write();
	}

	/**
	 * Generates a Rust expression outside of any function or class.
	 *
	 * @param expr Grit expression
	 * @return Rust expression source
	 */
	public String generateExpression(Expr expr) {
		ProgramWriter writer = new ProgramWriter(new Program(Collections.<Statement>emptyList()));
		return writer.expression(expr, FunctionScope.free(Collections.<String>emptyList(), Collections.<String>emptySet()));
	}

	// SUPPORTING METHODS

	private String indent(int level) {
		StringBuilder sb = new StringBuilder();
		for (int i = level * settings.getIndentWidth(); i > 0; i--) {
			sb.append(' ');
		}
		return sb.toString();
	}

	/**
	 * Renders a float literal so that Rust reads it back as the same <code>f64</code>.
	 */
	static String formatFloat(double value) {
		if (Double.isNaN(value)) {
			return "f64::NAN";
		}
		if (Double.isInfinite(value)) {
			return value > 0 ? "f64::INFINITY" : "f64::NEG_INFINITY";
		}
		String text = Double.toString(value);
		if (text.indexOf('E') >= 0) {
			text = new BigDecimal(text).stripTrailingZeros().toPlainString();
			if (text.indexOf('.') < 0) {
				text += ".0";
			}
		}
		return text;
	}

	/**
	 * Escapes text for a Rust string literal, without the quotes.
	 */
	static String escapeRustString(String text) {
		StringBuilder sb = new StringBuilder(text.length() + 8);
		text.codePoints().forEach(c -> {
			switch (c) {
			case '\\':
				sb.append("\\\\");
				break;
			case '"':
				sb.append("\\\"");
				break;
			case '\n':
				sb.append("\\n");
				break;
			case '\t':
				sb.append("\\t");
				break;
			case '\r':
				sb.append("\\r");
				break;
			case 0:
				sb.append("\\0");
				break;
			default:
				if (c < 0x20 || c == 0x7f) {
					sb.append("\\u{").append(Integer.toHexString(c)).append('}');
				} else {
					sb.appendCodePoint(c);
				}
				break;
			}
		});
		return sb.toString();
	}

	/**
	 * Turns a Grit format string into a Rust one: literal braces are doubled,
	 * then <code>%d</code> and <code>%s</code> become <code>{}</code>.
	 */
	static String toRustFormat(String format) {
		String braces = format.replace("{", "{{").replace("}", "}}");
		return escapeRustString(braces.replace("%d", "{}").replace("%s", "{}"));
	}

	/**
	 * Names bound inside one function body, and how the body refers to its receiver.
	 */
	private static final class FunctionScope {
		private final ClassLayout layout;
		private final String receiver;
		private final Set<String> params;
		private final Set<String> mutableNames;
		private final boolean bareFields;

		private FunctionScope(
				ClassLayout layout,
				String receiver,
				Set<String> params,
				Set<String> mutableNames,
				boolean bareFields) {
			this.layout = layout;
			this.receiver = receiver;
			this.params = params;
			this.mutableNames = mutableNames;
			this.bareFields = bareFields;
		}

		static FunctionScope free(List<String> params, Set<String> mutableNames) {
			return new FunctionScope(null, "self", new HashSet<String>(params), mutableNames, false);
		}

		static FunctionScope constructor(ClassLayout layout, List<String> params, Set<String> mutableNames, String receiver) {
			return new FunctionScope(layout, receiver, new HashSet<String>(params), mutableNames, false);
		}

		static FunctionScope method(ClassLayout layout, Statement.MethodDef method, Set<String> mutableNames) {
			return new FunctionScope(layout, "self", new HashSet<String>(method.getParams()), mutableNames, true);
		}

		/**
		 * @param declared locals assigned so far in the enclosing blocks
		 * @return whether a bare identifier reads a field of the receiver
		 */
		boolean isBareField(String name, Set<String> declared) {
			return bareFields && layout.hasField(name) && !params.contains(name) && !declared.contains(name);
		}
	}

	/**
	 * Writes one program. Holds the class layouts and the output buffer.
	 */
	private final class ProgramWriter {

		private final Program program;
		private final Map<String, ClassLayout> classes;
		private final Set<String> allMethods = new HashSet<String>();
		private final Set<String> allFields = new HashSet<String>();
		private final Set<String> mutatingMethods = new HashSet<String>();
		private final StringBuilder out = new StringBuilder();

		ProgramWriter(Program program) {
			this.program = program;
			this.classes = ClassLayout.collect(program);
			for (ClassLayout layout : classes.values()) {
				allFields.addAll(layout.getFields());
				for (Statement.MethodDef method : layout.getMethods()) {
					allMethods.add(method.getMethodName());
					if (layout.isMutating(method.getMethodName())) {
						mutatingMethods.add(method.getMethodName());
					}
				}
			}
		}

		String write() {
			List<Statement> statements = program.getStatements();
			if (statements.size() == 1 && statements.get(0) instanceof Statement.ExpressionStatement) {
				Expr expr = ((Statement.ExpressionStatement) statements.get(0)).getExpression();
				if (!(expr instanceof Expr.FunctionCall)) {
					return writeSingleExpression(expr);
				}
			}

			List<Statement.FunctionDef> functions = new ArrayList<Statement.FunctionDef>();
			List<Statement> mainBody = new ArrayList<Statement>();
			for (Statement statement : statements) {
				if (statement instanceof Statement.FunctionDef) {
					functions.add((Statement.FunctionDef) statement);
				} else if (!(statement instanceof Statement.ClassDef) && !(statement instanceof Statement.MethodDef)) {
					mainBody.add(statement);
				}
			}

			for (ClassLayout layout : classes.values()) {
				LOG.debug("Lowering class {} with fields {}", layout.getName(), layout.getFields());
				writeStruct(layout);
				out.append('\n');
				writeImpl(layout);
				out.append('\n');
			}
			for (Statement.FunctionDef function : functions) {
				writeFunction(function, 0);
				out.append('\n');
			}
			out.append("fn main() {\n");
			FunctionScope scope = FunctionScope.free(Collections.<String>emptyList(), mutableNames(mainBody, Collections.<String>emptyList()));
			new BlockWriter(scope, new HashSet<String>(), 1).writeBody(mainBody, false);
			out.append("}\n");
			return out.toString();
		}

		private String writeSingleExpression(Expr expr) {
			String result = settings.getResultVariable();
			FunctionScope scope = FunctionScope.free(Collections.<String>emptyList(), Collections.<String>emptySet());
			out.append("fn main() {\n");
			line(1, "let " + result + " = " + expression(expr, scope) + ";");
			line(1, "println!(\"{}\", " + result + ");");
			out.append("}\n");
			return out.toString();
		}

		private void line(int level, String text) {
			out.append(indent(level)).append(text).append('\n');
		}

		private void writeStruct(ClassLayout layout) {
			out.append("#[derive(Clone)]\n");
			out.append("struct ").append(layout.getName()).append(" {\n");
			for (String field : layout.getFields()) {
				line(1, field + ": i64,");
			}
			out.append("}\n");
		}

		private void writeImpl(ClassLayout layout) {
			out.append("impl ").append(layout.getName()).append(" {\n");
			boolean first = true;
			for (Statement.MethodDef method : layout.getMethods()) {
				if (!first) {
					out.append('\n');
				}
				first = false;
				if (ClassLayout.isConstructor(method)) {
					writeConstructor(layout, method);
				} else {
					writeMethod(layout, method);
				}
			}
			out.append("}\n");
		}

		private void writeFunction(Statement.FunctionDef function, int level) {
			Set<String> mutable = mutableNames(function.getBody(), function.getParams());
			FunctionScope scope = FunctionScope.free(function.getParams(), mutable);
			line(level, "fn " + function.getName() + "(" + parameters(function.getParams(), mutable) + ") -> i64 {");
			new BlockWriter(scope, new HashSet<String>(), level + 1).writeBody(function.getBody(), true);
			line(level, "}");
		}

		private void writeMethod(ClassLayout layout, Statement.MethodDef method) {
			Set<String> mutable = mutableNames(method.getBody(), method.getParams());
			FunctionScope scope = FunctionScope.method(layout, method, mutable);
			String selfParameter = layout.isMutating(method.getMethodName()) ? "&mut self" : "&self";
			String params = parameters(method.getParams(), mutable);
			line(1, "fn " + method.getMethodName() + "(" + selfParameter + (params.isEmpty() ? "" : ", " + params) + ") -> i64 {");
			new BlockWriter(scope, new HashSet<String>(), 2).writeBody(method.getBody(), true);
			line(1, "}");
		}

		/**
		 * Writes <code>new</code> as a function returning <code>Self</code>. When the
		 * body ends with plain field assignments and never uses <code>self</code>, those
		 * assignments become the fields of the returned struct literal. Otherwise the
		 * instance is created with zeroed fields and updated statement by statement.
		 */
		private void writeConstructor(ClassLayout layout, Statement.MethodDef method) {
			List<Statement> body = method.getBody();
			Set<String> mutable = mutableNames(body, method.getParams());
			line(1, "fn " + method.getMethodName() + "(" + parameters(method.getParams(), mutable) + ") -> Self {");

			int tail = fieldAssignmentTail(body);
			if (tail >= 0) {
				FunctionScope scope = FunctionScope.constructor(layout, method.getParams(), mutable, "self");
				BlockWriter writer = new BlockWriter(scope, new HashSet<String>(), 2);
				writer.writeBody(body.subList(0, tail), false);
				Map<String, Expr> initializers = new HashMap<String, Expr>();
				for (Statement statement : body.subList(tail, body.size())) {
					Statement.Assignment assignment = (Statement.Assignment) statement;
					initializers.put(assignment.getFieldName(), assignment.getValue());
				}
				line(2, "Self {");
				for (String field : layout.getFields()) {
					Expr value = initializers.get(field);
					line(3, field + ": " + (value == null ? "0" : expression(value, scope)) + ",");
				}
				line(2, "}");
			} else {
				String receiver = constructorReceiver(method);
				FunctionScope scope = FunctionScope.constructor(layout, method.getParams(), mutable, receiver);
				line(2, "let mut " + receiver + " = Self {");
				for (String field : layout.getFields()) {
					line(3, field + ": 0,");
				}
				line(2, "};");
				new BlockWriter(scope, new HashSet<String>(), 2).writeBody(body, false);
				line(2, receiver);
			}
			line(1, "}");
		}

		/**
		 * @return a receiver name that no parameter, local, identifier or called
		 *         function of the constructor body uses
		 */
		private String constructorReceiver(Statement.MethodDef method) {
			Set<String> taken = new HashSet<String>(method.getParams());
			AstScanner.forEachStatement(method.getBody(), statement -> {
				String local = AstScanner.assignedLocal(statement);
				if (local != null) {
					taken.add(local);
				}
			});
			AstScanner.forEachExpr(method.getBody(), expr -> {
				if (expr instanceof Expr.Identifier) {
					taken.add(((Expr.Identifier) expr).getName());
				} else if (expr instanceof Expr.FunctionCall) {
					taken.add(((Expr.FunctionCall) expr).getName());
				}
			});
			String receiver = CONSTRUCTOR_RECEIVER;
			while (taken.contains(receiver)) {
				receiver += "_";
			}
			return receiver;
		}

		/**
		 * @return the index where the trailing run of top-level field assignments starts,
		 *         or <code>-1</code> when the constructor must be written step by step
		 */
		private int fieldAssignmentTail(List<Statement> body) {
			int tail = body.size();
			while (tail > 0 && AstScanner.isFieldAssignment(body.get(tail - 1))) {
				tail--;
			}
			boolean[] usesSelf = new boolean[1];
			AstScanner.forEachStatement(body.subList(0, tail), statement -> {
				if (AstScanner.isFieldAssignment(statement)) {
					usesSelf[0] = true;
				}
			});
			AstScanner.forEachExpr(body, expr -> {
				if (AstScanner.isSelf(expr)) {
					usesSelf[0] = true;
				}
			});
			return usesSelf[0] ? -1 : tail;
		}

		private String parameters(List<String> params, Set<String> mutable) {
			return params
					.stream()
					.map(param -> (mutable.contains(param) ? "mut " : "") + param + ": i64")
					.collect(Collectors.joining(", "));
		}

		/**
		 * Variables that need <code>let mut</code>: assigned more than once in the body
		 * (parameters: assigned at all), or receivers of a method that mutates its receiver.
		 */
		private Set<String> mutableNames(List<Statement> body, List<String> params) {
			Map<String, Integer> assignments = new HashMap<String, Integer>();
			for (String param : params) {
				assignments.put(param, 1);
			}
			AstScanner.forEachStatement(body, statement -> {
				String local = AstScanner.assignedLocal(statement);
				if (local != null) {
					assignments.merge(local, 1, Integer::sum);
				}
			});
			Set<String> mutable = new HashSet<String>();
			for (Map.Entry<String, Integer> entry : assignments.entrySet()) {
				if (entry.getValue() > 1) {
					mutable.add(entry.getKey());
				}
			}
			AstScanner.forEachExpr(body, expr -> {
				if (expr instanceof Expr.MethodCall) {
					Expr.MethodCall call = (Expr.MethodCall) expr;
					if (call.getObject() instanceof Expr.Identifier && mutatingMethods.contains(call.getMethod())) {
						String receiver = ((Expr.Identifier) call.getObject()).getName();
						if (!"self".equals(receiver) && !classes.containsKey(receiver)) {
							mutable.add(receiver);
						}
					}
				}
			});
			return mutable;
		}

		String expression(Expr expr, FunctionScope scope) {
			return expression(expr, scope, Collections.<String>emptySet());
		}

		/**
		 * @param declared locals assigned so far, which hide fields of the same name
		 */
		String expression(Expr expr, FunctionScope scope, Set<String> declared) {
			return new ExpressionWriter(scope, declared).write(expr, NO_PARENT, false);
		}

		/**
		 * Writes the statements of one block. Nested blocks get their own writer, so
		 * variables they declare do not leak out, as in Rust.
		 */
		private final class BlockWriter implements Statement.Visitor<Void> {

			private final FunctionScope scope;
			private final Set<String> declared;
			private final int level;

			BlockWriter(FunctionScope scope, Set<String> declared, int level) {
				this.scope = scope;
				this.declared = declared;
				this.level = level;
			}

			/**
			 * @param implicitReturn whether a trailing expression is the value of the function
			 */
			void writeBody(List<Statement> body, boolean implicitReturn) {
				for (int i = 0; i < body.size(); i++) {
					Statement statement = body.get(i);
					boolean last = i == body.size() - 1;
					if (implicitReturn && last && statement instanceof Statement.ExpressionStatement && !AstScanner.isPrintCall(statement)) {
						line(level, expression(((Statement.ExpressionStatement) statement).getExpression(), scope, declared));
					} else {
						statement.accept(this);
					}
				}
			}

			private void nested(List<Statement> body) {
				new BlockWriter(scope, new HashSet<String>(declared), level + 1).writeBody(body, false);
			}

			@Override
			public Void visitAssignment(Statement.Assignment stmt) {
				String value = expression(stmt.getValue(), scope, declared);
				if (stmt.isFieldAssignment()) {
					line(level, scope.receiver + "." + stmt.getFieldName() + " = " + value + ";");
				} else if (declared.contains(stmt.getName()) || scope.params.contains(stmt.getName())) {
					line(level, stmt.getName() + " = " + value + ";");
				} else {
					declared.add(stmt.getName());
					String mut = scope.mutableNames.contains(stmt.getName()) ? "mut " : "";
					line(level, "let " + mut + stmt.getName() + " = " + value + ";");
				}
				return null;
			}

			@Override
			public Void visitExpressionStatement(Statement.ExpressionStatement stmt) {
				line(level, expression(stmt.getExpression(), scope, declared) + ";");
				return null;
			}

			@Override
			public Void visitFunctionDef(Statement.FunctionDef stmt) {
				writeFunction(stmt, level);
				return null;
			}

			@Override
			public Void visitClassDef(Statement.ClassDef stmt) {
				// lowered with the other classes
				return null;
			}

			@Override
			public Void visitMethodDef(Statement.MethodDef stmt) {
				// lowered with its class
				return null;
			}

			@Override
			public Void visitIf(Statement.If stmt) {
				line(level, "if " + expression(stmt.getCondition(), scope, declared) + " {");
				nested(stmt.getThenBranch());
				for (Statement.ElifBranch elif : stmt.getElifBranches()) {
					line(level, "} else if " + expression(elif.getCondition(), scope, declared) + " {");
					nested(elif.getBody());
				}
				if (stmt.hasElse()) {
					line(level, "} else {");
					nested(stmt.getElseBranch());
				}
				line(level, "}");
				return null;
			}

			@Override
			public Void visitWhile(Statement.While stmt) {
				line(level, "while " + expression(stmt.getCondition(), scope, declared) + " {");
				nested(stmt.getBody());
				line(level, "}");
				return null;
			}
		}

		/**
		 * Writes one expression, adding the parentheses Rust needs to keep the tree's grouping.
		 */
		private final class ExpressionWriter implements Expr.Visitor<String> {

			private final FunctionScope scope;
			private final Set<String> declared;

			ExpressionWriter(FunctionScope scope, Set<String> declared) {
				this.scope = scope;
				this.declared = declared;
			}

			/**
			 * A binary operation is parenthesized when it binds looser than its parent,
			 * or as tight but on the right, since all operators are left associative.
			 */
			String write(Expr expr, int parentPrecedence, boolean rightChild) {
				if (!(expr instanceof Expr.BinaryOp)) {
					return expr.accept(this);
				}
				Expr.BinaryOp binary = (Expr.BinaryOp) expr;
				BinaryOperator operator = binary.getOperator();
				int precedence = operator.getPrecedence();
				String text = write(binary.getLeft(), precedence, false)
						+ " " + operator.getSymbol() + " "
						+ write(binary.getRight(), precedence, true);
				boolean parenthesize = parentPrecedence != NO_PARENT
						&& (precedence < parentPrecedence || (precedence == parentPrecedence && rightChild));
				return parenthesize ? "(" + text + ")" : text;
			}

			private String arguments(List<Expr> args) {
				return args.stream().map(arg -> write(arg, NO_PARENT, false)).collect(Collectors.joining(", "));
			}

			@Override
			public String visitIntegerLiteral(Expr.IntegerLiteral expr) {
				return Long.toString(expr.getValue());
			}

			@Override
			public String visitFloatLiteral(Expr.FloatLiteral expr) {
				return formatFloat(expr.getValue());
			}

			@Override
			public String visitStringLiteral(Expr.StringLiteral expr) {
				return "\"" + escapeRustString(expr.getValue()) + "\"";
			}

			@Override
			public String visitIdentifier(Expr.Identifier expr) {
				String name = expr.getName();
				if ("self".equals(name)) {
					return scope.receiver;
				}
				if (scope.isBareField(name, declared)) {
					return scope.receiver + "." + name;
				}
				return name;
			}

			@Override
			public String visitBinaryOp(Expr.BinaryOp expr) {
				return write(expr, NO_PARENT, false);
			}

			@Override
			public String visitGrouped(Expr.Grouped expr) {
				return "(" + write(expr.getInner(), NO_PARENT, false) + ")";
			}

			@Override
			public String visitFunctionCall(Expr.FunctionCall expr) {
				List<Expr> args = expr.getArgs();
				String name = expr.getName();
				if ("print".equals(name)) {
					return println(args);
				}
				if (args.size() == 1) {
					if ("to_int".equals(name)) {
						return "(" + write(args.get(0), POSTFIX, false) + " as i64)";
					}
					if ("to_float".equals(name)) {
						return "(" + write(args.get(0), POSTFIX, false) + " as f64)";
					}
					if ("to_string".equals(name)) {
						return write(args.get(0), POSTFIX, false) + ".to_string()";
					}
				}
				return name + "(" + arguments(args) + ")";
			}

			private String println(List<Expr> args) {
				if (args.isEmpty()) {
					return "println!()";
				}
				Expr first = args.get(0);
				if (first instanceof Expr.StringLiteral) {
					String format = toRustFormat(((Expr.StringLiteral) first).getValue());
					List<Expr> values = args.subList(1, args.size());
					if (values.isEmpty()) {
						return "println!(\"" + format + "\")";
					}
					return "println!(\"" + format + "\", " + arguments(values) + ")";
				}
				String placeholders = args.stream().map(arg -> "{}").collect(Collectors.joining(" "));
				return "println!(\"" + placeholders + "\", " + arguments(args) + ")";
			}

			@Override
			public String visitFieldAccess(Expr.FieldAccess expr) {
				return write(expr.getObject(), POSTFIX, false) + "." + expr.getField();
			}

			@Override
			public String visitMethodCall(Expr.MethodCall expr) {
				Expr object = expr.getObject();
				String method = expr.getMethod();
				List<Expr> args = expr.getArgs();
				if (object instanceof Expr.Identifier && classes.containsKey(((Expr.Identifier) object).getName())) {
					return ((Expr.Identifier) object).getName() + "::" + method + "(" + arguments(args) + ")";
				}
				String receiver = write(object, POSTFIX, false);
				if (args.isEmpty() && isFieldRead(object, method)) {
					return receiver + "." + method;
				}
				return receiver + "." + method + "(" + arguments(args) + ")";
			}

			/**
			 * <code>obj.name</code> without arguments reads a field when <code>name</code>
			 * is not a method: of the current class for <code>self</code>, of any class
			 * otherwise.
			 */
			private boolean isFieldRead(Expr object, String name) {
				if (AstScanner.isSelf(object) && scope.layout != null) {
					return !scope.layout.hasMethod(name);
				}
				return !allMethods.contains(name) && allFields.contains(name);
			}
		}
	}
}
