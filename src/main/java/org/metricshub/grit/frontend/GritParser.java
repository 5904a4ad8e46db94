package org.metricshub.grit.frontend;

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
import java.util.List;
import org.metricshub.grit.frontend.ast.BinaryOperator;
import org.metricshub.grit.frontend.ast.Expr;
import org.metricshub.grit.frontend.ast.ParserException;
import org.metricshub.grit.frontend.ast.Program;
import org.metricshub.grit.frontend.ast.Statement;
import org.metricshub.grit.util.GritLogger;
import org.slf4j.Logger;

/**
 * Converts the tokens of a Grit script into a syntax tree.
 * <p>
 * Statements are read by recursive descent, expressions by precedence
 * climbing. The parser looks at most three tokens ahead (to recognize
 * <code>self.field =</code>) and never backtracks; the first error aborts
 * the parse.
 * <p>
 * An instance parses one token list and is not thread safe.
 */
public class GritParser {

	private static final Logger LOG = GritLogger.getLogger(GritParser.class);

	private final List<Token> tokens;
	private int position;

	/**
	 * <p>
	 * Constructor for GritParser.
	 * </p>
	 *
	 * @param tokens output of {@link GritTokenizer#tokenize()}; an EOF token is
	 *        appended when the list does not end with one
	 */
	public GritParser(List<Token> tokens) {
		this.tokens = new ArrayList<Token>(tokens);
		if (this.tokens.isEmpty()) {
			this.tokens.add(Token.of(TokenType.EOF, 1, 1));
		} else {
			Token last = this.tokens.get(this.tokens.size() - 1);
			if (!last.is(TokenType.EOF)) {
				this.tokens.add(Token.of(TokenType.EOF, last.getLine(), last.getColumn()));
			}
		}
	}

	/**
	 * Parses the whole token list.
	 *
	 * @return the program, empty when there are no statements
	 * @throws ParserException on the first grammar violation
	 */
	public Program parse() throws ParserException {
		List<Statement> statements = new ArrayList<Statement>();
		skipNewlines();
		while (!isAtEnd()) {
			statements.add(STATEMENT());
			skipNewlines();
		}
		LOG.debug("Parsed {} top-level statement(s)", statements.size());
		return new Program(statements);
	}

	/**
	 * Parses a single expression starting at the current token. Tokens after
	 * the expression are left unread.
	 *
	 * @return the expression
	 * @throws ParserException when no valid expression starts here
	 */
	public Expr parseExpression() throws ParserException {
		return EXPRESSION(0);
	}

	// SUPPORTING METHODS

	private Token current() {
		return tokens.get(position);
	}

	private Token peek(int offset) {
		int index = position + offset;
		return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
	}

	private boolean isAtEnd() {
		return current().is(TokenType.EOF);
	}

	private boolean check(TokenType type) {
		return current().is(type);
	}

	private Token advance() {
		Token token = current();
		if (!isAtEnd()) {
			position++;
		}
		return token;
	}

	/**
	 * Consumes a token of the given type or fails with the expected description.
	 */
	private Token consume(TokenType type, String expected) throws ParserException {
		if (!check(type)) {
			throw unexpected(expected);
		}
		return advance();
	}

	private String consumeIdentifier(String expected) throws ParserException {
		return consume(TokenType.IDENTIFIER, expected).getText();
	}

	private ParserException unexpected(String expected) {
		Token token = current();
		if (token.is(TokenType.EOF)) {
			return ParserException.unexpectedEof(expected, token);
		}
		return ParserException.unexpectedToken(expected, token);
	}

	private boolean optNewline() {
		if (check(TokenType.NEWLINE)) {
			advance();
			return true;
		}
		return false;
	}

	private void skipNewlines() {
		while (optNewline()) {
			// keep going
		}
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// STATEMENT : CLASS | FUNCTION | IF | WHILE | ASSIGNMENT | EXPRESSION, then optional newline
	Statement STATEMENT() throws ParserException {
		Statement statement;
		switch (current().getType()) {
		case CLASS:
			statement = CLASS();
			break;
		case FN:
			statement = FUNCTION();
			break;
		case IF:
			statement = IF_STATEMENT();
			break;
		case WHILE:
			statement = WHILE_STATEMENT();
			break;
		default:
			statement = SIMPLE_STATEMENT();
			break;
		}
		optNewline();
		return statement;
	}

	// SIMPLE_STATEMENT : ID '=' EXPRESSION | self '.' ID '=' EXPRESSION | EXPRESSION
	Statement SIMPLE_STATEMENT() throws ParserException {
		if (check(TokenType.IDENTIFIER) && peek(1).is(TokenType.EQUALS)) {
			String name = advance().getText();
			advance();
			return new Statement.Assignment(name, EXPRESSION(0));
		}
		if (check(TokenType.SELF)
				&& peek(1).is(TokenType.DOT)
				&& peek(2).is(TokenType.IDENTIFIER)
				&& peek(3).is(TokenType.EQUALS)) {
			advance();
			advance();
			String field = advance().getText();
			advance();
			return new Statement.Assignment(Statement.SELF_FIELD_PREFIX + field, EXPRESSION(0));
		}
		return new Statement.ExpressionStatement(EXPRESSION(0));
	}

	// CLASS : class ID
	Statement CLASS() throws ParserException {
		consume(TokenType.CLASS, "'class'");
		return new Statement.ClassDef(consumeIdentifier("class name"));
	}

	// FUNCTION : fn ID [PARAMS] BLOCK | fn ID '>' ID [PARAMS] BLOCK
	Statement FUNCTION() throws ParserException {
		consume(TokenType.FN, "'fn'");
		String firstName = consumeIdentifier("function or class name");
		if (check(TokenType.GREATER_THAN)) {
			advance();
			String methodName = consumeIdentifier("method name");
			List<String> params = OPT_PARAMS();
			skipNewlines();
			return new Statement.MethodDef(firstName, methodName, params, BLOCK());
		}
		List<String> params = OPT_PARAMS();
		skipNewlines();
		return new Statement.FunctionDef(firstName, params, BLOCK());
	}

	// OPT_PARAMS : [ '(' [ID (',' ID)*] ')' ], newlines allowed inside the parentheses
	List<String> OPT_PARAMS() throws ParserException {
		List<String> params = new ArrayList<String>();
		if (!check(TokenType.LEFT_PAREN)) {
			return params;
		}
		advance();
		while (true) {
			skipNewlines();
			if (check(TokenType.RIGHT_PAREN)) {
				advance();
				return params;
			}
			if (isAtEnd()) {
				throw unexpected("')' or parameter name");
			}
			params.add(consumeIdentifier("parameter name"));
			skipNewlines();
			if (check(TokenType.COMMA)) {
				advance();
			} else if (check(TokenType.RIGHT_PAREN)) {
				advance();
				return params;
			} else {
				throw unexpected("',' or ')'");
			}
		}
	}

	// BLOCK : '{' (STATEMENT NEWLINE*)* '}'
	List<Statement> BLOCK() throws ParserException {
		consume(TokenType.LEFT_BRACE, "'{'");
		List<Statement> body = new ArrayList<Statement>();
		skipNewlines();
		while (!check(TokenType.RIGHT_BRACE)) {
			if (isAtEnd()) {
				throw unexpected("'}'");
			}
			body.add(STATEMENT());
			skipNewlines();
		}
		advance();
		return body;
	}

	// IF_STATEMENT : if EXPRESSION BLOCK (elif EXPRESSION BLOCK)* [else BLOCK]
	Statement IF_STATEMENT() throws ParserException {
		consume(TokenType.IF, "'if'");
		Expr condition = EXPRESSION(0);
		skipNewlines();
		List<Statement> thenBranch = BLOCK();

		List<Statement.ElifBranch> elifBranches = new ArrayList<Statement.ElifBranch>();
		List<Statement> elseBranch = null;

		// newlines between '}' and elif/else do not end the statement
		skipNewlines();
		while (check(TokenType.ELIF)) {
			advance();
			Expr elifCondition = EXPRESSION(0);
			skipNewlines();
			elifBranches.add(new Statement.ElifBranch(elifCondition, BLOCK()));
			skipNewlines();
		}
		if (check(TokenType.ELSE)) {
			advance();
			skipNewlines();
			elseBranch = BLOCK();
		}
		return new Statement.If(condition, thenBranch, elifBranches, elseBranch);
	}

	// WHILE_STATEMENT : while EXPRESSION BLOCK
	Statement WHILE_STATEMENT() throws ParserException {
		consume(TokenType.WHILE, "'while'");
		Expr condition = EXPRESSION(0);
		skipNewlines();
		return new Statement.While(condition, BLOCK());
	}

	// EXPRESSION : POSTFIX (BINARY_OPERATOR EXPRESSION)*, by precedence climbing
	Expr EXPRESSION(int minPrecedence) throws ParserException {
		Expr left = POSTFIX();
		while (true) {
			BinaryOperator operator = BinaryOperator.fromToken(current().getType());
			if (operator == null || operator.getPrecedence() < minPrecedence) {
				// newline, comma, ')' and any other non-operator end the expression
				return left;
			}
			advance();
			Expr right = EXPRESSION(operator.getPrecedence() + 1);
			left = new Expr.BinaryOp(left, operator, right);
		}
	}

	// POSTFIX : PRIMARY ('.' ID [ARGUMENTS])*
	Expr POSTFIX() throws ParserException {
		Expr expr = PRIMARY();
		while (check(TokenType.DOT)) {
			advance();
			String member = consumeIdentifier("field or method name");
			List<Expr> args = check(TokenType.LEFT_PAREN) ? ARGUMENTS() : new ArrayList<Expr>();
			// obj.name without parentheses is still a call
			expr = new Expr.MethodCall(expr, member, args);
		}
		return expr;
	}

	// PRIMARY : INTEGER | FLOAT | STRING | self | ID [ARGUMENTS] | '(' EXPRESSION ')'
	Expr PRIMARY() throws ParserException {
		Token token = current();
		switch (token.getType()) {
		case INTEGER:
			advance();
			return new Expr.IntegerLiteral(token.getIntegerValue());
		case FLOAT:
			advance();
			return new Expr.FloatLiteral(token.getFloatValue());
		case STRING:
			advance();
			return new Expr.StringLiteral(token.getText());
		case SELF:
			advance();
			return new Expr.Identifier("self");
		case IDENTIFIER:
			advance();
			if (check(TokenType.LEFT_PAREN)) {
				return new Expr.FunctionCall(token.getText(), ARGUMENTS());
			}
			return new Expr.Identifier(token.getText());
		case LEFT_PAREN:
			advance();
			Expr inner = EXPRESSION(0);
			consume(TokenType.RIGHT_PAREN, "')'");
			return new Expr.Grouped(inner);
		case EOF:
			throw ParserException.unexpectedEof("expression", token);
		default:
			throw ParserException.invalidExpression(token);
		}
	}

	// ARGUMENTS : '(' [EXPRESSION (',' EXPRESSION)*] ')'
	List<Expr> ARGUMENTS() throws ParserException {
		consume(TokenType.LEFT_PAREN, "'('");
		List<Expr> args = new ArrayList<Expr>();
		if (check(TokenType.RIGHT_PAREN)) {
			advance();
			return args;
		}
		while (true) {
			args.add(EXPRESSION(0));
			if (check(TokenType.COMMA)) {
				advance();
			} else if (check(TokenType.RIGHT_PAREN)) {
				advance();
				return args;
			} else if (isAtEnd()) {
				throw unexpected("')'");
			} else {
				throw unexpected("',' or ')'");
			}
		}
	}
	// CHECKSTYLE.ON: MethodName
}
