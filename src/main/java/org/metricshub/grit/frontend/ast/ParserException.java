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

import org.metricshub.grit.frontend.Token;

/**
 * Raised when the token stream does not follow the Grit grammar.
 * Parsing stops at the first one.
 */
public class ParserException extends GritSyntaxException {

	private static final long serialVersionUID = 1L;

	/** What went wrong. */
	public enum Kind {
		/** A token other than the required one was found. */
		UNEXPECTED_TOKEN,
		/** Input ended while a construct was still open. */
		UNEXPECTED_EOF,
		/** A token that cannot start an expression. */
		INVALID_EXPRESSION
	}

	private final Kind kind;
	private final String expected;
	private final transient Token found;

	private ParserException(Kind kind, String message, String expected, Token found) {
		super(message, found == null ? -1 : found.getLine(), found == null ? -1 : found.getColumn());
		this.kind = kind;
		this.expected = expected;
		this.found = found;
	}

	/**
	 * @param expected description of what the grammar required, e.g. <code>'{'</code>
	 * @param found the offending token
	 * @return the exception
	 */
	public static ParserException unexpectedToken(String expected, Token found) {
		return new ParserException(
				Kind.UNEXPECTED_TOKEN,
				"Expected " + expected + " but found " + found.describe() + " at line " + found.getLine() + ", column "
						+ found.getColumn(),
				expected,
				found);
	}

	/**
	 * @param expected description of what the grammar required
	 * @param eof the end-of-input token, for its position
	 * @return the exception
	 */
	public static ParserException unexpectedEof(String expected, Token eof) {
		return new ParserException(Kind.UNEXPECTED_EOF, "Unexpected end of file, expected " + expected, expected, eof);
	}

	/**
	 * @param found the token that cannot start an expression
	 * @return the exception
	 */
	public static ParserException invalidExpression(Token found) {
		return new ParserException(
				Kind.INVALID_EXPRESSION,
				"Invalid expression at line " + found.getLine() + ", column " + found.getColumn(),
				"expression",
				found);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return what the grammar required at the failure point
	 */
	public String getExpected() {
		return expected;
	}

	/**
	 * @return the token where parsing stopped
	 */
	public Token getFound() {
		return found;
	}
}
