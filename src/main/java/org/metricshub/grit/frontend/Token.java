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

import java.util.Objects;

/**
 * One lexical token with its 1-based source position.
 * <p>
 * The value is a {@link Long} for integers, a {@link Double} for floats,
 * a {@link String} for strings and identifiers, and <code>null</code> otherwise.
 */
public final class Token {

	private final TokenType type;
	private final Object value;
	private final int line;
	private final int column;

	/**
	 * <p>
	 * Constructor for Token.
	 * </p>
	 *
	 * @param type kind of token
	 * @param value literal value, or <code>null</code> for tokens without one
	 * @param line 1-based line of the first character
	 * @param column 1-based column of the first character
	 */
	public Token(TokenType type, Object value, int line, int column) {
		this.type = Objects.requireNonNull(type, "type");
		this.value = value;
		this.line = line;
		this.column = column;
	}

	public static Token of(TokenType type, int line, int column) {
		return new Token(type, null, line, column);
	}

	public static Token integer(long value, int line, int column) {
		return new Token(TokenType.INTEGER, value, line, column);
	}

	public static Token floating(double value, int line, int column) {
		return new Token(TokenType.FLOAT, value, line, column);
	}

	public static Token string(String value, int line, int column) {
		return new Token(TokenType.STRING, value, line, column);
	}

	public static Token identifier(String name, int line, int column) {
		return new Token(TokenType.IDENTIFIER, name, line, column);
	}

	public TokenType getType() {
		return type;
	}

	public Object getValue() {
		return value;
	}

	/**
	 * @return the integer value
	 * @throws IllegalStateException if this is not an integer token
	 */
	public long getIntegerValue() {
		checkType(TokenType.INTEGER);
		return (Long) value;
	}

	/**
	 * @return the float value
	 * @throws IllegalStateException if this is not a float token
	 */
	public double getFloatValue() {
		checkType(TokenType.FLOAT);
		return (Double) value;
	}

	/**
	 * @return the decoded text of a string literal, or the name of an identifier
	 * @throws IllegalStateException if this token carries no text
	 */
	public String getText() {
		if (type != TokenType.STRING && type != TokenType.IDENTIFIER) {
			throw new IllegalStateException(type.getDisplayName() + " token has no text");
		}
		return (String) value;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public boolean is(TokenType expected) {
		return type == expected;
	}

	private void checkType(TokenType expected) {
		if (type != expected) {
			throw new IllegalStateException("Expected a " + expected.getDisplayName() + " token, got " + type.getDisplayName());
		}
	}

	/**
	 * Describes the token kind and its value, the way diagnostics print it:
	 * <code>Integer(42)</code>, <code>Identifier("x")</code>, <code>Plus</code>.
	 *
	 * @return the description
	 */
	public String describe() {
		if (!type.hasValue()) {
			return type.getDisplayName();
		}
		if (value instanceof String) {
			return type.getDisplayName() + "(\"" + value + "\")";
		}
		return type.getDisplayName() + "(" + value + ")";
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Token)) {
			return false;
		}
		Token that = (Token) other;
		return type == that.type && line == that.line && column == that.column && Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value, line, column);
	}

	@Override
	public String toString() {
		return "Token { type: " + describe() + ", line: " + line + ", column: " + column + " }";
	}
}
