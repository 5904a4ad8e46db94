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

/**
 * Lexer token kinds of the Grit language.
 * <p>
 * The display name is what error messages and token dumps show.
 */
public enum TokenType {
	// literals
	INTEGER("Integer"),
	FLOAT("Float"),
	STRING("String"),
	IDENTIFIER("Identifier"),

	// keywords
	FN("Fn"),
	IF("If"),
	ELIF("Elif"),
	ELSE("Else"),
	WHILE("While"),
	CLASS("Class"),
	SELF("Self"),

	// operators
	PLUS("Plus"),
	MINUS("Minus"),
	MULTIPLY("Multiply"),
	DIVIDE("Divide"),
	EQUALS("Equals"),
	EQUAL_EQUAL("EqualEqual"),
	NOT_EQUAL("NotEqual"),
	LESS_THAN("LessThan"),
	LESS_THAN_OR_EQUAL("LessThanOrEqual"),
	GREATER_THAN("GreaterThan"),
	GREATER_THAN_OR_EQUAL("GreaterThanOrEqual"),
	DOT("Dot"),

	// delimiters
	LEFT_PAREN("LeftParen"),
	RIGHT_PAREN("RightParen"),
	LEFT_BRACE("LeftBrace"),
	RIGHT_BRACE("RightBrace"),
	COMMA("Comma"),
	NEWLINE("Newline"),

	EOF("Eof");

	private final String displayName;

	TokenType(String displayName) {
		this.displayName = displayName;
	}

	/**
	 * @return the name shown in diagnostics, such as <code>LeftParen</code>
	 */
	public String getDisplayName() {
		return displayName;
	}

	/**
	 * @return whether tokens of this kind carry a literal or identifier value
	 */
	public boolean hasValue() {
		return this == INTEGER || this == FLOAT || this == STRING || this == IDENTIFIER;
	}
}
