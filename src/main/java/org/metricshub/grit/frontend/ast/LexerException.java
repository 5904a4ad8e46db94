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

/**
 * A character that starts no token of the language.
 */
public class LexerException extends GritSyntaxException {

	private static final long serialVersionUID = 1L;

	private final int character;

	/**
	 * <p>
	 * Constructor for LexerException.
	 * </p>
	 *
	 * @param character code point of the unexpected character
	 * @param line 1-based line of the character
	 * @param column 1-based column of the character
	 */
	public LexerException(int character, int line, int column) {
		super(
				"Unexpected character '" + new String(Character.toChars(character)) + "' at line " + line + ", column " + column,
				line,
				column);
		this.character = character;
	}

	/**
	 * @return code point of the unexpected character
	 */
	public int getCharacter() {
		return character;
	}
}
