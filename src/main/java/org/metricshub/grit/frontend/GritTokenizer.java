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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.grit.frontend.ast.LexerException;
import org.metricshub.grit.util.GritLogger;
import org.slf4j.Logger;

/**
 * Converts Grit source text into a list of {@link Token}s.
 * <p>
 * The tokenizer walks the source one Unicode code point at a time and tracks
 * the 1-based line and column of the next character. Spaces, tabs and carriage
 * returns separate tokens; a newline is a token of its own since it ends
 * statements.
 * <p>
 * An instance tokenizes one source and is not thread safe.
 */
public class GritTokenizer {

	private static final Logger LOG = GritLogger.getLogger(GritTokenizer.class);

	/**
	 * Contains a mapping of Grit keywords to their token values.
	 * Any other word is an identifier.
	 */
	private static final Map<String, TokenType> KEYWORDS = new HashMap<String, TokenType>();

	static {
		KEYWORDS.put("fn", TokenType.FN);
		KEYWORDS.put("if", TokenType.IF);
		KEYWORDS.put("elif", TokenType.ELIF);
		KEYWORDS.put("else", TokenType.ELSE);
		KEYWORDS.put("while", TokenType.WHILE);
		KEYWORDS.put("class", TokenType.CLASS);
		KEYWORDS.put("self", TokenType.SELF);
	}

	private final int[] input;
	private int position;
	private int line = 1;
	private int column = 1;

	private final StringBuilder text = new StringBuilder();

	/**
	 * <p>
	 * Constructor for GritTokenizer.
	 * </p>
	 *
	 * @param source the script text
	 */
	public GritTokenizer(String source) {
		this.input = source.codePoints().toArray();
	}

	/**
	 * Tokenizes the whole source.
	 *
	 * @return the tokens, terminated by exactly one {@link TokenType#EOF} token
	 * @throws LexerException on a character that starts no token
	 */
	public List<Token> tokenize() throws LexerException {
		List<Token> tokens = new ArrayList<Token>();
		Token token;
		do {
			token = nextToken();
			tokens.add(token);
		} while (token.getType() != TokenType.EOF);
		LOG.debug("Tokenized {} tokens over {} line(s)", tokens.size(), line);
		return tokens;
	}

	/**
	 * Reads the next token. Once the input is exhausted, every call returns
	 * an EOF token positioned just past the last character.
	 *
	 * @return the next token
	 * @throws LexerException on a character that starts no token
	 */
	public Token nextToken() throws LexerException {
		skipWhitespace();

		int startLine = line;
		int startColumn = column;
		int c = current();

		if (c < 0) {
			return Token.of(TokenType.EOF, startLine, startColumn);
		}
		if (c >= '0' && c <= '9') {
			return readNumber(startLine, startColumn);
		}
		if (isIdentifierStart(c)) {
			String word = readWord();
			TokenType keyword = KEYWORDS.get(word);
			if (keyword != null) {
				return Token.of(keyword, startLine, startColumn);
			}
			return Token.identifier(word, startLine, startColumn);
		}
		if (c == '\'') {
			return Token.string(readString(startLine, startColumn), startLine, startColumn);
		}

		read();
		switch (c) {
		case '+':
			return Token.of(TokenType.PLUS, startLine, startColumn);
		case '-':
			return Token.of(TokenType.MINUS, startLine, startColumn);
		case '*':
			return Token.of(TokenType.MULTIPLY, startLine, startColumn);
		case '/':
			return Token.of(TokenType.DIVIDE, startLine, startColumn);
		case '.':
			return Token.of(TokenType.DOT, startLine, startColumn);
		case '=':
			return Token.of(readIf('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUALS, startLine, startColumn);
		case '!':
			if (readIf('=')) {
				return Token.of(TokenType.NOT_EQUAL, startLine, startColumn);
			}
			throw new LexerException(c, startLine, startColumn);
		case '<':
			return Token.of(readIf('=') ? TokenType.LESS_THAN_OR_EQUAL : TokenType.LESS_THAN, startLine, startColumn);
		case '>':
			return Token.of(readIf('=') ? TokenType.GREATER_THAN_OR_EQUAL : TokenType.GREATER_THAN, startLine, startColumn);
		case '(':
			return Token.of(TokenType.LEFT_PAREN, startLine, startColumn);
		case ')':
			return Token.of(TokenType.RIGHT_PAREN, startLine, startColumn);
		case '{':
			return Token.of(TokenType.LEFT_BRACE, startLine, startColumn);
		case '}':
			return Token.of(TokenType.RIGHT_BRACE, startLine, startColumn);
		case ',':
			return Token.of(TokenType.COMMA, startLine, startColumn);
		case '\n':
			return Token.of(TokenType.NEWLINE, startLine, startColumn);
		default:
			throw new LexerException(c, startLine, startColumn);
		}
	}

	// SUPPORTING METHODS

	private int current() {
		return position < input.length ? input[position] : -1;
	}

	private int lookahead() {
		return position + 1 < input.length ? input[position + 1] : -1;
	}

	private void read() {
		int c = input[position++];
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
	}

	private boolean readIf(int expected) {
		if (current() == expected) {
			read();
			return true;
		}
		return false;
	}

	private void skipWhitespace() {
		int c = current();
		while (c >= 0 && c != '\n' && isWhitespace(c)) {
			read();
			c = current();
		}
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	/**
	 * Unicode <code>White_Space</code>: unlike {@link Character#isWhitespace(int)},
	 * this includes the no-break spaces and NEL, and excludes the information
	 * separators U+001C to U+001F.
	 */
	static boolean isWhitespace(int c) {
		return (c >= 0x09 && c <= 0x0D) || c == 0x85 || Character.isSpaceChar(c);
	}

	static boolean isIdentifierStart(int c) {
		return c == '_' || Character.isAlphabetic(c);
	}

	/**
	 * Letters, underscores and any numeric character: decimal digits, letter
	 * numbers such as roman numerals, and other numbers such as superscripts.
	 */
	static boolean isIdentifierPart(int c) {
		if (isIdentifierStart(c)) {
			return true;
		}
		switch (Character.getType(c)) {
		case Character.DECIMAL_DIGIT_NUMBER:
		case Character.LETTER_NUMBER:
		case Character.OTHER_NUMBER:
			return true;
		default:
			return false;
		}
	}

	private String readWord() {
		text.setLength(0);
		int c = current();
		while (c >= 0 && isIdentifierPart(c)) {
			text.appendCodePoint(c);
			read();
			c = current();
		}
		return text.toString();
	}

	/**
	 * Reads an integer, or a float when the digits are followed by a dot and
	 * another digit. <code>42.foo</code> therefore stops before the dot.
	 */
	private Token readNumber(int startLine, int startColumn) {
		text.setLength(0);
		while (isDigit(current())) {
			text.appendCodePoint(current());
			read();
		}
		if (current() == '.' && isDigit(lookahead())) {
			text.append('.');
			read();
			while (isDigit(current())) {
				text.appendCodePoint(current());
				read();
			}
			return Token.floating(Double.parseDouble(text.toString()), startLine, startColumn);
		}
		String digits = text.toString();
		try {
			return Token.integer(Long.parseLong(digits), startLine, startColumn);
		} catch (NumberFormatException e) {
			LOG.warn("Integer literal {} at line {}, column {} does not fit in 64 bits, using 0", digits, startLine, startColumn);
			return Token.integer(0L, startLine, startColumn);
		}
	}

	/**
	 * Reads a single-quoted string and decodes its escape sequences.
	 * Unknown escapes are kept verbatim, backslash included.
	 * A string left open runs to the end of the input.
	 */
	private String readString(int startLine, int startColumn) {
		text.setLength(0);
		// opening quote
		read();
		while (true) {
			int c = current();
			if (c < 0) {
				LOG.warn("Unterminated string literal starting at line {}, column {}", startLine, startColumn);
				break;
			}
			read();
			if (c == '\'') {
				break;
			}
			if (c != '\\') {
				text.appendCodePoint(c);
				continue;
			}
			int escaped = current();
			if (escaped < 0) {
				// a lone trailing backslash is dropped
				continue;
			}
			read();
			switch (escaped) {
			case 'n':
				text.append('\n');
				break;
			case 't':
				text.append('\t');
				break;
			case 'r':
				text.append('\r');
				break;
			case '\\':
				text.append('\\');
				break;
			case '\'':
				text.append('\'');
				break;
			default:
				text.append('\\').appendCodePoint(escaped);
				break;
			}
		}
		return text.toString();
	}
}
