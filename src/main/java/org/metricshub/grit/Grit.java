package org.metricshub.grit;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import org.metricshub.grit.backend.RustCodeGenerator;
import org.metricshub.grit.frontend.GritParser;
import org.metricshub.grit.frontend.GritTokenizer;
import org.metricshub.grit.frontend.Token;
import org.metricshub.grit.frontend.ast.Expr;
import org.metricshub.grit.frontend.ast.LexerException;
import org.metricshub.grit.frontend.ast.ParserException;
import org.metricshub.grit.frontend.ast.Program;
import org.metricshub.grit.util.GritLogger;
import org.metricshub.grit.util.GritSettings;
import org.metricshub.grit.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the translation of a Grit script to Rust.
 * This entry point is used both when Grit is used as a library and when
 * invoked from the command line.
 * <p>
 * The translation runs three stages, each consuming the complete output of
 * the previous one:
 * <ul>
 * <li>{@link GritTokenizer} turns the source text into tokens;
 * <li>{@link GritParser} turns the tokens into a {@link Program};
 * <li>{@link RustCodeGenerator} turns the program into Rust source code.
 * </ul>
 * A lexical or syntax error stops the translation; no partial output is produced.
 * <p>
 * The tokens and syntax tree of the last script are kept for diagnostics, which
 * makes an instance unsuitable for concurrent use. Separate instances are
 * independent.
 */
public class Grit {

	private static final Logger LOG = GritLogger.getLogger(Grit.class);

	private final GritSettings settings;

	private List<Token> lastTokens;

	private Program lastProgram;

	/**
	 * Create a new instance of Grit with the default settings
	 */
	public Grit() {
		this(new GritSettings());
	}

	/**
	 * Create a new instance of Grit.
	 *
	 * @param settings code generation settings
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Grit(GritSettings settings) {
		this.settings = settings;
	}

	/**
	 * Tokenizes the specified script.
	 *
	 * @param source script text
	 * @return the tokens, ending with a single EOF token
	 * @throws LexerException on a character that starts no token
	 */
	public List<Token> tokenize(String source) throws LexerException {
		lastTokens = null;
		List<Token> tokens = new GritTokenizer(source).tokenize();
		lastTokens = Collections.unmodifiableList(tokens);
		return lastTokens;
	}

	/**
	 * Tokenizes and parses the specified script.
	 *
	 * @param source script text
	 * @return the syntax tree
	 * @throws LexerException on a character that starts no token
	 * @throws ParserException when the script does not follow the grammar
	 */
	public Program parse(String source) throws LexerException, ParserException {
		lastProgram = null;
		return parse(tokenize(source));
	}

	/**
	 * Parses already produced tokens.
	 *
	 * @param tokens tokens, normally ending with an EOF token
	 * @return the syntax tree
	 * @throws ParserException when the tokens do not follow the grammar
	 */
	public Program parse(List<Token> tokens) throws ParserException {
		lastProgram = null;
		lastProgram = new GritParser(tokens).parse();
		LOG.debug("Parsed {} statement(s) from {} token(s)", lastProgram.getStatements().size(), tokens.size());
		return lastProgram;
	}

	/**
	 * Parses a single expression, such as <code>1 + 2 * x</code>.
	 *
	 * @param source expression text
	 * @return the expression tree
	 * @throws LexerException on a character that starts no token
	 * @throws ParserException when the text does not start with a valid expression
	 */
	public Expr parseExpression(String source) throws LexerException, ParserException {
		return new GritParser(tokenize(source)).parseExpression();
	}

	/**
	 * Generates the Rust program for an already parsed script.
	 *
	 * @param program syntax tree
	 * @return Rust source code
	 */
	public String generate(Program program) {
		String code = new RustCodeGenerator(settings).generateProgram(program);
		LOG.debug("Generated {} character(s) of Rust code", code.length());
		return code;
	}

	/**
	 * Translates the specified script to Rust.
	 *
	 * @param source script text
	 * @return Rust source code
	 * @throws LexerException on a character that starts no token
	 * @throws ParserException when the script does not follow the grammar
	 */
	public String translate(String source) throws LexerException, ParserException {
		return generate(parse(source));
	}

	/**
	 * Reads and translates the specified script to Rust.
	 *
	 * @param script where to read the script from
	 * @return Rust source code
	 * @throws IOException if the script cannot be read
	 * @throws LexerException on a character that starts no token
	 * @throws ParserException when the script does not follow the grammar
	 */
	public String translate(ScriptSource script) throws IOException, LexerException, ParserException {
		LOG.debug("Translating {}", script.getDescription());
		return translate(script.readFully());
	}

	/**
	 * Returns the tokens produced by the last call to {@link #tokenize(String)},
	 * directly or through parsing or translation.
	 *
	 * @return the last tokens, or {@code null} if nothing was tokenized
	 */
	public List<Token> getLastTokens() {
		return lastTokens;
	}

	/**
	 * Returns the last syntax tree produced by {@link #parse(String)}.
	 *
	 * @return the last {@link Program}, or {@code null} if the last parse failed or none occurred
	 */
	public Program getLastProgram() {
		return lastProgram;
	}

	/**
	 * @return the settings used for code generation
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public GritSettings getSettings() {
		return settings;
	}
}
