package org.metricshub.grit.util;

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
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single Grit translation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Grit programmatically, from within Java code.
 */
public class GritSettings {

	/** Default number of spaces per indentation level in the generated code. */
	public static final int DEFAULT_INDENT_WIDTH = 4;

	/** Default name of the variable holding the value of a single-expression program. */
	public static final String DEFAULT_RESULT_VARIABLE = "result";

	/**
	 * Number of spaces per indentation level;
	 * <code>4</code> by default.
	 */
	private int indentWidth = DEFAULT_INDENT_WIDTH;

	/**
	 * Name of the <code>let</code> binding used when the program is a single
	 * bare expression;
	 * <code>result</code> by default.
	 */
	private String resultVariable = DEFAULT_RESULT_VARIABLE;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("indentWidth = ").append(getIndentWidth()).append(newLine);
		desc.append("resultVariable = ").append(getResultVariable()).append(newLine);

		return desc.toString();
	}

	/**
	 * Number of spaces per indentation level;
	 * <code>4</code> by default.
	 *
	 * @return the indentWidth
	 */
	public int getIndentWidth() {
		return indentWidth;
	}

	/**
	 * Number of spaces per indentation level.
	 *
	 * @param indentWidth the indentWidth to set, must not be negative
	 */
	public void setIndentWidth(int indentWidth) {
		if (indentWidth < 0) {
			throw new IllegalArgumentException("Indentation width must not be negative: " + indentWidth);
		}
		this.indentWidth = indentWidth;
	}

	/**
	 * Name of the variable bound to the value of a single-expression program;
	 * <code>result</code> by default.
	 *
	 * @return the resultVariable
	 */
	public String getResultVariable() {
		return resultVariable;
	}

	/**
	 * @param resultVariable the resultVariable to set
	 */
	public void setResultVariable(String resultVariable) {
		if (resultVariable == null || resultVariable.isEmpty()) {
			throw new IllegalArgumentException("Result variable name must not be empty");
		}
		this.resultVariable = resultVariable;
	}

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the OutputStream to print to (instead of System.out by default)
	 *
	 * @param pOutputStream OutputStream to use for the translation reports
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}
}
