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
 * Base class of the errors raised while reading a Grit script.
 * Carries the 1-based source position of the offending input,
 * or <code>-1</code> when the position is unknown.
 */
public abstract class GritSyntaxException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int line;
	private final int column;

	protected GritSyntaxException(String message, int line, int column) {
		super(message);
		this.line = line;
		this.column = column;
	}

	/**
	 * @return the line of the offending input, or <code>-1</code>
	 */
	public int getLine() {
		return line;
	}

	/**
	 * @return the column of the offending input, or <code>-1</code>
	 */
	public int getColumn() {
		return column;
	}
}
