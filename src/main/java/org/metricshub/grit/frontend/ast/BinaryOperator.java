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

import org.metricshub.grit.frontend.TokenType;

/**
 * Binary operators of Grit expressions, from loosest to tightest binding:
 * comparisons, then additive, then multiplicative. All are left associative.
 */
public enum BinaryOperator {
	ADD("+", 1),
	SUBTRACT("-", 1),
	MULTIPLY("*", 2),
	DIVIDE("/", 2),
	EQUAL("==", 0),
	NOT_EQUAL("!=", 0),
	LESS_THAN("<", 0),
	LESS_EQUAL("<=", 0),
	GREATER_THAN(">", 0),
	GREATER_EQUAL(">=", 0);

	private final String symbol;
	private final int precedence;

	BinaryOperator(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
	}

	/**
	 * @return the operator as written in both Grit and Rust
	 */
	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return binding strength, higher binds tighter
	 */
	public int getPrecedence() {
		return precedence;
	}

	/**
	 * Maps an operator token to its operator.
	 *
	 * @param type token kind
	 * @return the operator, or <code>null</code> when the token is not a binary operator
	 */
	public static BinaryOperator fromToken(TokenType type) {
		switch (type) {
		case PLUS:
			return ADD;
		case MINUS:
			return SUBTRACT;
		case MULTIPLY:
			return MULTIPLY;
		case DIVIDE:
			return DIVIDE;
		case EQUAL_EQUAL:
			return EQUAL;
		case NOT_EQUAL:
			return NOT_EQUAL;
		case LESS_THAN:
			return LESS_THAN;
		case LESS_THAN_OR_EQUAL:
			return LESS_EQUAL;
		case GREATER_THAN:
			return GREATER_THAN;
		case GREATER_THAN_OR_EQUAL:
			return GREATER_EQUAL;
		default:
			return null;
		}
	}

	@Override
	public String toString() {
		return symbol;
	}
}
