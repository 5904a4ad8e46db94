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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Root of the syntax tree: the top-level statements in source order.
 */
public final class Program {

	private final List<Statement> statements;

	public Program(List<Statement> statements) {
		this.statements = Statement.copyOf(statements, "statements");
	}

	public List<Statement> getStatements() {
		return statements;
	}

	public boolean isEmpty() {
		return statements.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Program && ((Program) o).statements.equals(statements);
	}

	@Override
	public int hashCode() {
		return statements.hashCode();
	}

	@Override
	public String toString() {
		return statements.stream().map(Statement::toString).collect(Collectors.joining("\n"));
	}
}
