package org.metricshub.exprlang.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * ExprLang AST
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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
 * Syntactic role assigned to a node by the grouping pass.
 * <p>
 * Leaf classifications are never operators and are skipped when
 * operators are bucketed. Every other classification must be placed by
 * the {@link PrecedenceTable}, otherwise building the tree fails.
 */
public enum Classification {
	LITERAL(true),
	ITERATION_OUTPUT(true),
	ITERATION_SKIP(true),
	ITERATION_CONTINUE(true),
	ITERATION_COMPLETE(true),

	/** Joins the integer and fractional parts of a number. */
	DECIMAL(false),
	/** Member access on an object expression. */
	ACCESS(false),

	NEGATION(false),
	ABSOLUTE_VALUE(false),
	NOT(false),

	// emitted by the grouping pass, not placed by the standard table yet
	ADDITION(false),
	SUBTRACTION(false),
	MULTIPLICATION(false),
	DIVISION(false),
	EQUALITY(false),
	PAIR(false);

	private final boolean leaf;

	Classification(boolean leaf) {
		this.leaf = leaf;
	}

	/**
	 * @return {@code true} when nodes of this classification are tree leaves
	 */
	public boolean isLeaf() {
		return leaf;
	}
}
