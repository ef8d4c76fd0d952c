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
 * Which operands an operator consumes.
 */
public enum Fixity {
	/** Consumes the operands on both sides. */
	BINARY(true, true),
	/** Consumes the operand to its right only, as in {@code -x}. */
	UNARY_PREFIX(false, true),
	/** Consumes the operand to its left only. No standard tier uses it yet. */
	UNARY_POSTFIX(true, false);

	private final boolean left;
	private final boolean right;

	Fixity(boolean left, boolean right) {
		this.left = left;
		this.right = right;
	}

	public boolean consumesLeft() {
		return left;
	}

	public boolean consumesRight() {
		return right;
	}
}
