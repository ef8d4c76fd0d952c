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
 * Lexical categories produced by the lexer.
 */
public enum TokenType {
	NUMBER,
	CHARACTER,
	CHARACTER_LIST,
	IDENTIFIER,
	/** Symbol literal, such as {@code :value}. */
	SYMBOL,
	/** Operator text, such as {@code .}, {@code -}, {@code +} or {@code !}. */
	OPERATOR,
	UNIT_LITERAL,
	/** Reference to the expression input ({@code $}). */
	INPUT,
	/** Reference to the previous result ({@code ?}). */
	RESULT,

	ITERATION_OUTPUT,
	ITERATION_SKIP,
	ITERATION_CONTINUE,
	ITERATION_COMPLETE
}
