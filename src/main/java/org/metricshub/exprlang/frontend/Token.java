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

import java.util.Objects;

/**
 * A terminal lexical unit: the raw text and its lexical category.
 * Tokens are immutable.
 */
public final class Token {

	private final String value;
	private final TokenType tokenType;

	/**
	 * @param value raw text of the token (never {@code null}, may be empty)
	 * @param tokenType lexical category of the token
	 */
	public Token(String value, TokenType tokenType) {
		this.value = Objects.requireNonNull(value, "value");
		this.tokenType = Objects.requireNonNull(tokenType, "tokenType");
	}

	public String getValue() {
		return value;
	}

	public TokenType getTokenType() {
		return tokenType;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Token)) {
			return false;
		}
		Token other = (Token) obj;
		return value.equals(other.value) && tokenType == other.tokenType;
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, tokenType);
	}

	@Override
	public String toString() {
		return "\"" + value + "\" (" + tokenType + ")";
	}
}
