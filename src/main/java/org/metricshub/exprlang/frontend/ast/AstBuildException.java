package org.metricshub.exprlang.frontend.ast;

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
 * Base type of the errors raised while the syntax tree is built.
 * It is provided to conveniently distinguish AST construction errors
 * from other runtime exceptions.
 * <p>
 * Construction errors are contract violations between the grouping pass
 * and the AST builder, never user input errors: they abort the build and
 * are not meant to be recovered from.
 */
public class AstBuildException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int nodeIndex;

	/**
	 * @param msg description of the error
	 */
	public AstBuildException(String msg) {
		super(msg);
		this.nodeIndex = -1;
	}

	/**
	 * @param nodeIndex index of the offending node in the arena
	 * @param msg description of the error
	 */
	public AstBuildException(int nodeIndex, String msg) {
		super(msg);
		this.nodeIndex = nodeIndex;
	}

	public AstBuildException(int nodeIndex, String msg, Throwable cause) {
		super(msg, cause);
		this.nodeIndex = nodeIndex;
	}

	/**
	 * Returns the arena index of the node associated with this exception or
	 * {@code -1} if unavailable.
	 *
	 * @return the offending node index or {@code -1}
	 */
	public int getNodeIndex() {
		return nodeIndex;
	}
}
