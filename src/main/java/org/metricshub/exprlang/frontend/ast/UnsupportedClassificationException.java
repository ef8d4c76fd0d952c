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

import org.metricshub.exprlang.frontend.Classification;

/**
 * Thrown when the grouping pass produced an operator classification that
 * the precedence table does not place.
 */
public class UnsupportedClassificationException extends AstBuildException {

	private static final long serialVersionUID = 1L;

	private final Classification classification;

	/**
	 * @param nodeIndex index of the node carrying the classification, or
	 *        {@code -1} when raised outside of a build
	 * @param classification the classification without a tier
	 */
	public UnsupportedClassificationException(int nodeIndex, Classification classification) {
		super(nodeIndex, "Unsupported operator classification " + classification
				+ (nodeIndex >= 0 ? " at node " + nodeIndex : ""));
		this.classification = classification;
	}

	public Classification getClassification() {
		return classification;
	}
}
