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

import java.util.Locale;

/**
 * Thrown when an operator has no neighbour on a side its fixity consumes.
 */
public class MissingOperandException extends AstBuildException {

	private static final long serialVersionUID = 1L;

	/** Side of an operator. */
	public enum Side {
		LEFT,
		RIGHT
	}

	private final Side side;

	/**
	 * @param operatorIndex index of the operator node
	 * @param side the side where the operand is missing
	 * @param operatorText text of the operator token, for the message
	 */
	public MissingOperandException(int operatorIndex, Side side, String operatorText) {
		super(operatorIndex, "Operator '" + operatorText + "' at node " + operatorIndex
				+ " is missing its " + side.name().toLowerCase(Locale.ROOT) + " operand");
		this.side = side;
	}

	public Side getSide() {
		return side;
	}
}
