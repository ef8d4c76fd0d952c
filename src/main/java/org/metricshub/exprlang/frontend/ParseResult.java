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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of the grouping pass, and input of {@link AstBuilder}.
 * <p>
 * The arena holds the flat sequence of nodes, linked to their neighbours
 * and without any parent. Each entry of {@code subExpressions} is the
 * index of an arbitrary node of one independently grouped expression
 * segment; the first one identifies the primary expression.
 * <p>
 * The arena is handed over to the builder, which rewrites its links in
 * place. A parse result must therefore be built only once.
 */
public final class ParseResult {

	private final NodeArena nodes;
	private final List<Integer> subExpressions;

	/**
	 * @param nodes the flat node sequence
	 * @param subExpressions seed indexes, one per expression segment
	 */
	public ParseResult(List<Node> nodes, List<Integer> subExpressions) {
		this(new NodeArena(nodes), subExpressions);
	}

	/**
	 * @param nodes the flat node sequence
	 * @param subExpressions seed indexes, one per expression segment
	 */
	public ParseResult(NodeArena nodes, List<Integer> subExpressions) {
		this.nodes = Objects.requireNonNull(nodes, "nodes");
		this.subExpressions = Collections.unmodifiableList(new ArrayList<Integer>(
				Objects.requireNonNull(subExpressions, "subExpressions")));
	}

	public NodeArena getNodes() {
		return nodes;
	}

	public List<Integer> getSubExpressions() {
		return subExpressions;
	}
}
