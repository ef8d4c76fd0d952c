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
import java.util.Iterator;
import java.util.List;

/**
 * Insertion-ordered, index-addressed collection of {@link Node}s.
 * <p>
 * The arena has a fixed size: nodes are neither added nor removed once
 * it is created, so an index stays valid for the whole pipeline. Only
 * the links held by the nodes change while the tree is built.
 */
public final class NodeArena implements Iterable<Node> {

	private final List<Node> nodes;
	private final List<Node> view;

	/**
	 * @param nodes nodes in flat-sequence order; the list is copied, the
	 *        nodes are not
	 */
	public NodeArena(List<Node> nodes) {
		this.nodes = new ArrayList<Node>(nodes);
		for (Node node : this.nodes) {
			if (node == null) {
				throw new IllegalArgumentException("Arena must not contain null nodes");
			}
		}
		this.view = Collections.unmodifiableList(this.nodes);
	}

	public int size() {
		return nodes.size();
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	/**
	 * @param index position to check
	 * @return {@code true} when {@code index} addresses a node of this arena
	 */
	public boolean contains(int index) {
		return index >= 0 && index < nodes.size();
	}

	/**
	 * @param index position of the node
	 * @return the node at {@code index}
	 * @throws IndexOutOfBoundsException if the index is outside the arena
	 */
	public Node get(int index) {
		return nodes.get(index);
	}

	/**
	 * @return a read-only list view of the nodes, in arena order
	 */
	public List<Node> asList() {
		return view;
	}

	@Override
	public Iterator<Node> iterator() {
		return view.iterator();
	}

	@Override
	public String toString() {
		StringBuilder desc = new StringBuilder();
		for (int i = 0; i < nodes.size(); i++) {
			desc.append(i).append(": ").append(nodes.get(i)).append('\n');
		}
		return desc.toString();
	}
}
