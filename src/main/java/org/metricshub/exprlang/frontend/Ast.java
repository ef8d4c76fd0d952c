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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * A built syntax tree: the arena, now a forest, with the root of the
 * primary expression and the roots of the additional sub-expressions.
 * <p>
 * Nodes reachable from a root form a tree. Nodes that no root reaches
 * may still sit in the arena with stale links; consumers that traverse
 * from the roots never see them.
 */
public final class Ast {

	private final NodeArena nodes;
	private final int root;
	private final List<Integer> subRoots;

	/**
	 * @param nodes the reduced arena
	 * @param root index of the primary root
	 * @param subRoots indexes of the additional roots
	 */
	public Ast(NodeArena nodes, int root, List<Integer> subRoots) {
		this.nodes = nodes;
		this.root = root;
		this.subRoots = Collections.unmodifiableList(new ArrayList<Integer>(subRoots));
	}

	/**
	 * @return a read-only view of the arena
	 */
	public List<Node> getNodes() {
		return nodes.asList();
	}

	public NodeArena getArena() {
		return nodes;
	}

	public int getRoot() {
		return root;
	}

	public Node getRootNode() {
		return nodes.get(root);
	}

	public List<Integer> getSubRoots() {
		return subRoots;
	}

	/**
	 * @param index a node of the tree
	 * @return the indexes of the children of the node, left first
	 */
	public List<Integer> children(int index) {
		Node node = nodes.get(index);
		List<Integer> children = new ArrayList<Integer>(2);
		if (node.hasLeft()) {
			children.add(node.getLeft());
		}
		if (node.hasRight()) {
			children.add(node.getRight());
		}
		return children;
	}

	/**
	 * Prints the primary tree, then the sub-trees, one node per line and
	 * indented by depth.
	 *
	 * @param ps The print stream to dump the tree to
	 */
	public void dump(PrintStream ps) {
		BitSet printed = new BitSet(nodes.size());
		dump(ps, root, 0, printed);
		for (int subRoot : subRoots) {
			dump(ps, subRoot, 0, printed);
		}
		ps.flush();
	}

	private void dump(PrintStream ps, int index, int depth, BitSet printed) {
		StringBuilder line = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			line.append("  ");
		}
		Node node = nodes.get(index);
		line.append('[').append(index).append("] ").append(node.getClassification()).append(' ').append(node.getToken());
		if (printed.get(index)) {
			// only reachable when verification was turned off
			ps.println(line.append(" <already printed>"));
			return;
		}
		printed.set(index);
		ps.println(line);
		for (int child : children(index)) {
			dump(ps, child, depth + 1, printed);
		}
	}
}
