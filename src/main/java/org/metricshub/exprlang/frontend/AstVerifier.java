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

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import org.metricshub.exprlang.frontend.ast.MalformedTreeException;

/**
 * Checks that a built {@link Ast} honours the contract consumers rely on:
 * <ul>
 * <li>the roots have no parent;
 * <li>every child names the node holding it as its parent;
 * <li>no node is reached twice, so there is no shared child and no cycle;
 * <li>leaves have no children.
 * </ul>
 */
public final class AstVerifier {

	/**
	 * @param ast the tree to check
	 * @throws MalformedTreeException on the first violation found
	 */
	public void verify(Ast ast) {
		NodeArena arena = ast.getArena();
		BitSet visited = new BitSet(arena.size());
		verifyTree(ast, ast.getRoot(), visited);
		for (int subRoot : ast.getSubRoots()) {
			verifyTree(ast, subRoot, visited);
		}
	}

	private void verifyTree(Ast ast, int root, BitSet visited) {
		NodeArena arena = ast.getArena();
		if (!arena.contains(root)) {
			throw new MalformedTreeException(root, "Root " + root + " is outside of the arena");
		}
		if (arena.get(root).hasParent()) {
			throw new MalformedTreeException(
					root,
					"Root " + root + " has parent " + arena.get(root).getParent());
		}

		Deque<Integer> pending = new ArrayDeque<Integer>();
		pending.push(root);
		while (!pending.isEmpty()) {
			int index = pending.pop();
			if (visited.get(index)) {
				throw new MalformedTreeException(index, "Node " + index + " is reachable more than once");
			}
			visited.set(index);

			Node node = arena.get(index);
			if (node.getClassification().isLeaf() && (node.hasLeft() || node.hasRight())) {
				throw new MalformedTreeException(
						index,
						"Leaf " + index + " (" + node.getClassification() + ") has children");
			}
			for (int child : ast.children(index)) {
				if (!arena.contains(child)) {
					throw new MalformedTreeException(
							index,
							"Node " + index + " links to " + child + ", outside of the arena");
				}
				if (arena.get(child).getParent() != index) {
					throw new MalformedTreeException(
							child,
							"Node " + child + " is a child of " + index + " but its parent is "
									+ arena.get(child).getParent());
				}
				pending.push(child);
			}
		}
	}
}
