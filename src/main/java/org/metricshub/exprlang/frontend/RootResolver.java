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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.exprlang.frontend.ast.MalformedTreeException;

/**
 * Finds the root of the tree a node belongs to by climbing its parent
 * links.
 */
public final class RootResolver {

	/**
	 * Climbs from {@code seed} to the node without a parent.
	 *
	 * @param arena a reduced arena
	 * @param seed index of any node of the expression
	 * @return the index of the root
	 * @throws MalformedTreeException if the seed is outside the arena or the
	 *         parent links form a cycle
	 */
	public int resolve(NodeArena arena, int seed) {
		if (!arena.contains(seed)) {
			throw new MalformedTreeException(
					seed,
					"Seed index " + seed + " is outside of the arena (size " + arena.size() + ")");
		}
		int index = seed;
		int steps = 0;
		while (arena.get(index).hasParent()) {
			// a chain longer than the arena must revisit a node
			if (++steps > arena.size()) {
				throw new MalformedTreeException(seed, "Parent links from node " + seed + " form a cycle");
			}
			index = arena.get(index).getParent();
			if (!arena.contains(index)) {
				throw new MalformedTreeException(
						index,
						"Parent link " + index + " is outside of the arena (size " + arena.size() + ")");
			}
		}
		return index;
	}

	/**
	 * Resolves every seed after the first one and keeps the roots that are
	 * distinct from the primary root and from each other, in seed order.
	 *
	 * @param arena a reduced arena
	 * @param seeds seed indexes; the first one is the primary expression
	 * @param root the already resolved primary root
	 * @return the roots of the additional sub-expressions
	 */
	public List<Integer> resolveSubRoots(NodeArena arena, List<Integer> seeds, int root) {
		Set<Integer> roots = new LinkedHashSet<Integer>();
		for (int i = 1; i < seeds.size(); i++) {
			int subRoot = resolve(arena, seeds.get(i));
			if (subRoot != root) {
				roots.add(subRoot);
			}
		}
		return new ArrayList<Integer>(roots);
	}
}
