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
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import org.metricshub.exprlang.frontend.ast.MalformedTreeException;
import org.metricshub.exprlang.frontend.ast.MissingOperandException;
import org.metricshub.exprlang.frontend.ast.MissingOperandException.Side;
import org.metricshub.exprlang.util.ExprLogger;
import org.slf4j.Logger;

/**
 * Turns the flat node sequence of a {@link NodeArena} into a tree, in
 * place.
 * <p>
 * The engine first scans the arena once and puts the index of every
 * operator in the bucket of its precedence tier, in left-to-right order.
 * It then reduces the tiers one after the other. Reducing an operator
 * makes it the parent of its neighbour(s) and splices it into the
 * sequence in place of the operands it consumed, so that the operators
 * of the following tiers see it as a single operand.
 * <p>
 * Within a tier, operators are reduced from left to right. A binary
 * operator therefore finds the already reduced operator on its left as
 * its left operand, which makes the operators of a tier left-associative:
 * {@code a.b.c} becomes {@code (a.b).c}.
 * <p>
 * No node is created, moved or deleted: only links change.
 */
public final class ReductionEngine {

	private static final Logger LOG = ExprLogger.getLogger(ReductionEngine.class);

	private final PrecedenceTable precedenceTable;
	private final boolean strictOperands;

	/**
	 * @param precedenceTable tiers to reduce, tightest binding first
	 * @param strictOperands {@code true} to fail on a missing or already
	 *        consumed operand, {@code false} to log a warning and go on
	 */
	public ReductionEngine(PrecedenceTable precedenceTable, boolean strictOperands) {
		this.precedenceTable = Objects.requireNonNull(precedenceTable, "precedenceTable");
		this.strictOperands = strictOperands;
	}

	/**
	 * Reduces all the operators of the arena.
	 *
	 * @param arena the flat sequence produced by the grouping pass
	 * @throws org.metricshub.exprlang.frontend.ast.UnsupportedClassificationException
	 *         if an operator has no tier
	 * @throws MissingOperandException if an operand is missing in strict mode
	 * @throws MalformedTreeException if the sequence links are inconsistent
	 */
	public void reduce(NodeArena arena) {
		List<List<Integer>> buckets = bucket(arena);
		Sequence sequence = new Sequence(arena);
		BitSet reduced = new BitSet(arena.size());

		for (int tier = 0; tier < buckets.size(); tier++) {
			List<Integer> bucket = buckets.get(tier);
			Fixity fixity = precedenceTable.getTier(tier).getFixity();
			LOG.trace("Tier {} ({}): {} operator(s) to reduce", tier, precedenceTable.getTier(tier), bucket.size());
			for (int loc : bucket) {
				reduceOperator(arena, sequence, reduced, loc, fixity);
				reduced.set(loc);
			}
		}
	}

	/**
	 * Groups the operator indexes of the arena by precedence tier.
	 * Leaves are skipped.
	 *
	 * @param arena the flat sequence produced by the grouping pass
	 * @return one list per tier, holding the operator indexes in arena order
	 * @throws org.metricshub.exprlang.frontend.ast.UnsupportedClassificationException
	 *         if an operator has no tier
	 */
	public List<List<Integer>> bucket(NodeArena arena) {
		List<List<Integer>> buckets = new ArrayList<List<Integer>>(precedenceTable.size());
		for (int i = 0; i < precedenceTable.size(); i++) {
			buckets.add(new ArrayList<Integer>());
		}
		for (int i = 0; i < arena.size(); i++) {
			Classification classification = arena.get(i).getClassification();
			if (classification.isLeaf()) {
				continue;
			}
			buckets.get(precedenceTable.tierOf(classification, i)).add(i);
		}
		return buckets;
	}

	private void reduceOperator(NodeArena arena, Sequence sequence, BitSet reduced, int loc, Fixity fixity) {
		Node operator = arena.get(loc);
		// an operator that is itself the operand of a tighter one is no longer
		// part of the sequence: its operands are taken out instead of replaced
		boolean inSequence = !operator.hasParent();
		int left = sequence.before(loc);
		int right = sequence.after(loc);

		if (fixity.consumesLeft()) {
			if (left == Node.NONE) {
				missingOperand(operator, loc, Side.LEFT);
			} else {
				claim(arena, loc, left);
				int previous = sequence.before(left);
				if (inSequence) {
					sequence.link(previous, loc);
					if (previous != Node.NONE && !reduced.get(previous)) {
						arena.get(previous).setRight(loc);
					}
				} else {
					sequence.link(previous, sequence.after(left));
				}
			}
			operator.setLeft(left);
		} else {
			operator.setLeft(Node.NONE);
		}

		if (fixity.consumesRight()) {
			if (right == Node.NONE) {
				missingOperand(operator, loc, Side.RIGHT);
			} else {
				int newRight = sequence.after(right);
				claim(arena, loc, right);
				if (inSequence) {
					sequence.link(loc, newRight);
					if (newRight != Node.NONE && !reduced.get(newRight)) {
						arena.get(newRight).setLeft(loc);
					}
				} else {
					sequence.link(sequence.before(right), newRight);
				}
			}
			operator.setRight(right);
		} else {
			operator.setRight(Node.NONE);
		}
	}

	private void claim(NodeArena arena, int loc, int operandIndex) {
		Node operand = arena.get(operandIndex);
		if (operandIndex == arena.get(loc).getParent()) {
			throw new MalformedTreeException(
					loc,
					"Node " + loc + " cannot take its own parent " + operandIndex + " as operand");
		}
		if (operand.hasParent()) {
			String msg = "Node " + operandIndex + " is already an operand of node " + operand.getParent()
					+ " and cannot be claimed by node " + loc;
			if (strictOperands) {
				throw new MalformedTreeException(operandIndex, msg);
			}
			LOG.warn("{}, re-parenting it", msg);
		}
		operand.setParent(loc);
		if (operand.getClassification().isLeaf()) {
			operand.detach();
		}
	}

	private void missingOperand(Node operator, int loc, Side side) {
		MissingOperandException e = new MissingOperandException(loc, side, operator.getToken().getValue());
		if (strictOperands) {
			throw e;
		}
		LOG.warn("{}, leaving it unset", e.getMessage());
	}

	/**
	 * The current flat sequence, as two arrays of neighbour indexes.
	 * <p>
	 * Seeded from the links of the nodes in both directions, so a link
	 * given on either end of a pair is enough. The sequence only ever holds
	 * the roots of the partial trees built so far.
	 */
	private static final class Sequence {

		private final int[] before;
		private final int[] after;

		private Sequence(NodeArena arena) {
			before = new int[arena.size()];
			after = new int[arena.size()];
			Arrays.fill(before, Node.NONE);
			Arrays.fill(after, Node.NONE);
			for (int i = 0; i < arena.size(); i++) {
				Node node = arena.get(i);
				if (node.hasLeft()) {
					seed(arena, node.getLeft(), i, i);
				}
				if (node.hasRight()) {
					seed(arena, i, node.getRight(), i);
				}
			}
		}

		private void seed(NodeArena arena, int first, int second, int owner) {
			if (!arena.contains(first) || !arena.contains(second)) {
				throw new MalformedTreeException(
						owner,
						"Node " + owner + " links to an index outside of the arena (size " + arena.size() + ")");
			}
			if (first == second) {
				throw new MalformedTreeException(owner, "Node " + owner + " is linked to itself");
			}
			if ((after[first] != Node.NONE && after[first] != second)
					|| (before[second] != Node.NONE && before[second] != first)) {
				throw new MalformedTreeException(
						owner,
						"Inconsistent sequence links between nodes " + first + " and " + second);
			}
			after[first] = second;
			before[second] = first;
		}

		private int before(int index) {
			return before[index];
		}

		private int after(int index) {
			return after[index];
		}

		private void link(int first, int second) {
			if (first != Node.NONE) {
				after[first] = second;
			}
			if (second != Node.NONE) {
				before[second] = first;
			}
		}
	}
}
