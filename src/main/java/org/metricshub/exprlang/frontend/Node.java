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
 * One entry of the {@link NodeArena}.
 * <p>
 * Nodes have the following properties:
 * <ul>
 * <li>A classification and a token, both final.
 * <li>A left, a right and a parent link, expressed as indexes into the
 * same arena.
 * </ul>
 * Before the tree is built, {@code left} and {@code right} are the
 * neighbours of the node in the flat sequence produced by the grouping
 * pass. Once an operator is reduced, they are its children. An unset
 * link is {@link #NONE}.
 * <p>
 * Links are only rewritten by the reduction engine, hence the
 * package-private setters.
 */
public final class Node {

	/** Index value of an absent link. */
	public static final int NONE = -1;

	private final Classification classification;
	private final Token token;
	private int left = NONE;
	private int right = NONE;
	private int parent = NONE;

	/**
	 * Creates an unlinked node.
	 *
	 * @param classification syntactic role of the node
	 * @param token token the node was grouped from
	 */
	public Node(Classification classification, Token token) {
		this(classification, token, NONE, NONE);
	}

	/**
	 * Creates a node linked to its flat-sequence neighbours.
	 *
	 * @param classification syntactic role of the node
	 * @param token token the node was grouped from
	 * @param left index of the previous node, or {@link #NONE}
	 * @param right index of the next node, or {@link #NONE}
	 */
	public Node(Classification classification, Token token, int left, int right) {
		this.classification = Objects.requireNonNull(classification, "classification");
		this.token = Objects.requireNonNull(token, "token");
		this.left = left;
		this.right = right;
	}

	public Classification getClassification() {
		return classification;
	}

	public Token getToken() {
		return token;
	}

	public int getLeft() {
		return left;
	}

	public int getRight() {
		return right;
	}

	public int getParent() {
		return parent;
	}

	public boolean hasLeft() {
		return left != NONE;
	}

	public boolean hasRight() {
		return right != NONE;
	}

	public boolean hasParent() {
		return parent != NONE;
	}

	void setLeft(int left) {
		this.left = left;
	}

	void setRight(int right) {
		this.right = right;
	}

	void setParent(int parent) {
		this.parent = parent;
	}

	/**
	 * Drops both sequence links. Used when a leaf is consumed by an operator.
	 */
	void detach() {
		left = NONE;
		right = NONE;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Node)) {
			return false;
		}
		Node other = (Node) obj;
		return classification == other.classification
				&& token.equals(other.token)
				&& left == other.left
				&& right == other.right
				&& parent == other.parent;
	}

	@Override
	public int hashCode() {
		return Objects.hash(classification, token, left, right, parent);
	}

	@Override
	public String toString() {
		return classification + " " + token + " [left=" + left + ", right=" + right + ", parent=" + parent + "]";
	}
}
