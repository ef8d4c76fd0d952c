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
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.exprlang.frontend.ast.UnsupportedClassificationException;

/**
 * Ordered list of precedence tiers, tightest binding first.
 * <p>
 * The order of the tiers is the order in which the reduction engine
 * processes them: operators of an earlier tier are reduced first, and
 * the nodes they produce become operands of the operators of later
 * tiers.
 * <p>
 * The standard table is:
 * <ol start="0">
 * <li>{@link Fixity#BINARY}: {@link Classification#DECIMAL}
 * <li>{@link Fixity#BINARY}: {@link Classification#ACCESS}
 * <li>{@link Fixity#UNARY_PREFIX}: {@link Classification#NEGATION},
 * {@link Classification#ABSOLUTE_VALUE}, {@link Classification#NOT}
 * </ol>
 * New tiers are added through {@link #toBuilder()} at the position that
 * matches their binding strength; the reduction engine does not change.
 */
public final class PrecedenceTable {

	private static final PrecedenceTable STANDARD = builder()
			.append(Fixity.BINARY, Classification.DECIMAL)
			.append(Fixity.BINARY, Classification.ACCESS)
			.append(Fixity.UNARY_PREFIX, Classification.NEGATION, Classification.ABSOLUTE_VALUE, Classification.NOT)
			.build();

	private final List<PrecedenceTier> tiers;
	private final Map<Classification, Integer> tierIndexes;

	private PrecedenceTable(List<PrecedenceTier> tiers) {
		this.tiers = Collections.unmodifiableList(new ArrayList<PrecedenceTier>(tiers));
		Map<Classification, Integer> indexes = new EnumMap<Classification, Integer>(Classification.class);
		for (int i = 0; i < tiers.size(); i++) {
			for (Classification classification : tiers.get(i).getClassifications()) {
				if (classification.isLeaf()) {
					throw new IllegalArgumentException(
							"Leaf classification " + classification + " cannot be placed in a precedence tier");
				}
				Integer previous = indexes.put(classification, i);
				if (previous != null) {
					throw new IllegalArgumentException(
							"Classification " + classification + " is placed in tiers " + previous + " and " + i);
				}
			}
		}
		this.tierIndexes = indexes;
	}

	/**
	 * @return the precedence table for Decimal, Access and the unary prefix
	 *         operators
	 */
	public static PrecedenceTable standard() {
		return STANDARD;
	}

	/**
	 * @return an empty builder
	 */
	public static Builder builder() {
		return new Builder(Collections.<PrecedenceTier>emptyList());
	}

	/**
	 * @return a builder pre-filled with the tiers of this table
	 */
	public Builder toBuilder() {
		return new Builder(tiers);
	}

	public List<PrecedenceTier> getTiers() {
		return tiers;
	}

	public int size() {
		return tiers.size();
	}

	public PrecedenceTier getTier(int index) {
		return tiers.get(index);
	}

	/**
	 * Tier of an operator classification.
	 *
	 * @param classification a non-leaf classification
	 * @return the index of the tier holding {@code classification}
	 * @throws UnsupportedClassificationException if no tier holds it
	 * @throws IllegalArgumentException if {@code classification} is a leaf
	 */
	public int tierOf(Classification classification) {
		return tierOf(classification, -1);
	}

	int tierOf(Classification classification, int nodeIndex) {
		if (classification.isLeaf()) {
			throw new IllegalArgumentException(classification + " is a leaf classification, not an operator");
		}
		Integer index = tierIndexes.get(classification);
		if (index == null) {
			throw new UnsupportedClassificationException(nodeIndex, classification);
		}
		return index.intValue();
	}

	/**
	 * @return the operator classifications that no tier of this table places
	 */
	public Set<Classification> unsupportedClassifications() {
		Set<Classification> result = EnumSet.noneOf(Classification.class);
		for (Classification classification : Classification.values()) {
			if (!classification.isLeaf() && !tierIndexes.containsKey(classification)) {
				result.add(classification);
			}
		}
		return result;
	}

	@Override
	public String toString() {
		StringBuilder desc = new StringBuilder();
		for (int i = 0; i < tiers.size(); i++) {
			desc.append(i).append(": ").append(tiers.get(i)).append('\n');
		}
		return desc.toString();
	}

	/**
	 * Assembles a {@link PrecedenceTable}. Validation happens in
	 * {@link #build()}.
	 */
	public static final class Builder {

		private final List<PrecedenceTier> tiers;

		private Builder(List<PrecedenceTier> initial) {
			this.tiers = new ArrayList<PrecedenceTier>(initial);
		}

		/**
		 * Adds a tier that binds looser than all the tiers added so far.
		 *
		 * @param fixity operands consumed by the tier's operators
		 * @param classifications operator classifications of the tier
		 * @return this builder
		 */
		public Builder append(Fixity fixity, Classification... classifications) {
			tiers.add(tier(fixity, classifications));
			return this;
		}

		/**
		 * Adds a tier at the given binding position. Tiers at and after
		 * {@code position} move one step looser.
		 *
		 * @param position index of the new tier, from 0 to the current size
		 * @param fixity operands consumed by the tier's operators
		 * @param classifications operator classifications of the tier
		 * @return this builder
		 */
		public Builder insert(int position, Fixity fixity, Classification... classifications) {
			if (position < 0 || position > tiers.size()) {
				throw new IllegalArgumentException(
						"Tier position " + position + " is outside 0.." + tiers.size());
			}
			tiers.add(position, tier(fixity, classifications));
			return this;
		}

		/**
		 * @return the table
		 * @throws IllegalArgumentException if a classification is placed twice
		 *         or a leaf classification is placed at all
		 */
		public PrecedenceTable build() {
			return new PrecedenceTable(tiers);
		}

		private static PrecedenceTier tier(Fixity fixity, Classification... classifications) {
			if (classifications == null || classifications.length == 0) {
				throw new IllegalArgumentException("A precedence tier needs at least one classification");
			}
			return new PrecedenceTier(fixity, EnumSet.copyOf(Arrays.asList(classifications)));
		}
	}
}
