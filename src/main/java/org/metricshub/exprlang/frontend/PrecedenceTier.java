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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One precedence level: a fixity and the operator classifications that
 * are reduced together with it.
 */
public final class PrecedenceTier {

	private final Fixity fixity;
	private final Set<Classification> classifications;

	/**
	 * @param fixity operands consumed by the operators of this tier
	 * @param classifications operator classifications of this tier
	 */
	public PrecedenceTier(Fixity fixity, Set<Classification> classifications) {
		this.fixity = Objects.requireNonNull(fixity, "fixity");
		if (classifications == null || classifications.isEmpty()) {
			throw new IllegalArgumentException("A precedence tier needs at least one classification");
		}
		this.classifications = Collections.unmodifiableSet(EnumSet.copyOf(classifications));
	}

	public Fixity getFixity() {
		return fixity;
	}

	public Set<Classification> getClassifications() {
		return classifications;
	}

	@Override
	public String toString() {
		return fixity + " " + classifications;
	}
}
