package org.metricshub.exprlang.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import org.metricshub.exprlang.frontend.PrecedenceTable;

/**
 * A simple container for the parameters of AST construction.
 * These values have defaults, which match what the compiler front end
 * expects; embedding code may change them before building trees.
 */
public class AstBuildSettings {

	/**
	 * Tiers used to reduce operators.
	 * {@link PrecedenceTable#standard()} by default.
	 */
	private PrecedenceTable precedenceTable = PrecedenceTable.standard();

	/**
	 * Whether a missing or already consumed operand aborts the build;
	 * <code>true</code> by default. When <code>false</code>, the operator is
	 * left partially linked and a warning is logged.
	 */
	private boolean strictOperands = true;

	/**
	 * Whether the seeds after the first one are resolved to sub-roots;
	 * <code>true</code> by default.
	 */
	private boolean resolveSubRoots = true;

	/**
	 * Whether the finished tree is checked against the output contract;
	 * <code>true</code> by default. Trees degraded in lenient mode usually
	 * fail this check.
	 */
	private boolean verifyTree = true;

	/**
	 * Whether the finished tree is printed;
	 * <code>false</code> by default.
	 */
	private boolean dumpSyntaxTree = false;

	/**
	 * Where the syntax tree is dumped;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("precedenceTable = ").append(newLine).append(getPrecedenceTable());
		desc.append("strictOperands = ").append(isStrictOperands()).append(newLine);
		desc.append("resolveSubRoots = ").append(isResolveSubRoots()).append(newLine);
		desc.append("verifyTree = ").append(isVerifyTree()).append(newLine);
		desc.append("dumpSyntaxTree = ").append(isDumpSyntaxTree()).append(newLine);

		return desc.toString();
	}

	public PrecedenceTable getPrecedenceTable() {
		return precedenceTable;
	}

	public void setPrecedenceTable(PrecedenceTable precedenceTable) {
		if (precedenceTable == null) {
			throw new IllegalArgumentException("Precedence table must not be null");
		}
		this.precedenceTable = precedenceTable;
	}

	public boolean isStrictOperands() {
		return strictOperands;
	}

	public void setStrictOperands(boolean strictOperands) {
		this.strictOperands = strictOperands;
	}

	public boolean isResolveSubRoots() {
		return resolveSubRoots;
	}

	public void setResolveSubRoots(boolean resolveSubRoots) {
		this.resolveSubRoots = resolveSubRoots;
	}

	public boolean isVerifyTree() {
		return verifyTree;
	}

	public void setVerifyTree(boolean verifyTree) {
		this.verifyTree = verifyTree;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}

	/**
	 * @return the stream the syntax tree is dumped to
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The dump stream is shared with the caller on purpose")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param outputStream the stream to dump the syntax tree to
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}
}
