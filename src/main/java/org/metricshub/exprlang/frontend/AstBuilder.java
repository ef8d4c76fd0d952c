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
import java.util.List;
import java.util.Objects;
import org.metricshub.exprlang.frontend.ast.MalformedTreeException;
import org.metricshub.exprlang.util.AstBuildSettings;
import org.metricshub.exprlang.util.ExprLogger;
import org.slf4j.Logger;

/**
 * Entry point of the AST construction phase.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Bucket the operators of the flat sequence by precedence tier.
 * <li>Reduce the tiers in order, rewriting the node links in place
 * (see {@link ReductionEngine}).
 * <li>Climb the parent links from the seeds to find the roots
 * (see {@link RootResolver}).
 * <li>Optionally check the tree (see {@link AstVerifier}) and dump it.
 * </ul>
 * An empty sequence does not go through these steps: it builds a tree
 * holding a single unit literal.
 * <p>
 * A builder only holds its configuration and may be shared. The
 * {@link ParseResult} it is given is consumed: its arena becomes the
 * arena of the returned {@link Ast}.
 */
public class AstBuilder {

	private static final Logger LOG = ExprLogger.getLogger(AstBuilder.class);

	private final AstBuildSettings settings;
	private final ReductionEngine reductionEngine;
	private final RootResolver rootResolver = new RootResolver();
	private final AstVerifier verifier = new AstVerifier();

	/**
	 * Create a builder with the default settings
	 */
	public AstBuilder() {
		this(new AstBuildSettings());
	}

	/**
	 * @param settings construction settings; read once, later changes to
	 *        the precedence table or operand mode are not seen
	 */
	public AstBuilder(AstBuildSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.reductionEngine = new ReductionEngine(settings.getPrecedenceTable(), settings.isStrictOperands());
	}

	/**
	 * Builds the syntax tree of a grouped expression.
	 *
	 * @param parseResult output of the grouping pass; its arena is rewritten
	 *        in place
	 * @return the tree
	 * @throws org.metricshub.exprlang.frontend.ast.UnsupportedClassificationException
	 *         if an operator classification has no precedence tier
	 * @throws org.metricshub.exprlang.frontend.ast.MissingOperandException
	 *         if an operator lacks an operand, in strict mode
	 * @throws MalformedTreeException if the links or seeds are inconsistent
	 */
	public Ast build(ParseResult parseResult) {
		Objects.requireNonNull(parseResult, "parseResult");
		NodeArena arena = parseResult.getNodes();

		Ast ast;
		if (arena.isEmpty()) {
			LOG.debug("Empty input, building a unit literal");
			ast = unitAst();
		} else {
			List<Integer> seeds = parseResult.getSubExpressions();
			if (seeds.isEmpty()) {
				throw new MalformedTreeException("No sub-expression seed given for " + arena.size() + " node(s)");
			}

			LOG.debug("Building AST from {} node(s) and {} seed(s)", arena.size(), seeds.size());
			reductionEngine.reduce(arena);

			int root = rootResolver.resolve(arena, seeds.get(0));
			List<Integer> subRoots = settings.isResolveSubRoots()
					? rootResolver.resolveSubRoots(arena, seeds, root)
					: Collections.<Integer>emptyList();
			LOG.debug("Root is node {}, sub-roots are {}", root, subRoots);
			ast = new Ast(arena, root, subRoots);
		}

		if (settings.isVerifyTree()) {
			verifier.verify(ast);
		}
		if (settings.isDumpSyntaxTree()) {
			ast.dump(settings.getOutputStream());
		}
		return ast;
	}

	private static Ast unitAst() {
		Node unit = new Node(Classification.LITERAL, new Token("", TokenType.UNIT_LITERAL));
		return new Ast(new NodeArena(Collections.singletonList(unit)), 0, Collections.<Integer>emptyList());
	}
}
