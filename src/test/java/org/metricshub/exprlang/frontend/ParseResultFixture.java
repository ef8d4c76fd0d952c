package org.metricshub.exprlang.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds {@link ParseResult}s the way the grouping pass does: one node per
 * token, linked to its neighbours in a flat sequence, with one seed per
 * expression segment.
 * <p>
 * Typical usage:
 *
 * <pre>
 * ParseResult input = ParseResultFixture
 * 		.expression("3.14")
 * 		.number("3")
 * 		.decimal()
 * 		.number("14")
 * 		.build();
 * </pre>
 */
public final class ParseResultFixture {

	private final String description;
	private final List<Classification> classifications = new ArrayList<>();
	private final List<Token> tokens = new ArrayList<>();
	private final List<Integer> segmentStarts = new ArrayList<>();
	private List<Integer> explicitSeeds;
	private boolean linkLeaves = true;

	private ParseResultFixture(String description) {
		this.description = description;
		segmentStarts.add(0);
	}

	/**
	 * Starts a new fixture.
	 *
	 * @param description source text of the expression, for messages
	 * @return the fixture
	 */
	public static ParseResultFixture expression(String description) {
		return new ParseResultFixture(description);
	}

	public String description() {
		return description;
	}

	public ParseResultFixture node(Classification classification, String value, TokenType tokenType) {
		classifications.add(classification);
		tokens.add(new Token(value, tokenType));
		return this;
	}

	public ParseResultFixture number(String value) {
		return node(Classification.LITERAL, value, TokenType.NUMBER);
	}

	public ParseResultFixture character(String value) {
		return node(Classification.LITERAL, value, TokenType.CHARACTER);
	}

	public ParseResultFixture characterList(String value) {
		return node(Classification.LITERAL, value, TokenType.CHARACTER_LIST);
	}

	public ParseResultFixture identifier(String value) {
		return node(Classification.LITERAL, value, TokenType.IDENTIFIER);
	}

	public ParseResultFixture symbol(String value) {
		return node(Classification.LITERAL, value, TokenType.SYMBOL);
	}

	public ParseResultFixture unit() {
		return node(Classification.LITERAL, "()", TokenType.UNIT_LITERAL);
	}

	public ParseResultFixture input() {
		return node(Classification.LITERAL, "$", TokenType.INPUT);
	}

	public ParseResultFixture result() {
		return node(Classification.LITERAL, "?", TokenType.RESULT);
	}

	public ParseResultFixture operator(Classification classification, String text) {
		return node(classification, text, TokenType.OPERATOR);
	}

	public ParseResultFixture decimal() {
		return operator(Classification.DECIMAL, ".");
	}

	public ParseResultFixture access() {
		return operator(Classification.ACCESS, ".");
	}

	public ParseResultFixture negation() {
		return operator(Classification.NEGATION, "-");
	}

	public ParseResultFixture absoluteValue() {
		return operator(Classification.ABSOLUTE_VALUE, "+");
	}

	public ParseResultFixture not() {
		return operator(Classification.NOT, "!");
	}

	/**
	 * Ends the current expression segment. The next node starts a new,
	 * unlinked segment with its own seed.
	 *
	 * @return this fixture
	 */
	public ParseResultFixture newSegment() {
		segmentStarts.add(tokens.size());
		return this;
	}

	/**
	 * Replaces the default seeds (the first node of each segment).
	 *
	 * @param seeds seed indexes
	 * @return this fixture
	 */
	public ParseResultFixture seeds(Integer... seeds) {
		explicitSeeds = Arrays.asList(seeds);
		return this;
	}

	/**
	 * Only link operators to their neighbours, leaving the leaves without
	 * links.
	 *
	 * @return this fixture
	 */
	public ParseResultFixture unlinkedLeaves() {
		linkLeaves = false;
		return this;
	}

	public ParseResult build() {
		List<Node> nodes = new ArrayList<>();
		for (int i = 0; i < tokens.size(); i++) {
			Classification classification = classifications.get(i);
			if (classification.isLeaf() && !linkLeaves) {
				nodes.add(new Node(classification, tokens.get(i)));
			} else {
				int left = segmentStarts.contains(i) ? Node.NONE : i - 1;
				int right = i + 1 >= tokens.size() || segmentStarts.contains(i + 1) ? Node.NONE : i + 1;
				nodes.add(new Node(classification, tokens.get(i), left, right));
			}
		}

		List<Integer> seeds = new ArrayList<>();
		if (explicitSeeds != null) {
			seeds.addAll(explicitSeeds);
		} else if (!tokens.isEmpty()) {
			for (int start : segmentStarts) {
				if (start < tokens.size()) {
					seeds.add(start);
				}
			}
		}
		return new ParseResult(nodes, seeds);
	}

	/**
	 * Builds the input and runs it through a default {@link AstBuilder}.
	 *
	 * @return the tree
	 */
	public Ast ast() {
		return new AstBuilder().build(build());
	}
}
