package org.metricshub.exprlang.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.exprlang.frontend.ast.MalformedTreeException;
import org.metricshub.exprlang.frontend.ast.MissingOperandException;
import org.metricshub.exprlang.frontend.ast.MissingOperandException.Side;
import org.metricshub.exprlang.frontend.ast.UnsupportedClassificationException;
import org.metricshub.exprlang.util.AstBuildSettings;

public class ReductionEngineTest {

	private static final ReductionEngine STRICT = new ReductionEngine(PrecedenceTable.standard(), true);
	private static final ReductionEngine LENIENT = new ReductionEngine(PrecedenceTable.standard(), false);

	private static AstBuilder lenientBuilder() {
		AstBuildSettings settings = new AstBuildSettings();
		settings.setStrictOperands(false);
		settings.setVerifyTree(false);
		return new AstBuilder(settings);
	}

	@Test
	public void testBucketsFollowTiersAndArenaOrder() {
		NodeArena arena = ParseResultFixture
				.expression("-3.14.x.y")
				.negation()
				.number("3")
				.decimal()
				.number("14")
				.access()
				.identifier("x")
				.access()
				.identifier("y")
				.build()
				.getNodes();

		List<List<Integer>> buckets = STRICT.bucket(arena);

		assertEquals(
				Arrays.asList(
						Collections.singletonList(2),
						Arrays.asList(4, 6),
						Collections.singletonList(0)),
				buckets);
	}

	@Test
	public void testBucketingSkipsLeaves() {
		NodeArena arena = ParseResultFixture
				.expression("|>skip")
				.node(Classification.ITERATION_SKIP, "|>skip", TokenType.ITERATION_SKIP)
				.build()
				.getNodes();

		for (List<Integer> bucket : STRICT.bucket(arena)) {
			assertTrue(bucket.isEmpty());
		}
	}

	@Test
	public void testUnsupportedClassification() {
		ParseResult input = ParseResultFixture
				.expression("1+2")
				.number("1")
				.operator(Classification.ADDITION, "+")
				.number("2")
				.build();

		UnsupportedClassificationException e = assertThrows(
				UnsupportedClassificationException.class,
				() -> STRICT.reduce(input.getNodes()));
		assertEquals(Classification.ADDITION, e.getClassification());
		assertEquals(1, e.getNodeIndex());
		// nothing has been touched
		assertFalse(input.getNodes().get(0).hasParent());
		assertFalse(input.getNodes().get(2).hasParent());
	}

	@Test
	public void testUnsupportedClassificationAbortsEvenInLenientMode() {
		ParseResult input = ParseResultFixture
				.expression("a == b")
				.identifier("a")
				.operator(Classification.EQUALITY, "==")
				.identifier("b")
				.build();

		assertThrows(UnsupportedClassificationException.class, () -> lenientBuilder().build(input));
	}

	@Test
	public void testMissingRightOperand() {
		ParseResult input = ParseResultFixture.expression("3.").number("3").decimal().build();

		MissingOperandException e = assertThrows(
				MissingOperandException.class,
				() -> new AstBuilder().build(input));
		assertEquals(Side.RIGHT, e.getSide());
		assertEquals(1, e.getNodeIndex());
	}

	@Test
	public void testMissingLeftOperand() {
		ParseResult input = ParseResultFixture.expression(".value").access().identifier("value").build();

		MissingOperandException e = assertThrows(
				MissingOperandException.class,
				() -> new AstBuilder().build(input));
		assertEquals(Side.LEFT, e.getSide());
		assertEquals(0, e.getNodeIndex());
	}

	@Test
	public void testLonePrefixOperator() {
		ParseResult input = ParseResultFixture.expression("!").not().build();

		MissingOperandException e = assertThrows(
				MissingOperandException.class,
				() -> new AstBuilder().build(input));
		assertEquals(Side.RIGHT, e.getSide());
	}

	@Test
	public void testMissingOperandInLenientMode() {
		Ast ast = lenientBuilder()
				.build(ParseResultFixture.expression(".value").access().identifier("value").build());

		Node access = ast.getNodes().get(0);
		assertFalse(access.hasLeft());
		assertEquals(1, access.getRight());
		assertEquals(0, ast.getNodes().get(1).getParent());
		assertEquals(0, ast.getRoot());
	}

	@Test
	public void testOperandClaimedTwice() {
		ParseResult input = ParseResultFixture
				.expression("a.-b.c")
				.identifier("a")
				.access()
				.negation()
				.identifier("b")
				.access()
				.identifier("c")
				.build();

		MalformedTreeException e = assertThrows(MalformedTreeException.class, () -> STRICT.reduce(input.getNodes()));
		assertEquals(3, e.getNodeIndex());
	}

	@Test
	public void testOperandClaimedTwiceInLenientMode() {
		ParseResult input = ParseResultFixture
				.expression("a.-b.c")
				.identifier("a")
				.access()
				.negation()
				.identifier("b")
				.access()
				.identifier("c")
				.build();

		LENIENT.reduce(input.getNodes());

		// the last operator to reduce wins
		assertEquals(2, input.getNodes().get(3).getParent());
	}

	@Test
	public void testInconsistentSequenceLinks() {
		Token a = new Token("a", TokenType.IDENTIFIER);
		NodeArena arena = new NodeArena(Arrays.asList(
				new Node(Classification.LITERAL, a, Node.NONE, 1),
				new Node(Classification.ACCESS, new Token(".", TokenType.OPERATOR), Node.NONE, 2),
				new Node(Classification.LITERAL, a, 0, Node.NONE)));

		MalformedTreeException e = assertThrows(MalformedTreeException.class, () -> STRICT.reduce(arena));
		assertEquals(2, e.getNodeIndex());
	}

	@Test
	public void testLinkOutsideOfArena() {
		NodeArena arena = new NodeArena(Collections.singletonList(
				new Node(Classification.NOT, new Token("!", TokenType.OPERATOR), Node.NONE, 7)));

		assertThrows(MalformedTreeException.class, () -> STRICT.reduce(arena));
	}

	@Test
	public void testPostfixTier() {
		PrecedenceTable table = PrecedenceTable.builder().append(Fixity.UNARY_POSTFIX, Classification.NOT).build();
		NodeArena arena = ParseResultFixture.expression("10!").number("10").not().build().getNodes();

		new ReductionEngine(table, true).reduce(arena);

		assertEquals(1, arena.get(0).getParent());
		assertFalse(arena.get(0).hasLeft());
		assertFalse(arena.get(0).hasRight());
		assertEquals(0, arena.get(1).getLeft());
		assertFalse(arena.get(1).hasRight());
		assertFalse(arena.get(1).hasParent());
	}

	@Test
	public void testAppendedTierNeedsNoEngineChange() {
		AstBuildSettings settings = new AstBuildSettings();
		settings.setPrecedenceTable(PrecedenceTable
				.standard()
				.toBuilder()
				.append(Fixity.BINARY, Classification.ADDITION, Classification.SUBTRACTION)
				.build());
		AstBuilder builder = new AstBuilder(settings);

		// (-a) + (b.c)
		Ast ast = builder.build(ParseResultFixture
				.expression("-a+b.c")
				.negation()
				.identifier("a")
				.operator(Classification.ADDITION, "+")
				.identifier("b")
				.access()
				.identifier("c")
				.build());

		assertEquals(2, ast.getRoot());
		assertEquals(0, ast.getRootNode().getLeft());
		assertEquals(4, ast.getRootNode().getRight());
		assertEquals(1, ast.getNodes().get(0).getRight());
		assertEquals(2, ast.getNodes().get(4).getParent());

		// a + (-b)
		ast = builder.build(ParseResultFixture
				.expression("a+-b")
				.identifier("a")
				.operator(Classification.ADDITION, "+")
				.negation()
				.identifier("b")
				.build());

		assertEquals(1, ast.getRoot());
		assertEquals(0, ast.getRootNode().getLeft());
		assertEquals(2, ast.getRootNode().getRight());
		assertEquals(3, ast.getNodes().get(2).getRight());
	}

	@Test
	public void testSameTierSubtractionIsLeftAssociative() {
		AstBuildSettings settings = new AstBuildSettings();
		settings.setPrecedenceTable(PrecedenceTable
				.standard()
				.toBuilder()
				.append(Fixity.BINARY, Classification.ADDITION, Classification.SUBTRACTION)
				.build());

		// (a - b) + c
		Ast ast = new AstBuilder(settings).build(ParseResultFixture
				.expression("a-b+c")
				.identifier("a")
				.operator(Classification.SUBTRACTION, "-")
				.identifier("b")
				.operator(Classification.ADDITION, "+")
				.identifier("c")
				.build());

		assertEquals(3, ast.getRoot());
		assertEquals(1, ast.getRootNode().getLeft());
		assertEquals(3, ast.getNodes().get(1).getParent());
	}
}
