package org.metricshub.exprlang.frontend;

import static org.junit.Assert.*;

import java.util.EnumSet;
import org.junit.Test;
import org.metricshub.exprlang.frontend.ast.UnsupportedClassificationException;

public class PrecedenceTableTest {

	private static final PrecedenceTable STANDARD = PrecedenceTable.standard();

	@Test
	public void testStandardTiers() {
		assertEquals(3, STANDARD.size());

		assertEquals(Fixity.BINARY, STANDARD.getTier(0).getFixity());
		assertEquals(EnumSet.of(Classification.DECIMAL), STANDARD.getTier(0).getClassifications());

		assertEquals(Fixity.BINARY, STANDARD.getTier(1).getFixity());
		assertEquals(EnumSet.of(Classification.ACCESS), STANDARD.getTier(1).getClassifications());

		assertEquals(Fixity.UNARY_PREFIX, STANDARD.getTier(2).getFixity());
		assertEquals(
				EnumSet.of(Classification.NEGATION, Classification.ABSOLUTE_VALUE, Classification.NOT),
				STANDARD.getTier(2).getClassifications());
	}

	@Test
	public void testTierOf() {
		assertEquals(0, STANDARD.tierOf(Classification.DECIMAL));
		assertEquals(1, STANDARD.tierOf(Classification.ACCESS));
		assertEquals(2, STANDARD.tierOf(Classification.NEGATION));
		assertEquals(2, STANDARD.tierOf(Classification.ABSOLUTE_VALUE));
		assertEquals(2, STANDARD.tierOf(Classification.NOT));
	}

	@Test
	public void testTierOfLeaf() {
		assertThrows(IllegalArgumentException.class, () -> STANDARD.tierOf(Classification.LITERAL));
		assertThrows(IllegalArgumentException.class, () -> STANDARD.tierOf(Classification.ITERATION_OUTPUT));
	}

	@Test
	public void testTierOfUnsupported() {
		UnsupportedClassificationException e = assertThrows(
				UnsupportedClassificationException.class,
				() -> STANDARD.tierOf(Classification.MULTIPLICATION));
		assertEquals(Classification.MULTIPLICATION, e.getClassification());
		assertEquals(-1, e.getNodeIndex());
	}

	/**
	 * Operator classifications the grouping pass can emit but the standard
	 * table does not place yet. A new classification must either get a tier
	 * or be listed here.
	 */
	@Test
	public void testStandardCoverage() {
		assertEquals(
				EnumSet.of(
						Classification.ADDITION,
						Classification.SUBTRACTION,
						Classification.MULTIPLICATION,
						Classification.DIVISION,
						Classification.EQUALITY,
						Classification.PAIR),
				STANDARD.unsupportedClassifications());
	}

	@Test
	public void testInsertKeepsBindingOrder() {
		PrecedenceTable table = STANDARD
				.toBuilder()
				.insert(2, Fixity.BINARY, Classification.MULTIPLICATION, Classification.DIVISION)
				.append(Fixity.BINARY, Classification.ADDITION, Classification.SUBTRACTION)
				.build();

		assertEquals(5, table.size());
		assertEquals(1, table.tierOf(Classification.ACCESS));
		assertEquals(2, table.tierOf(Classification.DIVISION));
		assertEquals(3, table.tierOf(Classification.NOT));
		assertEquals(4, table.tierOf(Classification.ADDITION));
		assertEquals(
				EnumSet.of(Classification.EQUALITY, Classification.PAIR),
				table.unsupportedClassifications());
		// the standard table is left as is
		assertEquals(3, STANDARD.size());
	}

	@Test
	public void testInsertOutOfRange() {
		assertThrows(
				IllegalArgumentException.class,
				() -> STANDARD.toBuilder().insert(4, Fixity.BINARY, Classification.PAIR));
		assertThrows(
				IllegalArgumentException.class,
				() -> STANDARD.toBuilder().insert(-1, Fixity.BINARY, Classification.PAIR));
	}

	@Test
	public void testClassificationPlacedTwice() {
		assertThrows(
				IllegalArgumentException.class,
				() -> STANDARD.toBuilder().append(Fixity.UNARY_PREFIX, Classification.NEGATION).build());
	}

	@Test
	public void testLeafCannotBePlaced() {
		assertThrows(
				IllegalArgumentException.class,
				() -> PrecedenceTable.builder().append(Fixity.BINARY, Classification.LITERAL).build());
	}

	@Test
	public void testEmptyTier() {
		assertThrows(IllegalArgumentException.class, () -> PrecedenceTable.builder().append(Fixity.BINARY));
	}

	@Test
	public void testFixityOperands() {
		assertTrue(Fixity.BINARY.consumesLeft());
		assertTrue(Fixity.BINARY.consumesRight());
		assertFalse(Fixity.UNARY_PREFIX.consumesLeft());
		assertTrue(Fixity.UNARY_PREFIX.consumesRight());
		assertTrue(Fixity.UNARY_POSTFIX.consumesLeft());
		assertFalse(Fixity.UNARY_POSTFIX.consumesRight());
	}
}
