package org.lokray.fzn.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class SearchAnnotationExtractorTest
{
	private static Optional<SearchStrategy> extract(String source)
	{
		return new SearchAnnotationExtractor().extract(ObjectiveReconstructorTest.parse(source).getSolveGoal());
	}

	@Test
	void readsIntSearch()
	{
		SearchStrategy strategy = extract("var int: x; var int: y;"
				+ " solve :: int_search([x, y], input_order, indomain_min, complete) satisfy;").orElseThrow();

		assertEquals(SearchStrategy.Kind.INT_SEARCH, strategy.getKind());
		assertEquals(List.of("x", "y"), strategy.getScope());
		assertEquals("input_order", strategy.getVarChoice());
		assertEquals("indomain_min", strategy.getValChoice());
		assertEquals("complete", strategy.getExploration());
		assertTrue(strategy.getNested().isEmpty());
		assertFalse(strategy.isSequential());
		assertTrue(strategy.getPrecision().isEmpty());
	}

	@Test
	void scopeMayBeANamedArray()
	{
		SearchStrategy strategy = extract("array [1..3] of var bool: flags;"
				+ " solve :: bool_search(flags, first_fail, indomain_max, complete) satisfy;").orElseThrow();

		assertEquals(SearchStrategy.Kind.BOOL_SEARCH, strategy.getKind());
		assertEquals(List.of("flags"), strategy.getScope());
	}

	@Test
	void readsNestedSequence()
	{
		SearchStrategy strategy = extract("var int: x; var bool: b;"
				+ " solve :: seq_search([int_search([x], first_fail, indomain_split, complete),"
				+ " bool_search([b], input_order, indomain_max, complete)]) satisfy;").orElseThrow();

		assertTrue(strategy.isSequential());
		assertEquals(2, strategy.getNested().size());
		assertEquals(SearchStrategy.Kind.INT_SEARCH, strategy.getNested().get(0).getKind());
		assertEquals("indomain_split", strategy.getNested().get(0).getValChoice());
		assertEquals(SearchStrategy.Kind.BOOL_SEARCH, strategy.getNested().get(1).getKind());
	}

	@Test
	void severalTopLevelSearchesFormASequence()
	{
		SearchStrategy strategy = extract("var int: x; var int: y;"
				+ " solve :: int_search([x], input_order, indomain_min, complete)"
				+ " :: int_search([y], input_order, indomain_max, complete) minimize x;").orElseThrow();

		assertTrue(strategy.isSequential());
		assertEquals(List.of("x"), strategy.getNested().get(0).getScope());
		assertEquals(List.of("y"), strategy.getNested().get(1).getScope());
	}

	@Test
	void readsFloatSearchPrecision()
	{
		SearchStrategy strategy = extract("var 0.0..1.0: f;"
				+ " solve :: float_search([f], 0.001, input_order, indomain_split, complete) satisfy;").orElseThrow();

		assertEquals(SearchStrategy.Kind.FLOAT_SEARCH, strategy.getKind());
		assertEquals(0.001, strategy.getPrecision().orElseThrow());
	}

	@Test
	void ignoresMalformedAndForeignAnnotations()
	{
		assertTrue(extract("var int: x; solve :: int_search([x], input_order) satisfy;").isEmpty());
		assertTrue(extract("var int: x; solve :: int_search(3, input_order, indomain_min, complete) satisfy;").isEmpty());
		assertTrue(extract("solve :: restart_luby(100) satisfy;").isEmpty());
		assertTrue(extract("solve satisfy;").isEmpty());
	}

	@Test
	void keepsWellFormedSearchNextToMalformedOne()
	{
		SearchStrategy strategy = extract("var int: x;"
				+ " solve :: int_search([x]) :: int_search([x], smallest, indomain_min, complete) satisfy;").orElseThrow();

		assertFalse(strategy.isSequential());
		assertEquals("smallest", strategy.getVarChoice());
	}
}
