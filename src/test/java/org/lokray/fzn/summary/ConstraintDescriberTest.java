package org.lokray.fzn.summary;

import org.junit.jupiter.api.Test;
import org.lokray.fzn.model.SemanticModel;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

final class ConstraintDescriberTest
{
	private static final String MODEL = "var 0..5: x; var 0..5: y; var bool: b;"
			+ " constraint int_le(x, y); constraint int_le(x, 3); constraint bool_clause([b], []);"
			+ " solve satisfy;";

	@Test
	void listsPredicatesAlphabetically()
	{
		ConstraintDescriber describer = new ConstraintDescriber(SummaryFixtures.parse(MODEL), ConstraintCatalog.empty());

		assertEquals("  bool_clause: 1 constraint with average arity 1.00 (boolean clause constraints represent disjunctions over Boolean literals)\n"
						+ "  int_le: 2 constraints with average arity 1.50 (ordering constraints enforce that one integer variable is less than or equal to another)",
				describer.describe(false));
		assertEquals(Map.of("bool_clause", 1, "int_le", 2), describer.getCounts());
	}

	@Test
	void groupsByCategoryWithUncategorizedLast()
	{
		ConstraintCatalog catalog = new ConstraintCatalog(Map.of(), Map.of("int_le", List.of("Comparison")), Map.of("int_le", "Ordering."));
		ConstraintDescriber describer = new ConstraintDescriber(SummaryFixtures.parse(MODEL), catalog);

		assertEquals("Comparison: 1 type, 2 constraints (avg arity 1.50)\n"
						+ "  int_le: 2 constraints with average arity 1.50 (ordering)\n"
						+ "\n"
						+ "Uncategorized: 1 type, 1 constraint (avg arity 1.00)\n"
						+ "  bool_clause: 1 constraint with average arity 1.00 (boolean clause constraints represent disjunctions over Boolean literals)",
				describer.describe(true));
	}

	@Test
	void arityCountsDistinctDecisionVariables()
	{
		SemanticModel model = SummaryFixtures.parse("var 0..5: x; var 0..5: y; array [1..2] of var int: xs = [x, y]; int: k = 2;"
				+ " array [1..4] of var 0..3: zs;"
				+ " constraint int_lin_le([1, 1], xs, k);"
				+ " constraint fzn_all_different_int(zs);"
				+ " constraint int_plus(x, x, y);"
				+ " solve satisfy;");
		ConstraintDescriber describer = new ConstraintDescriber(model, ConstraintCatalog.empty());

		assertEquals(2, describer.arity(model.getConstraints().get(0)));
		assertEquals(4, describer.arity(model.getConstraints().get(1)));
		assertEquals(2, describer.arity(model.getConstraints().get(2)));
		assertEquals(4.0, describer.averageArity("fzn_all_different_int"));
		assertEquals(0.0, describer.averageArity("absent"));
	}

	@Test
	void arityOfHugeUninitialisedArrayIsNotTruncated()
	{
		SemanticModel model = SummaryFixtures.parse("array [1..3000000000] of var int: a;"
				+ " constraint fzn_all_different_int(a); solve satisfy;");
		ConstraintDescriber describer = new ConstraintDescriber(model, ConstraintCatalog.empty());

		assertEquals(3000000000L, describer.arity(model.getConstraints().get(0)));
		assertEquals(3.0e9, describer.averageArity("fzn_all_different_int"));
	}

	@Test
	void emptyModel()
	{
		assertEquals("The model contains no constraints.",
				new ConstraintDescriber(SummaryFixtures.parse("solve satisfy;"), ConstraintCatalog.empty()).describe(true));
	}

	@Test
	void descriptionsReadInsideParentheses()
	{
		assertEquals("links a to b", ConstraintDescriber.parenthetical(" Links a to b. "));
		assertEquals("x_y", ConstraintDescriber.parenthetical("x_y"));
	}
}
