package org.lokray.fzn.summary;

import org.junit.jupiter.api.Test;
import org.lokray.fzn.util.SummaryConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ModelSummarizerTest
{
	@Test
	void summarisesAllSections()
	{
		String summary = new ModelSummarizer(new SummaryConfig(), ConstraintCatalog.empty())
				.summarize(SummaryFixtures.parse("var 1..10: x; var bool: b; constraint int_le(x, 5); solve minimize x;"), false);

		assertEquals("Problem:\n"
				+ "  This is a minimization problem. The objective is to minimize an objective variable with domain [1, 10]"
				+ " (size 10, mean 5.50) and degree 1. The objective function is in the form: minimize a."
				+ " No explicit search strategy is specified.\n"
				+ "\n"
				+ "Variables:\n"
				+ "The model contains 2 variables (1 integer, 1 Boolean): 0 compiler-introduced and 2 user-introduced.\n"
				+ "Among 1 integer variables with known finite domains, 100.0% have domain size in [10, 10] (avg size 10.00).\n"
				+ "\n"
				+ "Constraints:\n"
				+ "  int_le: 1 constraint with average arity 1.00"
				+ " (ordering constraints enforce that one integer variable is less than or equal to another)", summary);
	}

	@Test
	void searchSentenceFollowsTheProblem()
	{
		String summary = new ModelSummarizer(new SummaryConfig(), ConstraintCatalog.empty())
				.summarize(SummaryFixtures.parse("var int: x; var int: y;"
						+ " solve :: int_search([x, y], input_order, indomain_min, complete) satisfy;"), true);

		assertTrue(summary.startsWith("Problem:\n  This is a satisfaction problem. Where the model suggests an integer search on 2 variables,"));
		assertTrue(summary.endsWith("Constraints:\nThe model contains no constraints."));
	}

	@Test
	void joinsProblemAndSearch()
	{
		assertEquals("This is a satisfaction problem. Where the model suggests x.",
				ModelSummarizer.joinProblemAndSearch("This is a satisfaction problem.", "The model suggests x."));
		assertEquals("P. No explicit search strategy is specified.",
				ModelSummarizer.joinProblemAndSearch("P", SearchDescriber.NO_STRATEGY));
		assertEquals("P.", ModelSummarizer.joinProblemAndSearch("P.", ""));
	}
}
