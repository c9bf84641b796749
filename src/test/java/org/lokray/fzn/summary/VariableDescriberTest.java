package org.lokray.fzn.summary;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

final class VariableDescriberTest
{
	private static String describe(String source)
	{
		return new VariableDescriber(SummaryFixtures.parse(source)).describe();
	}

	@Test
	void countsByTypeAndOrigin()
	{
		assertEquals("The model contains 4 variables (3 integer, 1 Boolean): 1 compiler-introduced and 3 user-introduced.\n"
						+ "Among 2 integer variables with known finite domains, 50.0% have domain size in [4, 4] (avg size 4.00);"
						+ " 50.0% have domain size in [9, 10] (avg size 10.00).\n"
						+ "1 integer variables have unknown domains.",
				describe("var 1..10: x; var 1..4: y; var bool: b; var int: X_INTRODUCED_0_; int: n = 3; solve satisfy;"));
	}

	@Test
	void elementsOfUserArraysCountAsUserVariables()
	{
		assertEquals("The model contains 2 variables (2 integer, 0 Boolean): 0 compiler-introduced and 2 user-introduced.\n"
						+ "Among 2 integer variables with known finite domains, 100.0% have domain size in [6, 6] (avg size 6.00).",
				describe("var 0..5: X_INTRODUCED_1_; var 0..5: X_INTRODUCED_2_;"
						+ " array [1..2] of var int: xs = [X_INTRODUCED_1_, X_INTRODUCED_2_]; solve satisfy;"));
	}

	@Test
	void mentionsFloatAndSetVariablesOnlyWhenPresent()
	{
		assertEquals("The model contains 2 variables (0 integer, 0 Boolean, 1 float, 1 set): 0 compiler-introduced and 2 user-introduced.",
				describe("var 0.0..1.0: f; var set of 1..3: s; solve satisfy;"));
	}

	@Test
	void countsUninitialisedArraysBeyondIntRange()
	{
		assertEquals("The model contains 3000000000 variables (3000000000 integer, 0 Boolean): 0 compiler-introduced and 3000000000 user-introduced.\n"
						+ "3000000000 integer variables have unknown domains.",
				describe("array [1..3000000000] of var int: a; solve satisfy;"));
	}

	@Test
	void emptyModel()
	{
		assertEquals("The model contains no variables.", describe("int: n = 1; solve satisfy;"));
	}

	@Test
	void singleDomainSizeFallsInOneBucket()
	{
		assertEquals("Among 1 integer variables with known finite domains, 100.0% have domain size in [5, 5] (avg size 5.00).",
				VariableDescriber.domainStatistics(List.of(5L)));
	}
}
