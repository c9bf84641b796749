package org.lokray.fzn.summary;

import org.junit.jupiter.api.Test;
import org.lokray.fzn.analysis.ObjectiveReconstruction;
import org.lokray.fzn.analysis.ObjectiveReconstructor;
import org.lokray.fzn.model.SemanticModel;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ExpressionFormatterTest
{
	private static final String NESTED = "var int: p; var int: q; var int: d; var int: t; var int: obj;"
			+ " constraint int_plus(p, q, t) :: defines_var(t);"
			+ " constraint int_max(t, d, obj) :: defines_var(obj);"
			+ " solve minimize obj;";

	private static String format(String source, int displayDepth, int maxLength)
	{
		SemanticModel model = SummaryFixtures.parse(source);
		ObjectiveReconstruction objective = new ObjectiveReconstructor().reconstruct(model);
		return new ExpressionFormatter(model, displayDepth, maxLength).format(objective.getObjectiveName(), objective.getExpression().orElseThrow());
	}

	private static String format(String source)
	{
		return format(source, 2, 100);
	}

	@Test
	void rendersArithmeticInfix()
	{
		assertEquals("(b + c)", format("var 0..10: p; var 0..10: q; var int: obj;"
				+ " constraint int_plus(p, q, obj) :: defines_var(obj); solve minimize obj;"));
	}

	@Test
	void rendersNestedCallsUpToTheDisplayDepth()
	{
		assertEquals("max((b + c), d)", format(NESTED));
	}

	@Test
	void cutsCallsBelowTheDisplayDepthToTheirVariable()
	{
		assertEquals("max(b, c)", format(NESTED, 1, 100));
	}

	@Test
	void showsFixedVariablesAsValues()
	{
		assertEquals("(5 * b)", format("var 5..5: k; var int: p; var int: obj;"
				+ " constraint int_times(k, p, obj) :: defines_var(obj); solve maximize obj;"));
	}

	@Test
	void solvesLinearEqualityForTheDefinedVariable()
	{
		assertEquals("b + c", format("var int: z; var int: w; var int: obj;"
				+ " constraint int_lin_eq([-1, 1, 1], [obj, z, w], 0) :: defines_var(obj); solve minimize obj;"));
	}

	@Test
	void rendersElementAccess()
	{
		assertEquals("[3, 5, 7][b]", format("var 1..3: i; var int: obj;"
				+ " constraint array_int_element(i, [3, 5, 7], obj) :: defines_var(obj); solve minimize obj;"));
	}

	@Test
	void unknownPredicateKeepsCallFormWithDefinedVariable()
	{
		assertEquals("my_fn(b, a, c)", format("var int: p; var int: q; var int: obj;"
				+ " constraint my_fn(p, obj, q) :: defines_var(obj); solve minimize obj;"));
	}

	@Test
	void truncatesLongOutput()
	{
		assertEquals("(b +…", format("var int: p; var int: q; var int: obj;"
				+ " constraint int_plus(p, q, obj) :: defines_var(obj); solve minimize obj;", 2, 5));
	}

	@Test
	void deepSharedOperandsStayWithinTheLengthCap()
	{
		StringBuilder source = new StringBuilder();
		for (int i = 0; i <= 30; i++)
		{
			source.append("var int: v").append(i).append("; ");
		}
		for (int i = 0; i < 30; i++)
		{
			source.append("constraint int_plus(v").append(i + 1).append(", v").append(i + 1).append(", v").append(i)
					.append(") :: defines_var(v").append(i).append("); ");
		}
		source.append("solve minimize v0;");

		String text = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> format(source.toString(), 30, 100));

		assertEquals(100, text.length());
		assertTrue(text.startsWith("(((((((((((((((((((((((((((((("));
		assertTrue(text.contains("(b + b)"));
		assertTrue(text.endsWith("…"));
	}

	@Test
	void placeholdersContinuePastZ()
	{
		assertEquals("a", ExpressionFormatter.placeholder(0));
		assertEquals("z", ExpressionFormatter.placeholder(25));
		assertEquals("aa", ExpressionFormatter.placeholder(26));
		assertEquals("ab", ExpressionFormatter.placeholder(27));
	}
}
