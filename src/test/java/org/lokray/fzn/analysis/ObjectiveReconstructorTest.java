package org.lokray.fzn.analysis;

import org.junit.jupiter.api.Test;
import org.lokray.fzn.lexer.Lexer;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.parser.FlatZincParser;
import org.lokray.fzn.util.ErrorReporter;
import org.lokray.fzn.util.SummaryConfig;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ObjectiveReconstructorTest
{
	private static final String CHAIN = "var int: c; var int: b; var int: a; var int: obj;"
			+ " constraint int_plus(a, 1, obj) :: defines_var(obj);"
			+ " constraint int_plus(b, 1, a) :: defines_var(a);"
			+ " constraint int_plus(c, 1, b) :: defines_var(b);"
			+ " solve minimize obj;";

	private static final String SHARED = "var int: f; var int: e; var int: c; var int: a; var int: obj;"
			+ " constraint int_plus(c, a, obj) :: defines_var(obj);"
			+ " constraint int_abs(e, c) :: defines_var(c);"
			+ " constraint int_abs(f, e) :: defines_var(e);"
			+ " constraint int_abs(c, a) :: defines_var(a);"
			+ " solve minimize obj;";

	/**
	 * v0 = v1 + v1, v1 = v2 + v2, ... so every level uses the one below twice.
	 */
	private static String doublingChain(int levels)
	{
		StringBuilder source = new StringBuilder();
		for (int i = 0; i <= levels; i++)
		{
			source.append("var int: v").append(i).append("; ");
		}
		for (int i = 0; i < levels; i++)
		{
			source.append("constraint int_plus(v").append(i + 1).append(", v").append(i + 1).append(", v").append(i)
					.append(") :: defines_var(v").append(i).append("); ");
		}
		return source.append("solve minimize v0;").toString();
	}

	static SemanticModel parse(String source)
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.setEcho(false);
		return new FlatZincParser(new Lexer(source).scanTokens(), reporter).parse();
	}

	private static ObjectiveReconstruction reconstruct(String source)
	{
		return new ObjectiveReconstructor().reconstruct(parse(source));
	}

	@Test
	void followsDefinesVarFromTheObjective()
	{
		ObjectiveReconstruction result = reconstruct("var int: obj; constraint int_plus(x, y, obj) :: defines_var(obj); solve maximize obj;");

		assertTrue(result.isKnown());
		CallNode root = (CallNode) result.getExpression().orElseThrow();
		assertEquals("int_plus(x, y)", root.toString());
		assertEquals("obj", root.getDefinedVariable());
		assertEquals(2, root.getDefinedPosition());
		assertEquals("obj = int_plus(x, y)", result.toString());
	}

	@Test
	void objectiveWithoutDefinitionIsUnknown()
	{
		ObjectiveReconstruction result = reconstruct("var 1..10: x; var bool: b; constraint int_le(x, 5); solve minimize x;");

		assertFalse(result.isKnown());
		assertEquals(ObjectiveReconstruction.Reason.NO_DEFINITION, result.getReason());
		assertEquals("x", result.getObjectiveName());
		assertEquals("Unknown (NO_DEFINITION)", result.toString());
	}

	@Test
	void satisfactionHasNoObjective()
	{
		assertEquals(ObjectiveReconstruction.Reason.NOT_AN_OPTIMISATION, reconstruct("solve satisfy;").getReason());
	}

	@Test
	void literalObjectiveIsNotAVariable()
	{
		assertEquals(ObjectiveReconstruction.Reason.NOT_A_VARIABLE, reconstruct("solve minimize 3;").getReason());
	}

	@Test
	void undeclaredObjectiveIsUnresolved()
	{
		assertEquals(ObjectiveReconstruction.Reason.UNRESOLVED_OBJECTIVE, reconstruct("solve minimize ghost;").getReason());
	}

	@Test
	void expandsOperandsThatAreDefinedInTurn()
	{
		ObjectiveReconstruction result = reconstruct("var int: p; var int: q; var int: d; var int: t; var int: obj;"
				+ " constraint int_plus(p, q, t) :: defines_var(t);"
				+ " constraint int_max(t, d, obj) :: defines_var(obj);"
				+ " solve minimize obj;");

		CallNode root = (CallNode) result.getExpression().orElseThrow();
		assertEquals("int_max(int_plus(p, q), d)", root.toString());
		assertInstanceOf(CallNode.class, root.getOperands().get(0));
		LeafNode d = (LeafNode) root.getOperands().get(1);
		assertEquals("d", d.getReferenceName());
	}

	@Test
	void definedVariableInsideAnArrayStaysALeaf()
	{
		ObjectiveReconstruction result = reconstruct("var int: z; var int: obj;"
				+ " constraint int_lin_eq([1, -1], [obj, z], 0) :: defines_var(obj);"
				+ " solve minimize obj;");

		CallNode root = (CallNode) result.getExpression().orElseThrow();
		assertEquals(-1, root.getDefinedPosition());
		assertEquals(3, root.getOperands().size());
		ArrayNode terms = (ArrayNode) root.getOperands().get(1);
		assertEquals("obj", ((LeafNode) terms.getElements().get(0)).getReferenceName());
	}

	@Test
	void detectsCycles()
	{
		ObjectiveReconstruction result = reconstruct("var int: a; var int: b;"
				+ " constraint int_plus(b, 1, a) :: defines_var(a);"
				+ " constraint int_plus(a, 1, b) :: defines_var(b);"
				+ " solve minimize a;");

		assertFalse(result.isKnown());
		assertEquals(ObjectiveReconstruction.Reason.CYCLE, result.getReason());
	}

	@Test
	void followsLongChainsWithinTheBound()
	{
		ObjectiveReconstruction result = reconstruct(CHAIN);
		assertEquals("int_plus(int_plus(int_plus(c, 1), 1), 1)", result.getExpression().orElseThrow().toString());
	}

	@Test
	void stopsAtTheConfiguredDepth()
	{
		Properties props = new Properties();
		props.setProperty("objective.max_depth", "2");
		ObjectiveReconstruction result = new ObjectiveReconstructor(new SummaryConfig(props)).reconstruct(parse(CHAIN));

		assertEquals(ObjectiveReconstruction.Reason.TOO_DEEP, result.getReason());
	}

	@Test
	void firstDefiningConstraintWins()
	{
		ObjectiveReconstruction result = reconstruct("var int: a; var int: obj;"
				+ " constraint int_abs(a, obj) :: defines_var(obj);"
				+ " constraint int_plus(a, a, obj) :: defines_var(obj);"
				+ " solve minimize obj;");
		assertEquals("int_abs(a)", result.getExpression().orElseThrow().toString());
	}

	@Test
	void sharedOperandsAreExpandedOnce()
	{
		SemanticModel model = parse(doublingChain(30));
		ObjectiveReconstruction result = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> new ObjectiveReconstructor().reconstruct(model));

		assertTrue(result.isKnown());
		CallNode root = (CallNode) result.getExpression().orElseThrow();
		assertSame(root.getOperands().get(0), root.getOperands().get(1));
		assertEquals("v1", ((CallNode) root.getOperands().get(0)).getDefinedVariable());
		assertTrue(root.toString().startsWith("int_plus(int_plus(int_plus("));
		assertTrue(root.toString().endsWith("…"));
		assertTrue(root.toString().length() <= ExpressionText.LIMIT + 1);
	}

	@Test
	void sharedOperandStillCountsTowardsTheDepthWhereItIsReused()
	{
		Properties props = new Properties();
		props.setProperty("objective.max_depth", "3");
		ObjectiveReconstruction tooDeep = new ObjectiveReconstructor(new SummaryConfig(props)).reconstruct(parse(SHARED));
		assertEquals(ObjectiveReconstruction.Reason.TOO_DEEP, tooDeep.getReason());

		props.setProperty("objective.max_depth", "4");
		ObjectiveReconstruction result = new ObjectiveReconstructor(new SummaryConfig(props)).reconstruct(parse(SHARED));
		assertEquals("int_plus(int_abs(int_abs(f)), int_abs(int_abs(int_abs(f))))", result.getExpression().orElseThrow().toString());
	}
}
