package org.lokray.fzn.model;

import org.junit.jupiter.api.Test;
import org.lokray.fzn.lexer.Token;
import org.lokray.fzn.lexer.TokenType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class SemanticModelTest
{
	private static Token name(String text)
	{
		return new Token(TokenType.IDENTIFIER, text, null, 1, 1);
	}

	@Test
	void frozenModelIsUnmodifiable()
	{
		VariableDecl x = new VariableDecl(name("x"), VariableType.INT, Domain.range(1, 3), Origin.USER, null, List.of(), false);
		SemanticModel model = SemanticModel.builder()
				.addVariable(x)
				.setSolveGoal(new SolveGoal(new Token(TokenType.SOLVE, "solve", null, 1, 1), GoalKind.SATISFY, null, List.of()))
				.build();

		assertSame(x, model.lookup("x"));
		assertNull(model.lookup("y"));
		assertTrue(model.getConstraints().isEmpty());
		assertThrows(UnsupportedOperationException.class, () -> model.getVariables().clear());
	}

	@Test
	void builderNeedsExactlyOneGoal()
	{
		SolveGoal goal = new SolveGoal(new Token(TokenType.SOLVE, "solve", null, 1, 1), GoalKind.SATISFY, null, List.of());
		assertThrows(IllegalStateException.class, () -> SemanticModel.builder().build());
		assertThrows(IllegalStateException.class, () -> SemanticModel.builder().setSolveGoal(goal).setSolveGoal(goal));
	}

	@Test
	void domainBounds()
	{
		assertEquals(10, Domain.range(1, 10).size());
		assertEquals(5.5, Domain.range(1, 10).getMean());
		assertEquals(List.of(2L, 7L), Domain.set(List.of(7L, 2L, 7L)).getValues());
		assertTrue(Domain.set(List.of(4L)).isSingleton());
		assertFalse(Domain.set(List.of()).hasIntegerBounds());
		assertFalse(Domain.floatRange(0.0, 1.0).hasIntegerBounds());
		assertTrue(Domain.unbounded().isUnbounded());
		assertThrows(IllegalStateException.class, () -> Domain.unbounded().getMin());
	}

	@Test
	void goalKindKnowsOptimisation()
	{
		assertFalse(GoalKind.SATISFY.isOptimisation());
		assertTrue(GoalKind.MAXIMIZE.isOptimisation());
		assertEquals("minimize", GoalKind.MINIMIZE.getKeyword());
	}
}
