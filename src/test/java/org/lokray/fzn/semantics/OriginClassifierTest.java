package org.lokray.fzn.semantics;

import org.junit.jupiter.api.Test;
import org.lokray.fzn.ast.Annotation;
import org.lokray.fzn.lexer.Token;
import org.lokray.fzn.lexer.TokenType;
import org.lokray.fzn.model.Origin;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

final class OriginClassifierTest
{
	private static Annotation annotation(String name)
	{
		return new Annotation(new Token(TokenType.IDENTIFIER, name, null, 1, 1), List.of());
	}

	@Test
	void prefixMarksCompilerVariables()
	{
		OriginClassifier classifier = new OriginClassifier("X_INTRODUCED_");
		assertEquals(Origin.INTRODUCED, classifier.classify("X_INTRODUCED_12_", List.of()));
		assertEquals(Origin.USER, classifier.classify("x_introduced_12_", List.of()));
		assertEquals(Origin.USER, classifier.classify("total", List.of(annotation("output_var"))));
	}

	@Test
	void annotationMarksCompilerVariables()
	{
		OriginClassifier classifier = new OriginClassifier("X_INTRODUCED_");
		assertEquals(Origin.INTRODUCED, classifier.classify("tmp", List.of(annotation(OriginClassifier.INTRODUCED_ANNOTATION))));
	}

	@Test
	void emptyPrefixMatchesNothing()
	{
		assertEquals(Origin.USER, new OriginClassifier("").classify("anything", List.of()));
	}
}
