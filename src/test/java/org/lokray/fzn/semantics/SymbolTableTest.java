package org.lokray.fzn.semantics;

import org.junit.jupiter.api.Test;
import org.lokray.fzn.lexer.Token;
import org.lokray.fzn.lexer.TokenType;
import org.lokray.fzn.model.Domain;
import org.lokray.fzn.model.Origin;
import org.lokray.fzn.model.VariableDecl;
import org.lokray.fzn.model.VariableType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class SymbolTableTest
{
	static VariableDecl variable(String name)
	{
		Token token = new Token(TokenType.IDENTIFIER, name, null, 1, 1);
		return new VariableDecl(token, VariableType.INT, Domain.range(0, 9), Origin.USER, null, List.of(), false);
	}

	@Test
	void resolvesDefinedNames()
	{
		SymbolTable table = new SymbolTable("model");
		VariableDecl x = variable("x");
		table.define(x);

		assertSame(x, table.resolve("x"));
		assertTrue(table.isDefined("x"));
		assertFalse(table.isDefined("y"));
		assertNull(table.resolve("y"));
		assertEquals(1, table.getSymbols().size());
	}

	@Test
	void rejectsSecondDefinitionOfAName()
	{
		SymbolTable table = new SymbolTable("model");
		table.define(variable("x"));
		assertThrows(IllegalArgumentException.class, () -> table.define(variable("x")));
	}

	@Test
	void lookupIsCaseSensitive()
	{
		SymbolTable table = new SymbolTable("model");
		table.define(variable("Cost"));
		assertNull(table.resolve("cost"));
	}
}
