package org.lokray.fzn.semantics;

import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.lexer.Token;
import org.lokray.fzn.lexer.TokenType;
import org.lokray.fzn.model.Declaration;
import org.lokray.fzn.util.Debug;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Turns identifiers found in arguments into {@link Reference}s. Only declarations already entered
 * in the symbol table are visible, which is how "declare before use" is enforced. A name that is
 * not visible yields an unresolved reference instead of an error.
 */
public class ReferenceResolver
{
	private final SymbolTable symbolTable;
	private final Set<String> unresolvedNames = new LinkedHashSet<>();

	public ReferenceResolver(SymbolTable symbolTable)
	{
		this.symbolTable = symbolTable;
	}

	/**
	 * Resolves an identifier token against the declarations seen so far.
	 *
	 * @param identifier An IDENTIFIER token.
	 * @return A resolved reference, or an unresolved one if no declaration with that name exists yet.
	 */
	public Reference resolve(Token identifier)
	{
		if (identifier.getType() != TokenType.IDENTIFIER)
		{
			throw new IllegalArgumentException("Only identifiers can be resolved, got " + identifier);
		}

		Declaration declaration = symbolTable.resolve(identifier.getLexeme());
		if (declaration == null)
		{
			if (unresolvedNames.add(identifier.getLexeme()))
			{
				Debug.log("Unresolved name '%s' at line %d", identifier.getLexeme(), identifier.getLine());
			}
			return Reference.unresolved(identifier);
		}
		return new Reference(identifier, declaration);
	}

	/**
	 * Distinct names that could not be resolved, in the order they were first met.
	 */
	public Set<String> getUnresolvedNames()
	{
		return Collections.unmodifiableSet(unresolvedNames);
	}
}
