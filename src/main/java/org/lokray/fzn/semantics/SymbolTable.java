package org.lokray.fzn.semantics;

import org.lokray.fzn.model.Declaration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps names to the declarations seen so far in a model. FlatZinc has a single flat namespace
 * shared by scalars and arrays, so there is one table per parse.
 */
public class SymbolTable
{
	private final Map<String, Declaration> symbols = new LinkedHashMap<>();
	private final String scopeName; // For debugging/identification

	public SymbolTable(String scopeName)
	{
		this.scopeName = scopeName;
	}

	/**
	 * Defines a new declaration.
	 *
	 * @param declaration The declaration to define.
	 * @throws IllegalArgumentException if a declaration with the same name already exists.
	 */
	public void define(Declaration declaration)
	{
		if (symbols.containsKey(declaration.getName()))
		{
			throw new IllegalArgumentException("Symbol '" + declaration.getName() + "' already defined in scope '" + scopeName + "'.");
		}
		symbols.put(declaration.getName(), declaration);
	}

	/**
	 * Looks up a declaration by name.
	 *
	 * @param name The name of the declaration to look up.
	 * @return The found Declaration, or null if not found.
	 */
	public Declaration resolve(String name)
	{
		return symbols.get(name);
	}

	public boolean isDefined(String name)
	{
		return symbols.containsKey(name);
	}

	public String getScopeName()
	{
		return scopeName;
	}

	public Map<String, Declaration> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Scope '").append(scopeName).append("':\n");
		for (Map.Entry<String, Declaration> entry : symbols.entrySet())
		{
			sb.append("  ").append(entry.getValue()).append("\n");
		}
		return sb.toString();
	}
}
