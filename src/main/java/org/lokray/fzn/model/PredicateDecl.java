package org.lokray.fzn.model;

import org.lokray.fzn.lexer.Token;

/**
 * A {@code predicate} item declaring a solver-specific constraint. Only the name and the raw
 * parameter text are kept.
 */
public class PredicateDecl
{
	private final Token name;
	private final String parameters;

	public PredicateDecl(Token name, String parameters)
	{
		this.name = name;
		this.parameters = parameters;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Token getNameToken()
	{
		return name;
	}

	/**
	 * @return The parameter list as written, without the surrounding parentheses.
	 */
	public String getParameters()
	{
		return parameters;
	}

	@Override
	public String toString()
	{
		return "predicate " + getName() + "(" + parameters + ")";
	}
}
