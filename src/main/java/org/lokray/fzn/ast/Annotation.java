package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An annotation attached with {@code ::} to a declaration, a constraint or the solve goal.
 * Shaped like a call: a name plus an optional argument list. Annotations written without
 * parentheses (e.g. {@code output_var}) have no arguments.
 */
public class Annotation
{
	private final Token name;
	private final List<Argument> arguments;

	public Annotation(Token name, List<Argument> arguments)
	{
		this.name = name;
		this.arguments = List.copyOf(arguments);
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Token getNameToken()
	{
		return name;
	}

	public List<Argument> getArguments()
	{
		return arguments;
	}

	public boolean hasArguments()
	{
		return !arguments.isEmpty();
	}

	/**
	 * Views this annotation as a call argument, so annotation trees and argument trees can be walked alike.
	 */
	public CallArgument asCall()
	{
		return new CallArgument(name, arguments);
	}

	@Override
	public String toString()
	{
		if (arguments.isEmpty())
		{
			return getName();
		}
		return arguments.stream().map(Object::toString).collect(Collectors.joining(",", getName() + "(", ")"));
	}
}
