package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A call-shaped argument {@code name(args)}. Appears as a nested annotation
 * (e.g. {@code int_search(...)} inside {@code seq_search([...])}) or as an inline objective expression.
 * The call is recorded, never evaluated.
 */
public class CallArgument implements Argument
{
	private final Token name;
	private final List<Argument> arguments;

	public CallArgument(Token name, List<Argument> arguments)
	{
		this.name = name;
		this.arguments = List.copyOf(arguments);
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public List<Argument> getArguments()
	{
		return arguments;
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public <R> R accept(ArgumentVisitor<R> visitor)
	{
		return visitor.visitCall(this);
	}

	@Override
	public String toString()
	{
		return arguments.stream().map(Object::toString).collect(Collectors.joining(",", getName() + "(", ")"));
	}
}
