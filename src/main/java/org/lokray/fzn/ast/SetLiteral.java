package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An explicit set literal such as {@code {1, 3, 5}}.
 */
public class SetLiteral implements Argument
{
	private final List<Argument> elements;
	private final Token leftBrace;

	public SetLiteral(List<Argument> elements, Token leftBrace)
	{
		this.elements = List.copyOf(elements);
		this.leftBrace = leftBrace;
	}

	public List<Argument> getElements()
	{
		return elements;
	}

	@Override
	public Token getFirstToken()
	{
		return leftBrace;
	}

	@Override
	public <R> R accept(ArgumentVisitor<R> visitor)
	{
		return visitor.visitSetLiteral(this);
	}

	@Override
	public String toString()
	{
		return elements.stream().map(Object::toString).collect(Collectors.joining(",", "{", "}"));
	}
}
