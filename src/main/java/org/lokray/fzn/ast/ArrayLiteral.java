package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An inline array literal {@code [a, b, ...]}. Elements are arguments themselves, so array
 * literals nest to any depth.
 */
public class ArrayLiteral implements Argument
{
	private final List<Argument> elements;
	private final Token leftBracket;

	public ArrayLiteral(List<Argument> elements, Token leftBracket)
	{
		this.elements = List.copyOf(elements);
		this.leftBracket = leftBracket;
	}

	public List<Argument> getElements()
	{
		return elements;
	}

	public int size()
	{
		return elements.size();
	}

	@Override
	public Token getFirstToken()
	{
		return leftBracket;
	}

	@Override
	public <R> R accept(ArgumentVisitor<R> visitor)
	{
		return visitor.visitArrayLiteral(this);
	}

	@Override
	public String toString()
	{
		return elements.stream().map(Object::toString).collect(Collectors.joining(",", "[", "]"));
	}
}
