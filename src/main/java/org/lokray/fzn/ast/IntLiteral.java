package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;

/**
 * An integer literal argument, e.g. {@code -3}.
 */
public class IntLiteral implements Argument
{
	private final long value;
	private final Token token;

	public IntLiteral(long value, Token token)
	{
		this.value = value;
		this.token = token;
	}

	public long getValue()
	{
		return value;
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public <R> R accept(ArgumentVisitor<R> visitor)
	{
		return visitor.visitIntLiteral(this);
	}

	@Override
	public String toString()
	{
		return Long.toString(value);
	}
}
