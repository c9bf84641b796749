package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;

public class BoolLiteral implements Argument
{
	private final boolean value;
	private final Token token;

	public BoolLiteral(boolean value, Token token)
	{
		this.value = value;
		this.token = token;
	}

	public boolean getValue()
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
		return visitor.visitBoolLiteral(this);
	}

	@Override
	public String toString()
	{
		return Boolean.toString(value);
	}
}
