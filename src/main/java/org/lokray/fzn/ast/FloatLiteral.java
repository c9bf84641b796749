package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;

/**
 * A float literal argument, e.g. {@code 0.5} or {@code 1e-3}.
 */
public class FloatLiteral implements Argument
{
	private final double value;
	private final Token token;

	public FloatLiteral(double value, Token token)
	{
		this.value = value;
		this.token = token;
	}

	public double getValue()
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
		return visitor.visitFloatLiteral(this);
	}

	@Override
	public String toString()
	{
		return Double.toString(value);
	}
}
