package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;

/**
 * A quoted string argument. Only annotations carry these in practice (e.g. output names).
 */
public class StringLiteral implements Argument
{
	private final String value;
	private final Token token;

	public StringLiteral(String value, Token token)
	{
		this.value = value;
		this.token = token;
	}

	public String getValue()
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
		return visitor.visitStringLiteral(this);
	}

	@Override
	public String toString()
	{
		return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
	}
}
