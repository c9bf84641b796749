package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;

/**
 * An inclusive range literal {@code lo..hi}. Bounds are either both integers or both floats.
 */
public class RangeLiteral implements Argument
{
	private final Number lower;
	private final Number upper;
	private final Token token;

	public RangeLiteral(Number lower, Number upper, Token token)
	{
		this.lower = lower;
		this.upper = upper;
		this.token = token;
	}

	public Number getLower()
	{
		return lower;
	}

	public Number getUpper()
	{
		return upper;
	}

	public boolean isFloat()
	{
		return lower instanceof Double || upper instanceof Double;
	}

	/**
	 * Number of integers covered by this range, or 0 for an empty or float range.
	 */
	public long size()
	{
		if (isFloat())
		{
			return 0;
		}
		long span = upper.longValue() - lower.longValue() + 1;
		return Math.max(0, span);
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public <R> R accept(ArgumentVisitor<R> visitor)
	{
		return visitor.visitRangeLiteral(this);
	}

	@Override
	public String toString()
	{
		return lower + ".." + upper;
	}
}
