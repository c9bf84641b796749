package org.lokray.fzn.model;

/**
 * No domain restriction beyond the base type.
 */
public final class UnboundedDomain extends Domain
{
	static final UnboundedDomain INSTANCE = new UnboundedDomain();

	private UnboundedDomain()
	{
	}

	@Override
	public boolean isUnbounded()
	{
		return true;
	}

	@Override
	public boolean hasIntegerBounds()
	{
		return false;
	}

	@Override
	public long getMin()
	{
		throw noBounds();
	}

	@Override
	public long getMax()
	{
		throw noBounds();
	}

	@Override
	public String toString()
	{
		return "unbounded";
	}
}
