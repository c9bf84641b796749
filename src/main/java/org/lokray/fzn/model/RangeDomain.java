package org.lokray.fzn.model;

import java.util.Objects;

/**
 * An inclusive integer range. Reversed bounds are swapped.
 */
public final class RangeDomain extends Domain
{
	private final long lower;
	private final long upper;

	RangeDomain(long lower, long upper)
	{
		this.lower = Math.min(lower, upper);
		this.upper = Math.max(lower, upper);
	}

	@Override
	public boolean hasIntegerBounds()
	{
		return true;
	}

	@Override
	public long getMin()
	{
		return lower;
	}

	@Override
	public long getMax()
	{
		return upper;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof RangeDomain other))
			return false;
		return lower == other.lower && upper == other.upper;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(lower, upper);
	}

	@Override
	public String toString()
	{
		return lower + ".." + upper;
	}
}
