package org.lokray.fzn.model;

import java.util.Objects;

/**
 * An inclusive float range such as {@code 0.0..1.0}. Has no integer bounds.
 */
public final class FloatRangeDomain extends Domain
{
	private final double lower;
	private final double upper;

	FloatRangeDomain(double lower, double upper)
	{
		this.lower = Math.min(lower, upper);
		this.upper = Math.max(lower, upper);
	}

	public double getLower()
	{
		return lower;
	}

	public double getUpper()
	{
		return upper;
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
	public double getMean()
	{
		return (lower + upper) / 2.0;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof FloatRangeDomain other))
			return false;
		return Double.compare(lower, other.lower) == 0 && Double.compare(upper, other.upper) == 0;
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
