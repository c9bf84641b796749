package org.lokray.fzn.model;

import java.util.Collection;

/**
 * The set of values a declaration may take. Exactly one representation applies:
 * unbounded, an inclusive integer range, an inclusive float range, or an explicit set of integers.
 */
public abstract class Domain
{
	public static Domain unbounded()
	{
		return UnboundedDomain.INSTANCE;
	}

	public static RangeDomain range(long lower, long upper)
	{
		return new RangeDomain(lower, upper);
	}

	public static FloatRangeDomain floatRange(double lower, double upper)
	{
		return new FloatRangeDomain(lower, upper);
	}

	public static SetDomain set(Collection<Long> values)
	{
		return new SetDomain(values);
	}

	public boolean isUnbounded()
	{
		return false;
	}

	/**
	 * @return True if min, max and size are defined (a range or a non-empty integer set).
	 */
	public abstract boolean hasIntegerBounds();

	/**
	 * @throws IllegalStateException if {@link #hasIntegerBounds()} is false.
	 */
	public abstract long getMin();

	/**
	 * @throws IllegalStateException if {@link #hasIntegerBounds()} is false.
	 */
	public abstract long getMax();

	/**
	 * The span {@code max - min + 1}. For sets this counts holes too, which is how domain sizes are
	 * reported in summaries.
	 *
	 * @throws IllegalStateException if {@link #hasIntegerBounds()} is false.
	 */
	public long size()
	{
		return getMax() - getMin() + 1;
	}

	public double getMean()
	{
		return (getMin() + getMax()) / 2.0;
	}

	/**
	 * @return True if the domain holds exactly one integer value.
	 */
	public boolean isSingleton()
	{
		return hasIntegerBounds() && getMin() == getMax();
	}

	protected IllegalStateException noBounds()
	{
		return new IllegalStateException("Domain " + this + " has no integer bounds.");
	}
}
