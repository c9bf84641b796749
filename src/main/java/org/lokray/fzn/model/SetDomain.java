package org.lokray.fzn.model;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * An explicit set of integer values, e.g. {@code {1,3,5}}. Stored sorted and without duplicates.
 */
public final class SetDomain extends Domain
{
	private final List<Long> values;

	SetDomain(Collection<Long> values)
	{
		this.values = List.copyOf(new TreeSet<>(values));
	}

	public List<Long> getValues()
	{
		return values;
	}

	public boolean isEmpty()
	{
		return values.isEmpty();
	}

	@Override
	public boolean hasIntegerBounds()
	{
		return !values.isEmpty();
	}

	@Override
	public long getMin()
	{
		if (values.isEmpty())
		{
			throw noBounds();
		}
		return values.get(0);
	}

	@Override
	public long getMax()
	{
		if (values.isEmpty())
		{
			throw noBounds();
		}
		return values.get(values.size() - 1);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof SetDomain other))
			return false;
		return values.equals(other.values);
	}

	@Override
	public int hashCode()
	{
		return values.hashCode();
	}

	@Override
	public String toString()
	{
		return values.stream().map(String::valueOf).collect(Collectors.joining(",", "{", "}"));
	}
}
