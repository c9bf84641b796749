package org.lokray.fzn.summary;

import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.model.ArrayDecl;
import org.lokray.fzn.model.Origin;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.model.VariableDecl;
import org.lokray.fzn.model.VariableType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Describes the decision variables: totals by type and origin, and how integer domain sizes are
 * distributed over four equal-width buckets.
 * <p>
 * Arrays of decision variables count as their elements, and an element named by several arrays
 * counts once. Parameters and variables fixed to a single value are not decision variables and are
 * skipped. Elements of a user-declared decision array count as user variables even when the
 * compiler introduced their scalar declaration.
 */
public class VariableDescriber
{
	private final SemanticModel model;

	public VariableDescriber(SemanticModel model)
	{
		this.model = model;
	}

	/**
	 * Running totals for one description.
	 */
	private static final class Tally
	{
		final Set<String> counted = new HashSet<>();
		final Map<VariableType, Long> byType = new EnumMap<>(VariableType.class);
		long user;
		long introduced;
		long anonymous;
		long unknownDomains;
		final List<Long> domainSizes = new ArrayList<>();

		void count(VariableType type, Origin origin, long amount)
		{
			byType.merge(type, amount, Long::sum);
			if (origin == Origin.INTRODUCED)
			{
				introduced += amount;
			}
			else
			{
				user += amount;
			}
		}

		long ofType(VariableType type)
		{
			return byType.getOrDefault(type, 0L);
		}
	}

	public String describe()
	{
		Set<String> userArrayElements = userDecisionArrayElements();
		Tally tally = new Tally();

		for (VariableDecl variable : model.getVariables().values())
		{
			if (isFixed(variable))
			{
				continue;
			}
			Origin origin = userArrayElements.contains(variable.getName()) ? Origin.USER : variable.getOrigin();
			tally.counted.add(variable.getName());
			tally.count(variable.getType(), origin, 1);

			if (variable.getType() == VariableType.INT)
			{
				if (variable.getDomain().hasIntegerBounds())
				{
					tally.domainSizes.add(variable.getDomain().size());
				}
				else
				{
					tally.unknownDomains++;
				}
			}
		}

		for (ArrayDecl array : model.getArrays().values())
		{
			if (array.isVar())
			{
				countArray(array, tally);
			}
		}

		List<String> lines = new ArrayList<>();
		long total = tally.counted.size() + tally.anonymous;
		if (total == 0)
		{
			lines.add("The model contains no variables.");
		}
		else
		{
			lines.add("The model contains " + total + " variables (" + typeBreakdown(tally) + "): "
					+ tally.introduced + " compiler-introduced and " + tally.user + " user-introduced.");
		}

		if (!tally.domainSizes.isEmpty())
		{
			lines.add(domainStatistics(tally.domainSizes));
		}
		if (tally.unknownDomains > 0)
		{
			lines.add(tally.unknownDomains + " integer variables have unknown domains.");
		}
		return String.join("\n", lines);
	}

	private void countArray(ArrayDecl array, Tally tally)
	{
		VariableType type = array.getElementType();
		if (!array.isInitialized())
		{
			long length = array.getLength();
			tally.anonymous += length;
			tally.count(type, array.getOrigin(), length);
			if (type == VariableType.INT)
			{
				tally.unknownDomains += length;
			}
			return;
		}

		for (Argument element : array.getElements())
		{
			if (!(element instanceof Reference reference))
			{
				continue;
			}
			VariableDecl variable = reference.getVariable();
			if ((variable != null && isFixed(variable)) || !tally.counted.add(reference.getName()))
			{
				continue;
			}
			// Declared scalars were counted above; this is an element naming nothing declared
			tally.count(type, array.getOrigin(), 1);
			if (type == VariableType.INT)
			{
				tally.unknownDomains++;
			}
		}
	}

	private Set<String> userDecisionArrayElements()
	{
		Set<String> names = new LinkedHashSet<>();
		for (ArrayDecl array : model.getArrays().values())
		{
			if (array.isVar() && array.getOrigin() == Origin.USER)
			{
				names.addAll(array.getElementNames());
			}
		}
		return names;
	}

	private static boolean isFixed(VariableDecl variable)
	{
		return variable.isParameter() || variable.isConstant();
	}

	private static String typeBreakdown(Tally tally)
	{
		StringBuilder text = new StringBuilder();
		text.append(tally.ofType(VariableType.INT)).append(" integer, ").append(tally.ofType(VariableType.BOOL)).append(" Boolean");
		if (tally.ofType(VariableType.FLOAT) > 0)
		{
			text.append(", ").append(tally.ofType(VariableType.FLOAT)).append(" float");
		}
		if (tally.ofType(VariableType.SET_OF_INT) > 0)
		{
			text.append(", ").append(tally.ofType(VariableType.SET_OF_INT)).append(" set");
		}
		return text.toString();
	}

	/**
	 * Splits [smallest, largest] domain size into four integer intervals of near equal width and
	 * reports the share and mean size of each non-empty one.
	 */
	static String domainStatistics(List<Long> sizes)
	{
		long min = sizes.stream().mapToLong(Long::longValue).min().orElseThrow();
		long max = sizes.stream().mapToLong(Long::longValue).max().orElseThrow();
		long span = max - min + 1;

		List<String> buckets = new ArrayList<>();
		for (int i = 0; i < 4; i++)
		{
			long lo = min + (span * i) / 4;
			long hi = i == 3 ? max : min + (span * (i + 1)) / 4 - 1;
			if (hi < lo)
			{
				continue;
			}
			long count = 0;
			long sum = 0;
			for (long size : sizes)
			{
				if (size >= lo && size <= hi)
				{
					count++;
					sum += size;
				}
			}
			if (count == 0)
			{
				continue;
			}
			double percentage = 100.0 * count / sizes.size();
			buckets.add(String.format(Locale.ROOT, "%.1f%% have domain size in [%d, %d] (avg size %.2f)", percentage, lo, hi, (double) sum / count));
		}
		return "Among " + sizes.size() + " integer variables with known finite domains, " + String.join("; ", buckets) + ".";
	}
}
