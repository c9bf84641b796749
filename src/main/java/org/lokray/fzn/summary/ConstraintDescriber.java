package org.lokray.fzn.summary;

import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.model.ArrayDecl;
import org.lokray.fzn.model.ConstraintCall;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.model.VariableDecl;
import org.lokray.fzn.semantics.ReferenceCollector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Describes the constraints grouped by predicate: how many calls, their average arity and what the
 * predicate means. Optionally groups predicates under their primary category, with
 * {@value ConstraintCatalog#UNCATEGORIZED} last.
 * <p>
 * The arity of a call is the number of distinct decision variables it involves. An array of
 * decision variables contributes its elements; an uninitialised one contributes its length.
 */
public class ConstraintDescriber
{
	private final SemanticModel model;
	private final ConstraintCatalog catalog;

	private final Map<String, Integer> counts = new TreeMap<>();
	private final Map<String, Long> aritySums = new TreeMap<>();

	public ConstraintDescriber(SemanticModel model, ConstraintCatalog catalog)
	{
		this.model = model;
		this.catalog = catalog;
		for (ConstraintCall constraint : model.getConstraints())
		{
			counts.merge(constraint.getPredicate(), 1, Integer::sum);
			aritySums.merge(constraint.getPredicate(), arity(constraint), Long::sum);
		}
	}

	public String describe(boolean categorize)
	{
		if (counts.isEmpty())
		{
			return "The model contains no constraints.";
		}
		if (!categorize)
		{
			List<String> lines = new ArrayList<>();
			counts.keySet().forEach(predicate -> lines.add(line(predicate, false)));
			return String.join("\n", lines);
		}

		Map<String, List<String>> byCategory = new TreeMap<>();
		for (String predicate : counts.keySet())
		{
			byCategory.computeIfAbsent(catalog.primaryCategory(predicate), ignored -> new ArrayList<>()).add(predicate);
		}
		List<String> order = new ArrayList<>(byCategory.keySet());
		if (order.remove(ConstraintCatalog.UNCATEGORIZED))
		{
			order.add(ConstraintCatalog.UNCATEGORIZED);
		}

		List<String> blocks = new ArrayList<>();
		for (String category : order)
		{
			List<String> predicates = byCategory.get(category);
			List<String> lines = new ArrayList<>();
			lines.add(categoryHeader(category, predicates));
			predicates.forEach(predicate -> lines.add(line(predicate, true)));
			blocks.add(String.join("\n", lines));
		}
		return String.join("\n\n", blocks);
	}

	/**
	 * Number of calls per predicate, sorted by predicate name.
	 */
	public Map<String, Integer> getCounts()
	{
		return Collections.unmodifiableMap(counts);
	}

	public double averageArity(String predicate)
	{
		int count = counts.getOrDefault(predicate, 0);
		return count == 0 ? 0.0 : (double) aritySums.getOrDefault(predicate, 0L) / count;
	}

	long arity(ConstraintCall constraint)
	{
		Set<String> mentioned = new HashSet<>();
		long anonymous = 0;
		for (Reference reference : ReferenceCollector.collect(constraint.getArguments()))
		{
			if (reference.isVariable() && isDecision(reference.getVariable()))
			{
				mentioned.add(reference.getName());
			}
			else if (reference.isArray() && reference.getArray().isVar())
			{
				ArrayDecl array = reference.getArray();
				if (!array.isInitialized())
				{
					anonymous += array.getLength();
					continue;
				}
				for (Argument element : array.getElements())
				{
					if (element instanceof Reference elementReference && elementReference.isVariable() && isDecision(elementReference.getVariable()))
					{
						mentioned.add(elementReference.getName());
					}
				}
			}
		}
		return mentioned.size() + anonymous;
	}

	private static boolean isDecision(VariableDecl variable)
	{
		return !variable.isParameter() && !variable.isConstant();
	}

	private String line(String predicate, boolean categorized)
	{
		int count = counts.get(predicate);
		return String.format(Locale.ROOT, "  %s: %d %s with average arity %.2f (%s)",
				predicate, count, count == 1 ? "constraint" : "constraints", averageArity(predicate),
				parenthetical(catalog.describe(predicate, categorized)));
	}

	private String categoryHeader(String category, List<String> predicates)
	{
		int total = 0;
		long aritySum = 0;
		for (String predicate : predicates)
		{
			total += counts.get(predicate);
			aritySum += aritySums.get(predicate);
		}
		double average = total == 0 ? 0.0 : (double) aritySum / total;
		return String.format(Locale.ROOT, "%s: %d %s, %d %s (avg arity %.2f)", category,
				predicates.size(), predicates.size() == 1 ? "type" : "types",
				total, total == 1 ? "constraint" : "constraints", average);
	}

	/**
	 * Drops a trailing period and lowercases the first letter so a description reads inside parentheses.
	 */
	static String parenthetical(String description)
	{
		String text = description.trim();
		if (text.endsWith("."))
		{
			text = text.substring(0, text.length() - 1);
		}
		if (!text.isEmpty() && Character.isUpperCase(text.charAt(0)))
		{
			text = Character.toLowerCase(text.charAt(0)) + text.substring(1);
		}
		return text;
	}
}
