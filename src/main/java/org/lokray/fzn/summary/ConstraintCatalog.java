package org.lokray.fzn.summary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup tables for constraint predicates: a description per predicate and the categories a
 * predicate belongs to. Lookups match the predicate name exactly. Both tables may be empty, in
 * which case the built-in short descriptions and then a generic placeholder are used.
 */
public class ConstraintCatalog
{
	public static final String UNCATEGORIZED = "Uncategorized";

	private static final Map<String, String> BUILT_IN_DESCRIPTIONS = Map.ofEntries(
			Map.entry("int_lin_eq", "Linear equality constraints enforce that weighted sums of integer variables equal a constant"),
			Map.entry("int_lin_le", "Linear inequality constraints restrict weighted sums of integer variables to be less than or equal to a constant"),
			Map.entry("int_lin_ge", "Linear inequality constraints restrict weighted sums of integer variables to be greater than or equal to a constant"),
			Map.entry("int_eq", "Equality constraints enforce that pairs of integer variables take the same value"),
			Map.entry("int_ne", "Disequality constraints enforce that pairs of integer variables take different values"),
			Map.entry("int_le", "Ordering constraints enforce that one integer variable is less than or equal to another"),
			Map.entry("bool_clause", "Boolean clause constraints represent disjunctions over Boolean literals"),
			Map.entry("bool_clause_reif", "Reified Boolean clauses link the satisfaction of a clause to a Boolean variable"),
			Map.entry("bool2int", "Boolean-to-integer channeling constraints map Boolean values to integer variables"),
			Map.entry("all_different", "All-different constraints enforce that all involved variables take pairwise distinct values"),
			Map.entry("element", "Element constraints link a variable to a value selected from an array using an index"),
			Map.entry("int_times", "Multiplicative constraints enforce that one integer variable equals the product of two others"),
			Map.entry("int_max", "Maximum constraints bind a variable to the maximum value among a set of variables"));

	private final Map<String, String> descriptions;
	private final Map<String, List<String>> categories;
	private final Map<String, String> categoryDescriptions;

	/**
	 * @param descriptions         Predicate to description.
	 * @param categories           Predicate to the categories it is listed under, in file order.
	 * @param categoryDescriptions Predicate to the description given in the categorised table.
	 */
	public ConstraintCatalog(Map<String, String> descriptions, Map<String, List<String>> categories, Map<String, String> categoryDescriptions)
	{
		this.descriptions = Map.copyOf(descriptions);
		Map<String, List<String>> frozen = new LinkedHashMap<>();
		categories.forEach((predicate, listed) -> frozen.put(predicate, List.copyOf(listed)));
		this.categories = Collections.unmodifiableMap(frozen);
		this.categoryDescriptions = Map.copyOf(categoryDescriptions);
	}

	public static ConstraintCatalog empty()
	{
		return new ConstraintCatalog(Map.of(), Map.of(), Map.of());
	}

	/**
	 * Describes a predicate. The categorised table is consulted first when {@code preferCategorized}
	 * is set, then the description table, then the built-in descriptions.
	 *
	 * @return A description, never null.
	 */
	public String describe(String predicate, boolean preferCategorized)
	{
		if (preferCategorized && categoryDescriptions.containsKey(predicate))
		{
			return categoryDescriptions.get(predicate);
		}
		return descriptions.getOrDefault(predicate,
				BUILT_IN_DESCRIPTIONS.getOrDefault(predicate, "Constraints of type " + predicate + " restrict relationships between variables"));
	}

	public List<String> getCategories(String predicate)
	{
		return categories.getOrDefault(predicate, List.of());
	}

	/**
	 * The alphabetically first category of a predicate, so a predicate listed under several
	 * categories is counted once. {@value #UNCATEGORIZED} when the predicate has none.
	 */
	public String primaryCategory(String predicate)
	{
		List<String> listed = getCategories(predicate);
		if (listed.isEmpty())
		{
			return UNCATEGORIZED;
		}
		List<String> sorted = new ArrayList<>(listed);
		Collections.sort(sorted);
		return sorted.get(0);
	}

	public int getDescriptionCount()
	{
		return descriptions.size();
	}

	public int getCategorizedCount()
	{
		return categories.size();
	}

	public boolean isEmpty()
	{
		return descriptions.isEmpty() && categories.isEmpty() && categoryDescriptions.isEmpty();
	}
}
