package org.lokray.fzn.summary;

import org.lokray.fzn.analysis.SearchStrategy;
import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.model.ArrayDecl;
import org.lokray.fzn.model.Domain;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.model.VariableDecl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Describes the search strategy suggested by the solve annotations.
 */
public class SearchDescriber
{
	public static final String NO_STRATEGY = "No explicit search strategy is specified.";

	private static final Map<String, String> VAR_CHOICE = Map.of(
			"input_order", "the input order",
			"first_fail", "a first-fail strategy",
			"anti_first_fail", "an anti first-fail strategy",
			"smallest", "a smallest-domain strategy",
			"largest", "a largest-domain strategy");

	private static final Map<String, String> VAL_CHOICE = Map.of(
			"indomain_min", "assigning the minimum value",
			"indomain_max", "assigning the maximum value",
			"indomain_split", "splitting the domain",
			"indomain_split_random", "splitting the domain randomly");

	private static final Map<String, String> EXPLORATION = Map.of(
			"complete", "exploring the entire search space",
			"incomplete", "using an incomplete exploration strategy");

	private final SemanticModel model;

	public SearchDescriber(SemanticModel model)
	{
		this.model = model;
	}

	public String describe(Optional<SearchStrategy> strategy)
	{
		return strategy.map(this::describe).orElse(NO_STRATEGY);
	}

	public String describe(SearchStrategy strategy)
	{
		if (!strategy.isSequential())
		{
			String phase = describePhase(strategy);
			return "The model suggests " + article(phase) + " " + phase + ".";
		}

		List<String> phases = new ArrayList<>();
		for (SearchStrategy nested : strategy.getNested())
		{
			phases.add(nested.isSequential() ? stripPeriod(describe(nested)) : describePhase(nested));
		}
		if (phases.isEmpty())
		{
			return NO_STRATEGY;
		}
		StringBuilder joined = new StringBuilder();
		for (int i = 0; i < phases.size(); i++)
		{
			if (i > 0)
			{
				joined.append("; ");
			}
			joined.append('(').append(i + 1).append(") ").append(phases.get(i));
		}
		return "The model suggests a sequential search strategy with " + phases.size() + " phases: " + joined + ".";
	}

	private String describePhase(SearchStrategy strategy)
	{
		String label = label(strategy.getKind());
		String using = "using " + VAR_CHOICE.getOrDefault(strategy.getVarChoice(), strategy.getVarChoice()) + ", "
				+ VAL_CHOICE.getOrDefault(strategy.getValChoice(), strategy.getValChoice()) + ", and "
				+ EXPLORATION.getOrDefault(strategy.getExploration(), strategy.getExploration());
		String precision = strategy.getPrecision().map(p -> " (precision " + p + ")").orElse("");

		List<String> scope = strategy.getScope();
		if (scope.size() == 1)
		{
			String name = scope.get(0);
			VariableDecl variable = model.getVariable(name);
			if (variable != null)
			{
				return label + " on 1 " + variable.getType().getKeyword() + " variable with " + domainText(variable.getDomain()) + precision + ", " + using;
			}
			ArrayDecl array = model.getArray(name);
			if (array != null)
			{
				long count = array.isInitialized() ? array.getElements().size() : array.getLength();
				return label + " on " + count + " " + array.getElementType().getKeyword() + " variables with " + arrayDomainText(array)
						+ " (from 1 array, length " + array.getLength() + ")" + precision + ", " + using;
			}
		}
		return label + " on " + (scope.size() == 1 ? "1 variable" : scope.size() + " variables") + precision + ", " + using;
	}

	private static String label(SearchStrategy.Kind kind)
	{
		return switch (kind)
		{
			case INT_SEARCH -> "integer search";
			case BOOL_SEARCH -> "Boolean search";
			case SET_SEARCH -> "set search";
			case FLOAT_SEARCH -> "float search";
			case SEQ_SEARCH -> "sequential search";
		};
	}

	private static String article(String phrase)
	{
		return "aeiouAEIOU".indexOf(phrase.charAt(0)) >= 0 ? "an" : "a";
	}

	private static String stripPeriod(String text)
	{
		return text.endsWith(".") ? text.substring(0, text.length() - 1) : text;
	}

	private static String domainText(Domain domain)
	{
		if (!domain.hasIntegerBounds())
		{
			return "domain unknown";
		}
		return String.format(Locale.ROOT, "domain [%d, %d]", domain.getMin(), domain.getMax());
	}

	/**
	 * The hull of the element variables' domains, or the declared element domain.
	 */
	private String arrayDomainText(ArrayDecl array)
	{
		boolean found = false;
		long lo = Long.MAX_VALUE;
		long hi = Long.MIN_VALUE;
		for (Argument element : array.getElements())
		{
			if (element instanceof Reference reference && reference.isVariable() && reference.getVariable().getDomain().hasIntegerBounds())
			{
				Domain domain = reference.getVariable().getDomain();
				lo = Math.min(lo, domain.getMin());
				hi = Math.max(hi, domain.getMax());
				found = true;
			}
		}
		if (found)
		{
			return String.format(Locale.ROOT, "domain [%d, %d]", lo, hi);
		}
		return domainText(array.getElementDomain());
	}
}
