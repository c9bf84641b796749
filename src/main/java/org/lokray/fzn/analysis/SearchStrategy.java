package org.lokray.fzn.analysis;

import java.util.List;
import java.util.Optional;

/**
 * A search annotation of the solve item in structured form. Sequential searches carry their phases
 * in {@link #getNested()} and leave the other fields empty.
 */
public final class SearchStrategy
{
	public enum Kind
	{
		INT_SEARCH("int_search"),
		BOOL_SEARCH("bool_search"),
		SET_SEARCH("set_search"),
		FLOAT_SEARCH("float_search"),
		SEQ_SEARCH("seq_search");

		private final String annotationName;

		Kind(String annotationName)
		{
			this.annotationName = annotationName;
		}

		public String getAnnotationName()
		{
			return annotationName;
		}

		public static Optional<Kind> fromAnnotationName(String name)
		{
			for (Kind kind : values())
			{
				if (kind.annotationName.equals(name))
				{
					return Optional.of(kind);
				}
			}
			return Optional.empty();
		}
	}

	private final Kind kind;
	private final List<String> scope;
	private final String varChoice;
	private final String valChoice;
	private final String exploration;
	private final Double precision;
	private final List<SearchStrategy> nested;

	private SearchStrategy(Kind kind, List<String> scope, String varChoice, String valChoice, String exploration, Double precision,
						   List<SearchStrategy> nested)
	{
		this.kind = kind;
		this.scope = List.copyOf(scope);
		this.varChoice = varChoice;
		this.valChoice = valChoice;
		this.exploration = exploration;
		this.precision = precision;
		this.nested = List.copyOf(nested);
	}

	/**
	 * A search over integer, boolean or set variables.
	 */
	public static SearchStrategy of(Kind kind, List<String> scope, String varChoice, String valChoice, String exploration)
	{
		if (kind == Kind.SEQ_SEARCH || kind == Kind.FLOAT_SEARCH)
		{
			throw new IllegalArgumentException(kind + " has its own factory.");
		}
		return new SearchStrategy(kind, scope, varChoice, valChoice, exploration, null, List.of());
	}

	public static SearchStrategy floatSearch(List<String> scope, double precision, String varChoice, String valChoice, String exploration)
	{
		return new SearchStrategy(Kind.FLOAT_SEARCH, scope, varChoice, valChoice, exploration, precision, List.of());
	}

	public static SearchStrategy sequence(List<SearchStrategy> phases)
	{
		return new SearchStrategy(Kind.SEQ_SEARCH, List.of(), null, null, null, null, phases);
	}

	public Kind getKind()
	{
		return kind;
	}

	/**
	 * Names of the searched variables, or the array name when the scope is an array reference.
	 */
	public List<String> getScope()
	{
		return scope;
	}

	public String getVarChoice()
	{
		return varChoice;
	}

	public String getValChoice()
	{
		return valChoice;
	}

	/**
	 * The exploration strategy, e.g. {@code complete}.
	 */
	public String getExploration()
	{
		return exploration;
	}

	/**
	 * @return The precision of a float search, empty for every other kind.
	 */
	public Optional<Double> getPrecision()
	{
		return Optional.ofNullable(precision);
	}

	public List<SearchStrategy> getNested()
	{
		return nested;
	}

	public boolean isSequential()
	{
		return kind == Kind.SEQ_SEARCH;
	}

	@Override
	public String toString()
	{
		if (isSequential())
		{
			return kind.getAnnotationName() + nested;
		}
		return kind.getAnnotationName() + "{scope=" + scope + ", varChoice=" + varChoice + ", valChoice=" + valChoice
				+ ", exploration=" + exploration + (precision != null ? ", precision=" + precision : "") + "}";
	}
}
