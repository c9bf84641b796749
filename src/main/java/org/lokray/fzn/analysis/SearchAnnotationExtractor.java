package org.lokray.fzn.analysis;

import org.lokray.fzn.ast.Annotation;
import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.ArrayAccess;
import org.lokray.fzn.ast.ArrayLiteral;
import org.lokray.fzn.ast.CallArgument;
import org.lokray.fzn.ast.FloatLiteral;
import org.lokray.fzn.ast.IntLiteral;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.ast.StringLiteral;
import org.lokray.fzn.model.SolveGoal;
import org.lokray.fzn.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the search annotations of a solve item. Annotations outside the search vocabulary, and
 * search annotations with the wrong number or shape of arguments, are skipped. When several
 * top-level searches are present they run one after the other, as a sequential search.
 */
public class SearchAnnotationExtractor
{
	public Optional<SearchStrategy> extract(SolveGoal goal)
	{
		List<SearchStrategy> strategies = new ArrayList<>();
		for (Annotation annotation : goal.getAnnotations())
		{
			parse(annotation.asCall()).ifPresent(strategies::add);
		}

		if (strategies.isEmpty())
		{
			return Optional.empty();
		}
		if (strategies.size() == 1)
		{
			return Optional.of(strategies.get(0));
		}
		Debug.log("Combining %d search annotations into a sequence", strategies.size());
		return Optional.of(SearchStrategy.sequence(strategies));
	}

	private Optional<SearchStrategy> parse(CallArgument call)
	{
		Optional<SearchStrategy.Kind> kind = SearchStrategy.Kind.fromAnnotationName(call.getName());
		if (kind.isEmpty())
		{
			Debug.log("Ignoring annotation '%s'", call.getName());
			return Optional.empty();
		}

		List<Argument> args = call.getArguments();
		return switch (kind.get())
		{
			case SEQ_SEARCH -> parseSequence(args);
			case FLOAT_SEARCH -> parseFloatSearch(args);
			default -> parseBasicSearch(kind.get(), args);
		};
	}

	private Optional<SearchStrategy> parseBasicSearch(SearchStrategy.Kind kind, List<Argument> args)
	{
		if (args.size() != 4)
		{
			return malformed(kind, args);
		}
		Optional<List<String>> scope = scope(args.get(0));
		String varChoice = word(args.get(1));
		String valChoice = word(args.get(2));
		String exploration = word(args.get(3));
		if (scope.isEmpty() || varChoice == null || valChoice == null || exploration == null)
		{
			return malformed(kind, args);
		}
		return Optional.of(SearchStrategy.of(kind, scope.get(), varChoice, valChoice, exploration));
	}

	private Optional<SearchStrategy> parseFloatSearch(List<Argument> args)
	{
		if (args.size() != 5)
		{
			return malformed(SearchStrategy.Kind.FLOAT_SEARCH, args);
		}
		Optional<List<String>> scope = scope(args.get(0));
		Double precision = number(args.get(1));
		String varChoice = word(args.get(2));
		String valChoice = word(args.get(3));
		String exploration = word(args.get(4));
		if (scope.isEmpty() || precision == null || varChoice == null || valChoice == null || exploration == null)
		{
			return malformed(SearchStrategy.Kind.FLOAT_SEARCH, args);
		}
		return Optional.of(SearchStrategy.floatSearch(scope.get(), precision, varChoice, valChoice, exploration));
	}

	/**
	 * {@code seq_search([s1, s2, ...])}. A single call in place of the list is accepted too.
	 * Phases that do not parse are dropped; a sequence with no phase left is ignored.
	 */
	private Optional<SearchStrategy> parseSequence(List<Argument> args)
	{
		if (args.size() != 1)
		{
			return malformed(SearchStrategy.Kind.SEQ_SEARCH, args);
		}

		List<Argument> phases;
		if (args.get(0) instanceof ArrayLiteral array)
		{
			phases = array.getElements();
		}
		else
		{
			phases = List.of(args.get(0));
		}

		List<SearchStrategy> nested = new ArrayList<>();
		for (Argument phase : phases)
		{
			if (phase instanceof CallArgument call)
			{
				parse(call).ifPresent(nested::add);
			}
		}
		if (nested.isEmpty())
		{
			return malformed(SearchStrategy.Kind.SEQ_SEARCH, args);
		}
		return Optional.of(SearchStrategy.sequence(nested));
	}

	private Optional<List<String>> scope(Argument argument)
	{
		if (argument instanceof Reference reference)
		{
			return Optional.of(List.of(reference.getName()));
		}
		if (argument instanceof ArrayLiteral array)
		{
			List<String> names = new ArrayList<>();
			for (Argument element : array.getElements())
			{
				if (element instanceof Reference reference)
				{
					names.add(reference.getName());
				}
				else if (element instanceof ArrayAccess access)
				{
					names.add(access.toString());
				}
				else
				{
					names.add(element.toString());
				}
			}
			return Optional.of(names);
		}
		return Optional.empty();
	}

	/**
	 * Strategy names are bare identifiers, which parse as (usually unresolved) references.
	 */
	private String word(Argument argument)
	{
		if (argument instanceof Reference reference)
		{
			return reference.getName();
		}
		if (argument instanceof StringLiteral literal)
		{
			return literal.getValue();
		}
		if (argument instanceof CallArgument call && call.getArguments().isEmpty())
		{
			return call.getName();
		}
		return null;
	}

	private Double number(Argument argument)
	{
		if (argument instanceof FloatLiteral literal)
		{
			return literal.getValue();
		}
		if (argument instanceof IntLiteral literal)
		{
			return (double) literal.getValue();
		}
		return null;
	}

	private Optional<SearchStrategy> malformed(SearchStrategy.Kind kind, List<Argument> args)
	{
		Debug.log("Ignoring malformed %s with %d argument(s)", kind.getAnnotationName(), args.size());
		return Optional.empty();
	}
}
