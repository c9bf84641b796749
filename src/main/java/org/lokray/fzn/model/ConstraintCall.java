package org.lokray.fzn.model;

import org.lokray.fzn.ast.Annotation;
import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A {@code constraint} item: a predicate applied to arguments, plus its annotations.
 * The index records the order in which constraints appear in the model.
 */
public class ConstraintCall
{
	public static final String DEFINES_VAR = "defines_var";

	private final Token keyword;
	private final Token predicate;
	private final List<Argument> arguments;
	private final List<Annotation> annotations;
	private final int index;

	public ConstraintCall(Token keyword, Token predicate, List<Argument> arguments, List<Annotation> annotations, int index)
	{
		this.keyword = keyword;
		this.predicate = predicate;
		this.arguments = List.copyOf(arguments);
		this.annotations = List.copyOf(annotations);
		this.index = index;
	}

	public String getPredicate()
	{
		return predicate.getLexeme();
	}

	/**
	 * @return The {@code constraint} keyword that starts the item.
	 */
	public Token getKeyword()
	{
		return keyword;
	}

	public List<Argument> getArguments()
	{
		return arguments;
	}

	public Argument getArgument(int position)
	{
		return arguments.get(position);
	}

	public int getArity()
	{
		return arguments.size();
	}

	public List<Annotation> getAnnotations()
	{
		return annotations;
	}

	/**
	 * @return Zero-based position of this constraint in the model.
	 */
	public int getIndex()
	{
		return index;
	}

	/**
	 * Names given by the {@code defines_var(x)} annotations on this constraint, in order.
	 */
	public List<String> getDefinedVariables()
	{
		List<String> names = new ArrayList<>();
		for (Annotation annotation : annotations)
		{
			if (DEFINES_VAR.equals(annotation.getName()) && annotation.getArguments().size() == 1
					&& annotation.getArguments().get(0) instanceof Reference reference)
			{
				names.add(reference.getName());
			}
		}
		return names;
	}

	public boolean defines(String variableName)
	{
		return getDefinedVariables().contains(variableName);
	}

	/**
	 * The call without annotations, e.g. {@code int_plus(x,y,z)}.
	 */
	public String toCallString()
	{
		return arguments.stream().map(Object::toString).collect(Collectors.joining(",", getPredicate() + "(", ")"));
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(toCallString());
		for (Annotation annotation : annotations)
		{
			sb.append(" :: ").append(annotation);
		}
		return sb.toString();
	}
}
