package org.lokray.fzn.model;

import org.lokray.fzn.ast.Annotation;
import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.lexer.Token;

import java.util.List;

/**
 * The single {@code solve} item of a model.
 */
public class SolveGoal
{
	private final Token keyword;
	private final GoalKind kind;
	private final Argument objective; // Null for satisfy
	private final List<Annotation> annotations;

	public SolveGoal(Token keyword, GoalKind kind, Argument objective, List<Annotation> annotations)
	{
		if (kind.isOptimisation() && objective == null)
		{
			throw new IllegalArgumentException(kind.getKeyword() + " requires an objective.");
		}
		this.keyword = keyword;
		this.kind = kind;
		this.objective = objective;
		this.annotations = List.copyOf(annotations);
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public GoalKind getKind()
	{
		return kind;
	}

	public Argument getObjective()
	{
		return objective;
	}

	/**
	 * @return The objective's identifier when it is a plain reference, otherwise null.
	 */
	public String getObjectiveName()
	{
		return objective instanceof Reference reference ? reference.getName() : null;
	}

	/**
	 * Search annotations in source order. Empty when the solve item has none.
	 */
	public List<Annotation> getAnnotations()
	{
		return annotations;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("solve");
		for (Annotation annotation : annotations)
		{
			sb.append(" :: ").append(annotation);
		}
		sb.append(' ').append(kind.getKeyword());
		if (objective != null)
		{
			sb.append(' ').append(objective);
		}
		return sb.toString();
	}
}
