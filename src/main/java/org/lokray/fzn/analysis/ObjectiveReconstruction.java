package org.lokray.fzn.analysis;

import java.util.Optional;

/**
 * Outcome of rebuilding the objective: either an expression tree rooted at the objective
 * variable, or "unknown" with the reason the chain could not be followed.
 */
public final class ObjectiveReconstruction
{
	public enum Reason
	{
		/** The solve goal is {@code satisfy}. */
		NOT_AN_OPTIMISATION,
		/** The objective is a literal, an array or an expression rather than a scalar variable. */
		NOT_A_VARIABLE,
		/** The objective names nothing declared. */
		UNRESOLVED_OBJECTIVE,
		/** No constraint carries {@code defines_var} for the objective. */
		NO_DEFINITION,
		CYCLE,
		TOO_DEEP
	}

	private final String objectiveName;
	private final ExpressionNode expression;
	private final Reason reason;

	private ObjectiveReconstruction(String objectiveName, ExpressionNode expression, Reason reason)
	{
		this.objectiveName = objectiveName;
		this.expression = expression;
		this.reason = reason;
	}

	public static ObjectiveReconstruction known(String objectiveName, ExpressionNode expression)
	{
		return new ObjectiveReconstruction(objectiveName, expression, null);
	}

	public static ObjectiveReconstruction unknown(String objectiveName, Reason reason)
	{
		return new ObjectiveReconstruction(objectiveName, null, reason);
	}

	public boolean isKnown()
	{
		return expression != null;
	}

	/**
	 * @return The objective variable's name; null when the objective is not a named reference.
	 */
	public String getObjectiveName()
	{
		return objectiveName;
	}

	public Optional<ExpressionNode> getExpression()
	{
		return Optional.ofNullable(expression);
	}

	/**
	 * @return Why reconstruction failed, or null when it succeeded.
	 */
	public Reason getReason()
	{
		return reason;
	}

	@Override
	public String toString()
	{
		if (isKnown())
		{
			return objectiveName + " = " + expression;
		}
		return "Unknown (" + reason + ")";
	}
}
