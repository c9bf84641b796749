package org.lokray.fzn.analysis;

import org.lokray.fzn.model.ConstraintCall;

import java.util.List;

/**
 * A defined variable replaced by the constraint that defines it. The operands are the constraint's
 * arguments in order, minus the argument that is the defined variable itself.
 */
public class CallNode implements ExpressionNode
{
	private final ConstraintCall constraint;
	private final String definedVariable;
	private final int definedPosition;
	private final List<ExpressionNode> operands;

	public CallNode(ConstraintCall constraint, String definedVariable, int definedPosition, List<ExpressionNode> operands)
	{
		this.constraint = constraint;
		this.definedVariable = definedVariable;
		this.definedPosition = definedPosition;
		this.operands = List.copyOf(operands);
	}

	public String getPredicate()
	{
		return constraint.getPredicate();
	}

	public ConstraintCall getConstraint()
	{
		return constraint;
	}

	public String getDefinedVariable()
	{
		return definedVariable;
	}

	/**
	 * @return Index of the removed argument in the original call, or -1 when the defined variable
	 * is not a top-level argument (e.g. it sits inside an array as in {@code int_lin_eq}).
	 */
	public int getDefinedPosition()
	{
		return definedPosition;
	}

	public List<ExpressionNode> getOperands()
	{
		return operands;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitCall(this);
	}

	@Override
	public String toString()
	{
		return ExpressionText.of(this);
	}
}
