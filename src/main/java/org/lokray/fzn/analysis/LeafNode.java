package org.lokray.fzn.analysis;

import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.Reference;

/**
 * An operand that is not expanded further: a literal, a variable without a definition,
 * an array reference or an element access.
 */
public class LeafNode implements ExpressionNode
{
	private final Argument argument;

	public LeafNode(Argument argument)
	{
		this.argument = argument;
	}

	public Argument getArgument()
	{
		return argument;
	}

	/**
	 * @return The referenced name when the leaf is a plain reference, otherwise null.
	 */
	public String getReferenceName()
	{
		return argument instanceof Reference reference ? reference.getName() : null;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitLeaf(this);
	}

	@Override
	public String toString()
	{
		return argument.toString();
	}
}
