package org.lokray.fzn.analysis;

/**
 * A node of a reconstructed objective expression.
 */
public interface ExpressionNode
{
	<R> R accept(ExpressionVisitor<R> visitor);
}
