package org.lokray.fzn.analysis;

import java.util.List;

/**
 * An inline array operand, expanded element by element.
 */
public class ArrayNode implements ExpressionNode
{
	private final List<ExpressionNode> elements;

	public ArrayNode(List<ExpressionNode> elements)
	{
		this.elements = List.copyOf(elements);
	}

	public List<ExpressionNode> getElements()
	{
		return elements;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitArray(this);
	}

	@Override
	public String toString()
	{
		return ExpressionText.of(this);
	}
}
