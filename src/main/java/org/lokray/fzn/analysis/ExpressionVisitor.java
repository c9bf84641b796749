package org.lokray.fzn.analysis;

public interface ExpressionVisitor<R>
{
	R visitCall(CallNode node);

	R visitLeaf(LeafNode node);

	R visitArray(ArrayNode node);
}
