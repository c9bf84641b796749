package org.lokray.fzn.analysis;

import java.util.List;

/**
 * Prefix text of an expression for {@code toString}. Shared nodes are written once per use, so
 * the text stops at {@link #LIMIT} characters and ends with an ellipsis.
 */
final class ExpressionText
{
	static final int LIMIT = 1000;

	private ExpressionText()
	{
	}

	static String of(ExpressionNode node)
	{
		StringBuilder out = new StringBuilder();
		append(node, out);
		if (out.length() > LIMIT)
		{
			out.setLength(LIMIT);
			out.append('…');
		}
		return out.toString();
	}

	private static void append(ExpressionNode node, StringBuilder out)
	{
		if (out.length() > LIMIT)
		{
			return;
		}
		if (node instanceof CallNode call)
		{
			out.append(call.getPredicate());
			appendAll(call.getOperands(), out, '(', ')');
		}
		else if (node instanceof ArrayNode array)
		{
			appendAll(array.getElements(), out, '[', ']');
		}
		else
		{
			out.append(((LeafNode) node).getArgument());
		}
	}

	private static void appendAll(List<ExpressionNode> nodes, StringBuilder out, char open, char close)
	{
		out.append(open);
		for (int i = 0; i < nodes.size() && out.length() <= LIMIT; i++)
		{
			if (i > 0)
			{
				out.append(", ");
			}
			append(nodes.get(i), out);
		}
		out.append(close);
	}
}
