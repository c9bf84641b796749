package org.lokray.fzn.summary;

import org.lokray.fzn.analysis.ArrayNode;
import org.lokray.fzn.analysis.CallNode;
import org.lokray.fzn.analysis.ExpressionNode;
import org.lokray.fzn.analysis.LeafNode;
import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.ArrayAccess;
import org.lokray.fzn.ast.ArrayLiteral;
import org.lokray.fzn.ast.CallArgument;
import org.lokray.fzn.ast.IntLiteral;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.model.ArrayDecl;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.model.VariableDecl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a reconstructed objective in infix form, e.g. {@code max((b + c), d)}.
 * <p>
 * Declared names are replaced by placeholders {@code a, b, c, ...} in order of first appearance,
 * with {@code a} reserved for the objective. Variables fixed to an integer are shown as that integer.
 * Calls nested deeper than the display depth are shown as the variable they define. Output longer
 * than the maximum length is cut and ends with an ellipsis.
 * <p>
 * A node shared by several operands is rendered once per display depth, and partial renderings are
 * kept to one character past the maximum length, so the work stays linear in the size of the DAG.
 * <p>
 * A formatter keeps its placeholder assignments, so use one instance per objective.
 */
public class ExpressionFormatter
{
	private static final String ELLIPSIS = "…";

	private final SemanticModel model;
	private final int displayDepth;
	private final int maxLength;
	private final Map<String, String> placeholders = new HashMap<>();
	private final Map<CallNode, Map<Integer, String>> rendered = new IdentityHashMap<>();

	public ExpressionFormatter(SemanticModel model, int displayDepth, int maxLength)
	{
		this.model = model;
		this.displayDepth = displayDepth;
		this.maxLength = maxLength;
	}

	/**
	 * @param objective The objective variable, rendered as {@code a}.
	 * @param root      The expression defining it.
	 * @return The rendered expression, at most {@code maxLength} characters long.
	 */
	public String format(String objective, ExpressionNode root)
	{
		placeholders.putIfAbsent(objective, placeholder(0));
		String text = render(root, displayDepth).replaceAll("\\s+", " ").trim();
		if (text.length() > maxLength)
		{
			text = text.substring(0, Math.max(0, maxLength - 1)) + ELLIPSIS;
		}
		return text;
	}

	/**
	 * The placeholder of a declared name, assigning the next free one on first use.
	 * Names that are not declared are returned unchanged.
	 */
	public String placeholderFor(String name)
	{
		if (placeholders.containsKey(name))
		{
			return placeholders.get(name);
		}
		if (model.lookup(name) == null)
		{
			return name;
		}
		// Index 0 ('a') belongs to the objective
		String assigned = placeholder(placeholders.size() + (placeholders.containsValue("a") ? 0 : 1));
		placeholders.put(name, assigned);
		return assigned;
	}

	/**
	 * 0 -> a, 25 -> z, 26 -> aa, 27 -> ab, ...
	 */
	static String placeholder(int index)
	{
		StringBuilder out = new StringBuilder();
		int n = index;
		while (true)
		{
			out.insert(0, (char) ('a' + n % 26));
			n = n / 26 - 1;
			if (n < 0)
			{
				break;
			}
		}
		return out.toString();
	}

	private String render(ExpressionNode node, int depth)
	{
		if (node instanceof CallNode call)
		{
			Map<Integer, String> byDepth = rendered.computeIfAbsent(call, key -> new HashMap<>());
			String text = byDepth.get(depth);
			if (text == null)
			{
				text = clip(renderCall(call, depth));
				byDepth.put(depth, text);
			}
			return text;
		}
		if (node instanceof ArrayNode array)
		{
			StringBuilder text = new StringBuilder("[");
			List<ExpressionNode> elements = array.getElements();
			for (int i = 0; i < elements.size() && text.length() <= maxLength; i++)
			{
				if (i > 0)
				{
					text.append(", ");
				}
				text.append(render(elements.get(i), depth));
			}
			return clip(text.append("]").toString());
		}
		return clip(renderArgument(((LeafNode) node).getArgument()));
	}

	private String clip(String text)
	{
		return text.length() > maxLength + 1 ? text.substring(0, maxLength + 1) : text;
	}

	private String renderCall(CallNode call, int depth)
	{
		if (depth <= 0)
		{
			return placeholderFor(call.getDefinedVariable());
		}

		List<ExpressionNode> ops = call.getOperands();
		int arity = call.getConstraint().getArity();
		boolean definesLast = call.getDefinedPosition() == arity - 1;
		String predicate = call.getPredicate();

		if (definesLast && ops.size() == 2)
		{
			String a = render(ops.get(0), depth - 1);
			String b = render(ops.get(1), depth - 1);
			switch (predicate)
			{
				case "int_plus":
					return "(" + a + " + " + b + ")";
				case "int_minus":
					return "(" + a + " - " + b + ")";
				case "int_times":
					return "(" + a + " * " + b + ")";
				case "int_div":
					return "(" + a + " / " + b + ")";
				case "int_max":
					return "max(" + a + ", " + b + ")";
				case "int_min":
					return "min(" + a + ", " + b + ")";
				case "array_int_element":
				case "array_var_int_element":
				case "array_bool_element":
				case "array_var_bool_element":
					return b + "[" + a + "]";
				case "fzn_if_then_else_var_int":
				case "fzn_if_then_else_var_bool":
					return "(if " + a + " then " + b + " else 0)";
				default:
					break;
			}
		}
		if (definesLast && ops.size() == 1)
		{
			String a = render(ops.get(0), depth - 1);
			switch (predicate)
			{
				case "int_abs":
					return "abs(" + a + ")";
				case "bool2int":
					return "bool2int(" + a + ")";
				default:
					break;
			}
		}
		if (definesLast && ops.size() == 3 && (predicate.equals("fzn_if_then_else_var_int") || predicate.equals("fzn_if_then_else_var_bool")))
		{
			return "(if " + render(ops.get(0), depth - 1) + " then " + render(ops.get(1), depth - 1) + " else " + render(ops.get(2), depth - 1) + ")";
		}
		if (predicate.equals("int_lin_eq") && call.getDefinedPosition() < 0 && ops.size() == 3)
		{
			String linear = renderLinearDefinition(call, depth);
			if (linear != null)
			{
				return linear;
			}
		}
		return renderFallback(call, depth);
	}

	/**
	 * {@code int_lin_eq(as, xs, c)} solved for the defined variable {@code x_t}:
	 * {@code x_t = (c - sum of the other terms) / a_t}.
	 */
	private String renderLinearDefinition(CallNode call, int depth)
	{
		List<Long> coefficients = integers(call.getOperands().get(0));
		List<ExpressionNode> terms = elements(call.getOperands().get(1));
		Long constant = integer(call.getOperands().get(2));
		if (coefficients == null || terms == null || constant == null || coefficients.size() != terms.size())
		{
			return null;
		}

		int target = -1;
		for (int i = 0; i < terms.size(); i++)
		{
			if (terms.get(i) instanceof LeafNode leaf && call.getDefinedVariable().equals(leaf.getReferenceName()))
			{
				target = i;
				break;
			}
		}
		if (target < 0)
		{
			return null;
		}

		long targetCoefficient = coefficients.get(target);
		List<String> pieces = new ArrayList<>();
		for (int i = 0; i < terms.size(); i++)
		{
			long coefficient = coefficients.get(i);
			if (i == target || coefficient == 0)
			{
				continue;
			}
			String term = render(terms.get(i), depth - 1);
			if (coefficient == 1)
			{
				pieces.add(term);
			}
			else if (coefficient == -1)
			{
				pieces.add("-(" + term + ")");
			}
			else
			{
				pieces.add(coefficient + "*(" + term + ")");
			}
		}
		String rest = pieces.isEmpty() ? "0" : String.join(" + ", pieces).replace("+ -(", "- (");

		if (targetCoefficient == -1)
		{
			return constant == 0 ? rest : "(" + rest + " - " + constant + ")";
		}
		if (targetCoefficient == 1)
		{
			if (constant == 0)
			{
				return rest.equals("0") ? "0" : "(-(" + rest + "))";
			}
			return rest.equals("0") ? String.valueOf(constant) : "(" + constant + " - (" + rest + "))";
		}
		if (targetCoefficient == 0)
		{
			return null;
		}
		if (rest.equals("0"))
		{
			return "(" + constant + " / " + targetCoefficient + ")";
		}
		return "((" + constant + " - (" + rest + ")) / " + targetCoefficient + ")";
	}

	/**
	 * {@code pred(args)} with the defined variable back in its original position.
	 */
	private String renderFallback(CallNode call, int depth)
	{
		List<String> rendered = new ArrayList<>();
		for (ExpressionNode operand : call.getOperands())
		{
			rendered.add(render(operand, depth - 1));
		}
		if (call.getDefinedPosition() >= 0)
		{
			rendered.add(call.getDefinedPosition(), placeholderFor(call.getDefinedVariable()));
		}
		return call.getPredicate() + "(" + String.join(", ", rendered) + ")";
	}

	private String renderArgument(Argument argument)
	{
		if (argument instanceof Reference reference)
		{
			Long fixed = fixedValue(reference);
			return fixed != null ? String.valueOf(fixed) : placeholderFor(reference.getName());
		}
		if (argument instanceof ArrayAccess access)
		{
			return placeholderFor(access.getArray().getName()) + "[" + renderArgument(access.getIndex()) + "]";
		}
		if (argument instanceof ArrayLiteral array)
		{
			return array.getElements().stream().map(this::renderArgument).collect(Collectors.joining(", ", "[", "]"));
		}
		if (argument instanceof CallArgument call)
		{
			return call.getArguments().stream().map(this::renderArgument).collect(Collectors.joining(", ", call.getName() + "(", ")"));
		}
		return argument.toString();
	}

	private static Long fixedValue(Reference reference)
	{
		VariableDecl variable = reference.getVariable();
		return variable != null ? variable.getFixedIntValue() : null;
	}

	/**
	 * Elements of an inline array operand, or of a named array's initializer.
	 */
	private static List<ExpressionNode> elements(ExpressionNode node)
	{
		if (node instanceof ArrayNode array)
		{
			return array.getElements();
		}
		if (node instanceof LeafNode leaf && leaf.getArgument() instanceof Reference reference && reference.isArray())
		{
			ArrayDecl array = reference.getArray();
			if (!array.isInitialized())
			{
				return null;
			}
			List<ExpressionNode> elements = new ArrayList<>();
			for (Argument element : array.getElements())
			{
				elements.add(new LeafNode(element));
			}
			return elements;
		}
		return null;
	}

	private static List<Long> integers(ExpressionNode node)
	{
		List<ExpressionNode> elements = elements(node);
		if (elements == null)
		{
			return null;
		}
		List<Long> values = new ArrayList<>();
		for (ExpressionNode element : elements)
		{
			Long value = integer(element);
			if (value == null)
			{
				return null;
			}
			values.add(value);
		}
		return values;
	}

	private static Long integer(ExpressionNode node)
	{
		if (!(node instanceof LeafNode leaf))
		{
			return null;
		}
		if (leaf.getArgument() instanceof IntLiteral literal)
		{
			return literal.getValue();
		}
		if (leaf.getArgument() instanceof Reference reference)
		{
			return fixedValue(reference);
		}
		return null;
	}
}
