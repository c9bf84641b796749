package org.lokray.fzn.analysis;

import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.ArrayLiteral;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.model.ConstraintCall;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.model.SolveGoal;
import org.lokray.fzn.util.Debug;
import org.lokray.fzn.util.SummaryConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds the objective as an expression tree by following {@code defines_var} annotations from
 * the objective variable down through the constraints that define its operands.
 * <p>
 * The walk keeps the set of variables on the current path; meeting one of them again means the
 * annotations form a cycle. The depth is bounded by the configured maximum and by the number of
 * constraints plus one, since an acyclic chain cannot be longer than that.
 * <p>
 * A variable used several times is expanded once and its node is shared, so the result is a DAG
 * whose size is linear in the number of defining constraints.
 */
public class ObjectiveReconstructor
{
	private final int maxDepth;

	public ObjectiveReconstructor()
	{
		this(new SummaryConfig());
	}

	public ObjectiveReconstructor(SummaryConfig config)
	{
		this.maxDepth = config.getObjectiveMaxDepth();
	}

	/**
	 * Aborts a walk. Caught by {@link #reconstruct(SemanticModel)} and turned into an unknown result.
	 */
	private static class ReconstructionAbort extends RuntimeException
	{
		private final ObjectiveReconstruction.Reason reason;

		ReconstructionAbort(ObjectiveReconstruction.Reason reason)
		{
			super(reason.name(), null, false, false);
			this.reason = reason;
		}
	}

	public ObjectiveReconstruction reconstruct(SemanticModel model)
	{
		SolveGoal goal = model.getSolveGoal();
		if (!goal.getKind().isOptimisation())
		{
			return ObjectiveReconstruction.unknown(null, ObjectiveReconstruction.Reason.NOT_AN_OPTIMISATION);
		}
		if (!(goal.getObjective() instanceof Reference objective))
		{
			return ObjectiveReconstruction.unknown(null, ObjectiveReconstruction.Reason.NOT_A_VARIABLE);
		}
		String name = objective.getName();
		if (!objective.isResolved())
		{
			return ObjectiveReconstruction.unknown(name, ObjectiveReconstruction.Reason.UNRESOLVED_OBJECTIVE);
		}
		if (!objective.isVariable())
		{
			return ObjectiveReconstruction.unknown(name, ObjectiveReconstruction.Reason.NOT_A_VARIABLE);
		}
		ConstraintCall definition = model.getDefiningConstraint(name);
		if (definition == null)
		{
			Debug.log("Objective '%s' has no defining constraint", name);
			return ObjectiveReconstruction.unknown(name, ObjectiveReconstruction.Reason.NO_DEFINITION);
		}

		int bound = Math.min(maxDepth, model.getConstraints().size() + 1);
		Walk walk = new Walk(model, bound);
		try
		{
			ExpressionNode root = walk.expand(name, definition, 1);
			Debug.log("Objective '%s' reconstructed from %d defining constraints, height %d", name, walk.expanded.size(), walk.heights.get(name));
			return ObjectiveReconstruction.known(name, root);
		}
		catch (ReconstructionAbort abort)
		{
			Debug.log("Objective '%s' left unknown: %s", name, abort.reason);
			return ObjectiveReconstruction.unknown(name, abort.reason);
		}
	}

	/**
	 * State of a single reconstruction.
	 */
	private static final class Walk
	{
		private final SemanticModel model;
		private final int bound;
		private final Set<String> path = new HashSet<>();
		// Finished expansions and the number of call levels below and including each
		private final Map<String, CallNode> expanded = new HashMap<>();
		private final Map<String, Integer> heights = new HashMap<>();

		Walk(SemanticModel model, int bound)
		{
			this.model = model;
			this.bound = bound;
		}

		CallNode expand(String variable, ConstraintCall definition, int depth)
		{
			if (depth > bound)
			{
				throw new ReconstructionAbort(ObjectiveReconstruction.Reason.TOO_DEEP);
			}
			path.add(variable);

			int definedPosition = -1;
			List<ExpressionNode> operands = new ArrayList<>();
			List<Argument> arguments = definition.getArguments();
			for (int i = 0; i < arguments.size(); i++)
			{
				Argument argument = arguments.get(i);
				if (definedPosition < 0 && isReferenceTo(argument, variable))
				{
					definedPosition = i;
					continue;
				}
				operands.add(operand(argument, variable, depth));
			}

			path.remove(variable);
			CallNode node = new CallNode(definition, variable, definedPosition, operands);
			expanded.put(variable, node);
			heights.put(variable, 1 + height(operands));
			return node;
		}

		/**
		 * An already expanded variable, provided its subtree still fits under the bound at this depth.
		 */
		private CallNode reuse(String variable, int depth)
		{
			CallNode node = expanded.get(variable);
			if (depth + heights.get(variable) - 1 > bound)
			{
				throw new ReconstructionAbort(ObjectiveReconstruction.Reason.TOO_DEEP);
			}
			return node;
		}

		private int height(List<ExpressionNode> nodes)
		{
			int max = 0;
			for (ExpressionNode node : nodes)
			{
				if (node instanceof CallNode call)
				{
					max = Math.max(max, heights.get(call.getDefinedVariable()));
				}
				else if (node instanceof ArrayNode array)
				{
					max = Math.max(max, height(array.getElements()));
				}
			}
			return max;
		}

		private ExpressionNode operand(Argument argument, String definedVariable, int depth)
		{
			if (argument instanceof ArrayLiteral array)
			{
				List<ExpressionNode> elements = new ArrayList<>();
				for (Argument element : array.getElements())
				{
					elements.add(operand(element, definedVariable, depth));
				}
				return new ArrayNode(elements);
			}
			if (argument instanceof Reference reference && reference.isVariable() && !reference.getName().equals(definedVariable))
			{
				ConstraintCall definition = model.getDefiningConstraint(reference.getName());
				if (definition != null)
				{
					if (path.contains(reference.getName()))
					{
						throw new ReconstructionAbort(ObjectiveReconstruction.Reason.CYCLE);
					}
					if (expanded.containsKey(reference.getName()))
					{
						return reuse(reference.getName(), depth + 1);
					}
					return expand(reference.getName(), definition, depth + 1);
				}
			}
			return new LeafNode(argument);
		}

		private static boolean isReferenceTo(Argument argument, String name)
		{
			return argument instanceof Reference reference && reference.getName().equals(name);
		}
	}
}
