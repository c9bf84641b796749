package org.lokray.fzn.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The root of a parsed FlatZinc model: every declaration, every constraint in source order and the
 * solve goal. Instances are created through {@link Builder} and never change afterwards.
 */
public class SemanticModel
{
	private final Map<String, VariableDecl> variables;
	private final Map<String, ArrayDecl> arrays;
	private final List<PredicateDecl> predicates;
	private final List<ConstraintCall> constraints;
	private final SolveGoal solveGoal;
	private final Map<String, ConstraintCall> definitions;

	private SemanticModel(Builder builder)
	{
		this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
		this.arrays = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arrays));
		this.predicates = List.copyOf(builder.predicates);
		this.constraints = List.copyOf(builder.constraints);
		this.solveGoal = builder.solveGoal;

		// First constraint wins when several claim to define the same variable
		Map<String, ConstraintCall> defined = new LinkedHashMap<>();
		for (ConstraintCall constraint : constraints)
		{
			for (String name : constraint.getDefinedVariables())
			{
				defined.putIfAbsent(name, constraint);
			}
		}
		this.definitions = Collections.unmodifiableMap(defined);
	}

	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Scalar declarations (variables and parameters) by name, in declaration order.
	 */
	public Map<String, VariableDecl> getVariables()
	{
		return variables;
	}

	/**
	 * Array declarations by name, in declaration order.
	 */
	public Map<String, ArrayDecl> getArrays()
	{
		return arrays;
	}

	public List<PredicateDecl> getPredicates()
	{
		return predicates;
	}

	public List<ConstraintCall> getConstraints()
	{
		return constraints;
	}

	public SolveGoal getSolveGoal()
	{
		return solveGoal;
	}

	public VariableDecl getVariable(String name)
	{
		return variables.get(name);
	}

	public ArrayDecl getArray(String name)
	{
		return arrays.get(name);
	}

	/**
	 * Looks a name up in the shared scalar/array namespace.
	 *
	 * @return The declaration, or null if nothing with that name was declared.
	 */
	public Declaration lookup(String name)
	{
		VariableDecl variable = variables.get(name);
		if (variable != null)
		{
			return variable;
		}
		return arrays.get(name);
	}

	/**
	 * @return The first constraint annotated {@code defines_var(name)}, or null.
	 */
	public ConstraintCall getDefiningConstraint(String name)
	{
		return definitions.get(name);
	}

	/**
	 * Defined variable name to its first defining constraint.
	 */
	public Map<String, ConstraintCall> getDefinitions()
	{
		return definitions;
	}

	@Override
	public String toString()
	{
		return "SemanticModel(" + variables.size() + " variables, " + arrays.size() + " arrays, "
				+ constraints.size() + " constraints, " + (solveGoal != null ? solveGoal.getKind() : "no solve") + ")";
	}

	/**
	 * Accumulates declarations while a model is parsed. Owned by one parser at a time.
	 */
	public static class Builder
	{
		private final Map<String, VariableDecl> variables = new LinkedHashMap<>();
		private final Map<String, ArrayDecl> arrays = new LinkedHashMap<>();
		private final List<PredicateDecl> predicates = new ArrayList<>();
		private final List<ConstraintCall> constraints = new ArrayList<>();
		private SolveGoal solveGoal;

		private Builder()
		{
		}

		public Builder addVariable(VariableDecl variable)
		{
			requireFreshName(variable.getName());
			variables.put(variable.getName(), variable);
			return this;
		}

		public Builder addArray(ArrayDecl array)
		{
			requireFreshName(array.getName());
			arrays.put(array.getName(), array);
			return this;
		}

		public Builder addPredicate(PredicateDecl predicate)
		{
			predicates.add(predicate);
			return this;
		}

		public Builder addConstraint(ConstraintCall constraint)
		{
			constraints.add(constraint);
			return this;
		}

		/**
		 * @return The index the next constraint added will occupy.
		 */
		public int nextConstraintIndex()
		{
			return constraints.size();
		}

		public Builder setSolveGoal(SolveGoal goal)
		{
			if (solveGoal != null)
			{
				throw new IllegalStateException("A model has exactly one solve goal.");
			}
			this.solveGoal = goal;
			return this;
		}

		public boolean hasSolveGoal()
		{
			return solveGoal != null;
		}

		public SemanticModel build()
		{
			if (solveGoal == null)
			{
				throw new IllegalStateException("Cannot build a model without a solve goal.");
			}
			return new SemanticModel(this);
		}

		private void requireFreshName(String name)
		{
			if (variables.containsKey(name) || arrays.containsKey(name))
			{
				throw new IllegalArgumentException("Name '" + name + "' is already declared.");
			}
		}
	}
}
