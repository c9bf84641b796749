package org.lokray.fzn.summary;

import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.model.ConstraintCall;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.semantics.ReferenceCollector;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which declarations a constraint names directly in its arguments.
 */
final class ConstraintMentions
{
	private ConstraintMentions()
	{
	}

	static Set<String> namesIn(ConstraintCall constraint)
	{
		Set<String> names = new LinkedHashSet<>();
		for (Reference reference : ReferenceCollector.collect(constraint.getArguments()))
		{
			names.add(reference.getName());
		}
		return names;
	}

	/**
	 * The number of constraints that name {@code name} in their arguments.
	 */
	static int degree(SemanticModel model, String name)
	{
		int degree = 0;
		for (ConstraintCall constraint : model.getConstraints())
		{
			if (namesIn(constraint).contains(name))
			{
				degree++;
			}
		}
		return degree;
	}
}
