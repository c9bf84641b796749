package org.lokray.fzn.summary;

import org.lokray.fzn.analysis.ObjectiveReconstruction;
import org.lokray.fzn.model.Domain;
import org.lokray.fzn.model.GoalKind;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.model.SolveGoal;
import org.lokray.fzn.model.VariableDecl;
import org.lokray.fzn.util.SummaryConfig;

import java.util.Locale;

/**
 * Describes the kind of problem and, for optimisation problems, the objective variable and the
 * formulation rebuilt from its {@code defines_var} chain.
 */
public class ProblemDescriber
{
	private final SemanticModel model;
	private final SummaryConfig config;

	public ProblemDescriber(SemanticModel model, SummaryConfig config)
	{
		this.model = model;
		this.config = config;
	}

	public String describe(ObjectiveReconstruction objective)
	{
		SolveGoal goal = model.getSolveGoal();
		if (goal.getKind() == GoalKind.SATISFY)
		{
			return "This is a satisfaction problem.";
		}

		String direction = goal.getKind() == GoalKind.MINIMIZE ? "minimization" : "maximization";
		StringBuilder text = new StringBuilder("This is a " + direction + " problem.");

		String name = goal.getObjectiveName();
		VariableDecl variable = name != null ? model.getVariable(name) : null;
		if (variable == null)
		{
			return text.append(" Objective variable could not be determined.").toString();
		}

		String keyword = goal.getKind().getKeyword();
		int degree = ConstraintMentions.degree(model, name);
		Domain domain = variable.getDomain();
		if (domain.hasIntegerBounds())
		{
			text.append(String.format(Locale.ROOT, " The objective is to %s an objective variable with domain [%d, %d] (size %d, mean %.2f) and degree %d.",
					keyword, domain.getMin(), domain.getMax(), domain.size(), domain.getMean(), degree));
		}
		else
		{
			text.append(String.format(Locale.ROOT, " The objective is to %s an objective variable with unknown domain and degree %d.", keyword, degree));
		}

		text.append(' ').append(formulation(keyword, objective)).append('.');
		return text.toString();
	}

	/**
	 * "The objective function is in the form: minimize a where a = ..." when the objective could be
	 * rebuilt, otherwise just the goal over the placeholder.
	 */
	String formulation(String keyword, ObjectiveReconstruction objective)
	{
		String prefix = "The objective function is in the form: " + keyword + " a";
		if (!objective.isKnown())
		{
			return prefix;
		}
		ExpressionFormatter formatter = new ExpressionFormatter(model, config.getObjectiveDisplayDepth(), config.getObjectiveMaxLength());
		String expression = formatter.format(objective.getObjectiveName(), objective.getExpression().orElseThrow());
		if (expression.isEmpty() || expression.equals("a"))
		{
			return prefix;
		}
		return prefix + " where a = " + expression;
	}
}
