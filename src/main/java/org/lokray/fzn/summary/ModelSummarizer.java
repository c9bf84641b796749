package org.lokray.fzn.summary;

import org.lokray.fzn.analysis.ObjectiveReconstruction;
import org.lokray.fzn.analysis.ObjectiveReconstructor;
import org.lokray.fzn.analysis.SearchAnnotationExtractor;
import org.lokray.fzn.analysis.SearchStrategy;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.util.Debug;
import org.lokray.fzn.util.SummaryConfig;

import java.util.Optional;

/**
 * Puts the sections of a summary together: Problem (with the search strategy), Variables and Constraints.
 */
public class ModelSummarizer
{
	private static final String SUGGESTS = "The model suggests";

	private final SummaryConfig config;
	private final ConstraintCatalog catalog;
	private final ObjectiveReconstructor reconstructor;
	private final SearchAnnotationExtractor searchExtractor = new SearchAnnotationExtractor();

	public ModelSummarizer(SummaryConfig config, ConstraintCatalog catalog)
	{
		this.config = config;
		this.catalog = catalog;
		this.reconstructor = new ObjectiveReconstructor(config);
	}

	public String summarize(SemanticModel model, boolean categorizeConstraints)
	{
		Debug.log("Summarising model");
		Debug.indent();
		ObjectiveReconstruction objective = reconstructor.reconstruct(model);
		Optional<SearchStrategy> search = searchExtractor.extract(model.getSolveGoal());

		String problem = new ProblemDescriber(model, config).describe(objective);
		String variables = new VariableDescriber(model).describe();
		String constraints = new ConstraintDescriber(model, catalog).describe(categorizeConstraints);
		Debug.dedent();

		return "Problem:\n  " + joinProblemAndSearch(problem, new SearchDescriber(model).describe(search))
				+ "\n\nVariables:\n" + variables
				+ "\n\nConstraints:\n" + constraints;
	}

	/**
	 * "This is ... problem. Where the model suggests ..." when a strategy is given.
	 */
	static String joinProblemAndSearch(String problem, String search)
	{
		if (search.isEmpty())
		{
			return problem;
		}
		if (search.startsWith(SUGGESTS))
		{
			search = "Where the model suggests" + search.substring(SUGGESTS.length());
		}
		if (problem.isEmpty())
		{
			return search;
		}
		String trimmed = problem.endsWith(".") ? problem.substring(0, problem.length() - 1) : problem;
		return trimmed + ". " + search;
	}
}
