package org.lokray.fzn;

import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.parser.ParseError;
import org.lokray.fzn.summary.CatalogLoader;
import org.lokray.fzn.summary.ConstraintCatalog;
import org.lokray.fzn.summary.ModelSummarizer;
import org.lokray.fzn.util.Debug;
import org.lokray.fzn.util.ErrorReporter;
import org.lokray.fzn.util.SummaryConfig;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Entry point of fzn-summary. Parses a FlatZinc model and prints its Problem, Variables and
 * Constraints sections.
 */
public class Main
{
	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_USAGE = 2;

	private static final String USAGE = "Usage: fzn-summary [--categorize-constraints] [--config <file>] [--debug] <model.fzn>";

	public static void main(String[] args)
	{
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Runs the tool and returns its exit code instead of exiting.
	 */
	public static int run(String[] args, PrintStream out, PrintStream err)
	{
		// 1. Argument parsing for flags
		boolean categorize = false;
		boolean debug = false;
		Path configFile = null;
		List<String> mainArgs = new ArrayList<>();
		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			switch (arg)
			{
				case "--categorize-constraints" -> categorize = true;
				case "--debug" -> debug = true;
				case "--config" ->
				{
					if (i + 1 >= args.length)
					{
						err.println("Error: --config needs a file.");
						err.println(USAGE);
						return EXIT_USAGE;
					}
					configFile = Paths.get(args[++i]);
				}
				default ->
				{
					if (arg.startsWith("--"))
					{
						err.println("Error: Unknown option " + arg);
						err.println(USAGE);
						return EXIT_USAGE;
					}
					mainArgs.add(arg);
				}
			}
		}
		if (mainArgs.size() != 1)
		{
			err.println(USAGE);
			return EXIT_USAGE;
		}

		// 2. Load configuration
		ErrorReporter errorReporter = new ErrorReporter();
		errorReporter.setEcho(false);
		SummaryConfig config;
		try
		{
			config = loadConfiguration(configFile, errorReporter);
		}
		catch (IOException e)
		{
			err.println("Error: Could not read config file " + configFile + ": " + e.getMessage());
			return EXIT_FAILURE;
		}
		Debug.setEnabled(debug || config.isDebugEnabled());

		// 3. Parse the model
		Path modelFile = Paths.get(mainArgs.get(0));
		SemanticModel model;
		try
		{
			model = new ModelLoader(errorReporter, config).load(modelFile);
		}
		catch (ParseError e)
		{
			errorReporter.getWarnings().forEach(err::println);
			errorReporter.getErrors().forEach(err::println);
			err.println("Parsing failed; no summary was produced.");
			return EXIT_FAILURE;
		}
		catch (IOException e)
		{
			errorReporter.getWarnings().forEach(err::println);
			err.println("Error: Could not read " + modelFile + ": " + e.getMessage());
			return EXIT_FAILURE;
		}

		// 4. Summarise
		ConstraintCatalog catalog = new CatalogLoader(errorReporter).load(config);
		errorReporter.getWarnings().forEach(err::println);
		out.println(new ModelSummarizer(config, catalog).summarize(model, categorize));
		return EXIT_OK;
	}

	/**
	 * Reads the configuration from {@code explicitFile} when given, otherwise from
	 * {@code ~/.config/fzn-summary/fzn-summary.conf} if it exists. Missing keys take their defaults and
	 * unusable values are reported to {@code errorReporter} as warnings.
	 *
	 * @throws IOException if the explicitly named file cannot be read.
	 */
	static SummaryConfig loadConfiguration(Path explicitFile, ErrorReporter errorReporter) throws IOException
	{
		Properties props = new Properties();
		if (explicitFile != null)
		{
			try (InputStream input = new FileInputStream(explicitFile.toFile()))
			{
				props.load(input);
			}
			return new SummaryConfig(props, errorReporter);
		}

		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "fzn-summary", "fzn-summary.conf");
		if (Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
			}
			catch (IOException e)
			{
				errorReporter.warn("Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		return new SummaryConfig(props, errorReporter);
	}
}
