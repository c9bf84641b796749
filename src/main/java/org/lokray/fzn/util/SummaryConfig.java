package org.lokray.fzn.util;

import java.util.Properties;

/**
 * Holds configuration settings for the summarizer, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class SummaryConfig
{
	public static final String DEFAULT_INTRODUCED_PREFIX = "X_INTRODUCED_";

	private final String introducedPrefix;
	private final int objectiveMaxDepth;
	private final int objectiveDisplayDepth;
	private final int objectiveMaxLength;
	private final String descriptionsPath;
	private final String categoriesPath;
	private final boolean debugEnabled;

	public SummaryConfig()
	{
		this(new Properties());
	}

	public SummaryConfig(Properties props)
	{
		this(props, new ErrorReporter());
	}

	/**
	 * @param errorReporter Receives a warning for each numeric setting that cannot be used.
	 */
	public SummaryConfig(Properties props, ErrorReporter errorReporter)
	{
		this.introducedPrefix = props.getProperty("model.introduced_prefix", DEFAULT_INTRODUCED_PREFIX);
		this.objectiveMaxDepth = readInt(props, "objective.max_depth", 32, errorReporter);
		this.objectiveDisplayDepth = readInt(props, "objective.display_depth", 2, errorReporter);
		this.objectiveMaxLength = readInt(props, "objective.max_length", 100, errorReporter);
		// Blank means "use the bundled classpath resource"
		this.descriptionsPath = props.getProperty("catalog.descriptions_path", "").trim();
		this.categoriesPath = props.getProperty("catalog.categories_path", "").trim();
		this.debugEnabled = Boolean.parseBoolean(props.getProperty("debug.enabled", "false"));
	}

	private static int readInt(Properties props, String key, int fallback, ErrorReporter errorReporter)
	{
		String raw = props.getProperty(key);
		if (raw == null || raw.isBlank())
		{
			return fallback;
		}
		try
		{
			int value = Integer.parseInt(raw.trim());
			if (value > 0)
			{
				return value;
			}
			errorReporter.warn("'" + key + "' must be positive (" + raw + "). Using " + fallback + ".");
			return fallback;
		}
		catch (NumberFormatException e)
		{
			errorReporter.warn("'" + key + "' is not a number (" + raw + "). Using " + fallback + ".");
			return fallback;
		}
	}

	public String getIntroducedPrefix()
	{
		return introducedPrefix;
	}

	public int getObjectiveMaxDepth()
	{
		return objectiveMaxDepth;
	}

	public int getObjectiveDisplayDepth()
	{
		return objectiveDisplayDepth;
	}

	public int getObjectiveMaxLength()
	{
		return objectiveMaxLength;
	}

	public String getDescriptionsPath()
	{
		return descriptionsPath;
	}

	public String getCategoriesPath()
	{
		return categoriesPath;
	}

	public boolean isDebugEnabled()
	{
		return debugEnabled;
	}
}
