package org.lokray.fzn.summary;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.lokray.fzn.util.Debug;
import org.lokray.fzn.util.ErrorReporter;
import org.lokray.fzn.util.SummaryConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the two lookup tables of a {@link ConstraintCatalog}. A table comes from the file named in
 * the configuration, or from the bundled classpath resource when none is named. A table that is
 * missing or malformed is replaced by an empty one and a warning; loading never fails.
 */
public class CatalogLoader
{
	public static final String DESCRIPTIONS_RESOURCE = "/constraint-descriptions.json";
	public static final String CATEGORIES_RESOURCE = "/constraint-categories.json";

	private final ErrorReporter errorReporter;

	public CatalogLoader(ErrorReporter errorReporter)
	{
		this.errorReporter = errorReporter;
	}

	/**
	 * Both tables parsed from the categorised file.
	 */
	record Categories(Map<String, List<String>> categories, Map<String, String> descriptions)
	{
		static Categories empty()
		{
			return new Categories(Map.of(), Map.of());
		}
	}

	public ConstraintCatalog load(SummaryConfig config)
	{
		Map<String, String> descriptions = read(config.getDescriptionsPath(), DESCRIPTIONS_RESOURCE)
				.map(text -> parseDescriptions(text, source(config.getDescriptionsPath(), DESCRIPTIONS_RESOURCE)))
				.orElse(Map.of());
		Categories categories = read(config.getCategoriesPath(), CATEGORIES_RESOURCE)
				.map(text -> parseCategories(text, source(config.getCategoriesPath(), CATEGORIES_RESOURCE)))
				.orElse(Categories.empty());

		Debug.log("Loaded %d constraint description(s) and %d categorised predicate(s)", descriptions.size(), categories.categories().size());
		return new ConstraintCatalog(descriptions, categories.categories(), categories.descriptions());
	}

	/**
	 * Parses {@code {"pred": "description"}}, or the older list form
	 * {@code [{"constraint": "pred", "description": "..."}]}. The first description of a predicate wins.
	 */
	Map<String, String> parseDescriptions(String json, String source)
	{
		Map<String, String> mapping = new LinkedHashMap<>();
		try
		{
			JsonElement parsed = JsonParser.parseString(json);
			if (parsed.isJsonObject())
			{
				for (Map.Entry<String, JsonElement> entry : parsed.getAsJsonObject().entrySet())
				{
					putFirst(mapping, entry.getKey(), text(entry.getValue()));
				}
			}
			else if (parsed.isJsonArray())
			{
				for (JsonElement item : parsed.getAsJsonArray())
				{
					if (item.isJsonObject())
					{
						JsonObject obj = item.getAsJsonObject();
						putFirst(mapping, text(obj.get("constraint")), text(obj.get("description")));
					}
				}
			}
			else
			{
				errorReporter.warn("Ignoring " + source + ": expected a JSON object or array.");
			}
		}
		catch (JsonParseException e)
		{
			errorReporter.warn("Ignoring malformed " + source + ": " + e.getMessage());
			return Map.of();
		}
		return mapping;
	}

	/**
	 * Parses the categorised table:
	 * {@code {"categories": {"Cat": {"pred": "desc"}}, "multi_category": {"pred": ["Cat"]}, "uncategorized": {"pred": "desc"}}}.
	 */
	Categories parseCategories(String json, String source)
	{
		Map<String, List<String>> categories = new LinkedHashMap<>();
		Map<String, String> descriptions = new LinkedHashMap<>();
		try
		{
			JsonElement parsed = JsonParser.parseString(json);
			if (!parsed.isJsonObject())
			{
				errorReporter.warn("Ignoring " + source + ": expected a JSON object.");
				return Categories.empty();
			}
			JsonObject root = parsed.getAsJsonObject();

			JsonObject byCategory = object(root, "categories");
			for (Map.Entry<String, JsonElement> category : byCategory.entrySet())
			{
				String name = category.getKey().trim();
				if (name.isEmpty() || !category.getValue().isJsonObject())
				{
					continue;
				}
				for (Map.Entry<String, JsonElement> entry : category.getValue().getAsJsonObject().entrySet())
				{
					if (putFirst(descriptions, entry.getKey(), text(entry.getValue())) || descriptions.containsKey(entry.getKey().trim()))
					{
						addCategory(categories, entry.getKey().trim(), name);
					}
				}
			}

			for (Map.Entry<String, JsonElement> entry : object(root, "multi_category").entrySet())
			{
				if (!entry.getValue().isJsonArray() || entry.getKey().isBlank())
				{
					continue;
				}
				for (JsonElement category : entry.getValue().getAsJsonArray())
				{
					String name = text(category);
					if (name != null)
					{
						addCategory(categories, entry.getKey().trim(), name);
					}
				}
			}

			for (Map.Entry<String, JsonElement> entry : object(root, "uncategorized").entrySet())
			{
				if (putFirst(descriptions, entry.getKey(), text(entry.getValue())) || descriptions.containsKey(entry.getKey().trim()))
				{
					addCategory(categories, entry.getKey().trim(), ConstraintCatalog.UNCATEGORIZED);
				}
			}
		}
		catch (JsonParseException | IllegalStateException e)
		{
			errorReporter.warn("Ignoring malformed " + source + ": " + e.getMessage());
			return Categories.empty();
		}
		return new Categories(categories, descriptions);
	}

	private Optional<String> read(String configuredPath, String resource)
	{
		if (!configuredPath.isEmpty())
		{
			try
			{
				return Optional.of(Files.readString(Path.of(configuredPath), StandardCharsets.UTF_8));
			}
			catch (IOException e)
			{
				errorReporter.warn("Could not read " + configuredPath + " (" + e.getMessage() + "); continuing without it.");
				return Optional.empty();
			}
		}

		try (InputStream in = CatalogLoader.class.getResourceAsStream(resource))
		{
			if (in == null)
			{
				errorReporter.warn("Resource " + resource + " not found; continuing without it.");
				return Optional.empty();
			}
			return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
		}
		catch (IOException e)
		{
			errorReporter.warn("Could not read resource " + resource + " (" + e.getMessage() + "); continuing without it.");
			return Optional.empty();
		}
	}

	private static String source(String configuredPath, String resource)
	{
		return configuredPath.isEmpty() ? resource : configuredPath;
	}

	private static JsonObject object(JsonObject parent, String member)
	{
		JsonElement element = parent.get(member);
		return element != null && element.isJsonObject() ? element.getAsJsonObject() : new JsonObject();
	}

	/**
	 * @return The trimmed string value, or null for anything that is not a non-blank string.
	 */
	private static String text(JsonElement element)
	{
		if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString())
		{
			return null;
		}
		String value = element.getAsString().trim();
		return value.isEmpty() ? null : value;
	}

	private static boolean putFirst(Map<String, String> mapping, String key, String value)
	{
		if (key == null || key.isBlank() || value == null)
		{
			return false;
		}
		return mapping.putIfAbsent(key.trim(), value) == null;
	}

	private static void addCategory(Map<String, List<String>> categories, String predicate, String category)
	{
		List<String> listed = categories.computeIfAbsent(predicate, ignored -> new ArrayList<>());
		if (!listed.contains(category))
		{
			listed.add(category);
		}
	}
}
