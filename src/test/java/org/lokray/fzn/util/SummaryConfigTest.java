package org.lokray.fzn.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class SummaryConfigTest
{
	@Test
	void defaults()
	{
		SummaryConfig config = new SummaryConfig();
		assertEquals(SummaryConfig.DEFAULT_INTRODUCED_PREFIX, config.getIntroducedPrefix());
		assertEquals(32, config.getObjectiveMaxDepth());
		assertEquals(2, config.getObjectiveDisplayDepth());
		assertEquals(100, config.getObjectiveMaxLength());
		assertEquals("", config.getDescriptionsPath());
		assertFalse(config.isDebugEnabled());
	}

	@Test
	void readsOverrides()
	{
		Properties props = new Properties();
		props.setProperty("objective.max_depth", " 8 ");
		props.setProperty("catalog.categories_path", " /tmp/cats.json ");
		props.setProperty("debug.enabled", "true");
		SummaryConfig config = new SummaryConfig(props);

		assertEquals(8, config.getObjectiveMaxDepth());
		assertEquals("/tmp/cats.json", config.getCategoriesPath());
		assertTrue(config.isDebugEnabled());
	}

	@Test
	void invalidNumbersFallBack()
	{
		Properties props = new Properties();
		props.setProperty("objective.max_depth", "deep");
		props.setProperty("objective.max_length", "-4");
		SummaryConfig config = new SummaryConfig(props);

		assertEquals(32, config.getObjectiveMaxDepth());
		assertEquals(100, config.getObjectiveMaxLength());
	}

	@Test
	void invalidNumbersAreReportedAsWarnings()
	{
		Properties props = new Properties();
		props.setProperty("objective.max_depth", "deep");
		props.setProperty("objective.max_length", "-4");
		ErrorReporter reporter = new ErrorReporter();
		reporter.setEcho(false);

		new SummaryConfig(props, reporter);

		assertEquals(List.of("[Warning] 'objective.max_depth' is not a number (deep). Using 32.",
				"[Warning] 'objective.max_length' must be positive (-4). Using 100."), reporter.getWarnings());
		assertFalse(reporter.hasErrors());
	}
}
