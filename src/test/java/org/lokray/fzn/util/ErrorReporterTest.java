package org.lokray.fzn.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ErrorReporterTest
{
	@Test
	void keepsErrorsAndWarningsApart()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.setEcho(false);
		reporter.warn("table missing");
		assertFalse(reporter.hasErrors());

		reporter.report(4, 2, "Expected ';'.");
		assertTrue(reporter.hasErrors());
		assertEquals(List.of("[Error] Line 4, Column 2: Expected ';'."), reporter.getErrors());
		assertEquals(List.of("[Warning] table missing"), reporter.getWarnings());

		reporter.reset();
		assertFalse(reporter.hasErrors());
		assertTrue(reporter.getWarnings().isEmpty());
	}
}
