package org.lokray.fzn;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.fzn.util.ErrorReporter;
import org.lokray.fzn.util.SummaryConfig;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class MainTest
{
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args)
	{
		return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private static Path write(Path dir, String name, String text) throws IOException
	{
		Path file = dir.resolve(name);
		Files.writeString(file, text, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	void usageErrors()
	{
		assertEquals(Main.EXIT_USAGE, run());
		assertEquals(Main.EXIT_USAGE, run("--verbose", "model.fzn"));
		assertEquals(Main.EXIT_USAGE, run("a.fzn", "b.fzn"));
		assertEquals(Main.EXIT_USAGE, run("model.fzn", "--config"));
		assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
	}

	@Test
	void printsSummary(@TempDir Path dir) throws IOException
	{
		Path model = write(dir, "model.fzn", "var 1..10: x;\nconstraint int_le(x, 5);\nsolve minimize x;\n");

		assertEquals(Main.EXIT_OK, run("--categorize-constraints", model.toString()));
		String text = out.toString(StandardCharsets.UTF_8);
		assertTrue(text.startsWith("Problem:\n  This is a minimization problem."));
		assertTrue(text.contains("Comparison: 1 type, 1 constraint"));
	}

	@Test
	void parseFailureExitsWithOne(@TempDir Path dir) throws IOException
	{
		Path model = write(dir, "broken.fzn", "var int: x;\nconstraint int_le(x, 5;\nsolve satisfy;\n");

		assertEquals(Main.EXIT_FAILURE, run(model.toString()));
		String messages = err.toString(StandardCharsets.UTF_8);
		assertTrue(messages.contains("[Error] Line 2, Column 1:"));
		assertTrue(messages.contains("no summary was produced"));
		assertEquals("", out.toString(StandardCharsets.UTF_8));
	}

	@Test
	void unreadableModelExitsWithOne(@TempDir Path dir)
	{
		assertEquals(Main.EXIT_FAILURE, run(dir.resolve("absent.fzn").toString()));
	}

	@Test
	void missingExplicitConfigExitsWithOne(@TempDir Path dir) throws IOException
	{
		Path model = write(dir, "model.fzn", "solve satisfy;\n");
		assertEquals(Main.EXIT_FAILURE, run("--config", dir.resolve("none.conf").toString(), model.toString()));
	}

	@Test
	void explicitConfigIsApplied(@TempDir Path dir) throws IOException
	{
		Path config = write(dir, "fzn-summary.conf", "objective.max_length = 12\nmodel.introduced_prefix = TMP_\n");
		ErrorReporter reporter = new ErrorReporter();
		reporter.setEcho(false);
		SummaryConfig loaded = Main.loadConfiguration(config, reporter);

		assertEquals(12, loaded.getObjectiveMaxLength());
		assertEquals("TMP_", loaded.getIntroducedPrefix());
		assertTrue(reporter.getWarnings().isEmpty());
		assertThrows(IOException.class, () -> Main.loadConfiguration(dir.resolve("none.conf"), reporter));
	}

	@Test
	void configWarningsArePrintedWithTheSummary(@TempDir Path dir) throws IOException
	{
		Path config = write(dir, "fzn-summary.conf", "objective.max_depth = deep\n");
		Path model = write(dir, "model.fzn", "solve satisfy;\n");

		assertEquals(Main.EXIT_OK, run("--config", config.toString(), model.toString()));
		assertTrue(err.toString(StandardCharsets.UTF_8).contains("[Warning] 'objective.max_depth' is not a number (deep). Using 32."));
		assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Problem:"));
	}
}
