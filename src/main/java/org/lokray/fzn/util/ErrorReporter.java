package org.lokray.fzn.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics produced while loading and parsing a FlatZinc model.
 * Errors are structural and abort the run; warnings only reduce the detail of the summary.
 */
public class ErrorReporter
{
	private final List<String> errors = new ArrayList<>();
	private final List<String> warnings = new ArrayList<>();
	private boolean echo = true; // Print diagnostics to stderr as they arrive

	/**
	 * Reports a structural error.
	 *
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(int line, int column, String message)
	{
		String formatted = "[Error] Line " + line + ", Column " + column + ": " + message;
		errors.add(formatted);
		if (echo)
		{
			System.err.println(formatted);
		}
	}

	/**
	 * Reports a non-fatal problem, such as a lookup table that could not be read.
	 *
	 * @param message The warning message.
	 */
	public void warn(String message)
	{
		String formatted = "[Warning] " + message;
		warnings.add(formatted);
		if (echo)
		{
			System.err.println(formatted);
		}
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<String> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}

	/**
	 * Turns printing to stderr on or off. Diagnostics are recorded either way.
	 */
	public void setEcho(boolean echo)
	{
		this.echo = echo;
	}

	/**
	 * Clears all recorded diagnostics.
	 */
	public void reset()
	{
		errors.clear();
		warnings.clear();
	}
}
