package org.lokray.fzn.summary;

import org.lokray.fzn.lexer.Lexer;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.parser.FlatZincParser;
import org.lokray.fzn.util.ErrorReporter;

final class SummaryFixtures
{
	private SummaryFixtures()
	{
	}

	static SemanticModel parse(String source)
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.setEcho(false);
		return new FlatZincParser(new Lexer(source).scanTokens(), reporter).parse();
	}
}
