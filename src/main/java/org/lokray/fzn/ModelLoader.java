package org.lokray.fzn;

import org.lokray.fzn.lexer.Lexer;
import org.lokray.fzn.lexer.Token;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.parser.FlatZincParser;
import org.lokray.fzn.util.Debug;
import org.lokray.fzn.util.ErrorReporter;
import org.lokray.fzn.util.SummaryConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a FlatZinc file and runs it through the lexer and the parser.
 * All I/O happens here, before lexing starts.
 */
public class ModelLoader
{
	private final ErrorReporter errorReporter;
	private final SummaryConfig config;

	public ModelLoader(ErrorReporter errorReporter, SummaryConfig config)
	{
		this.errorReporter = errorReporter;
		this.config = config;
	}

	/**
	 * @throws IOException if the file cannot be read.
	 * @throws org.lokray.fzn.parser.ParseError if the text is not valid FlatZinc.
	 */
	public SemanticModel load(Path file) throws IOException
	{
		Debug.log("Reading %s", file);
		String text = Files.readString(file, StandardCharsets.UTF_8);
		return parse(text);
	}

	public SemanticModel parse(String text)
	{
		List<Token> tokens = new Lexer(text).scanTokens();
		Debug.log("Lexed %d tokens", tokens.size());
		return new FlatZincParser(tokens, errorReporter, config).parse();
	}
}
