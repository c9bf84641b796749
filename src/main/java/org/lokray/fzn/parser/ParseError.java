package org.lokray.fzn.parser;

/**
 * Thrown when a FlatZinc text is structurally unrecoverable. The position is that of the first
 * token of the statement being parsed, not of the token where parsing gave up.
 */
public class ParseError extends RuntimeException
{
	public enum Kind
	{
		UNEXPECTED_TOKEN,
		UNKNOWN_STATEMENT,
		UNTERMINATED_LITERAL,
		MISMATCHED_BRACKET,
		DUPLICATE_SOLVE,
		MISSING_SOLVE,
		DUPLICATE_DECLARATION,
		ARRAY_LENGTH_MISMATCH,
		INVALID_LITERAL
	}

	private final Kind kind;
	private final int line;
	private final int column;

	public ParseError(Kind kind, String message, int line, int column)
	{
		super(message);
		this.kind = kind;
		this.line = line;
		this.column = column;
	}

	public Kind getKind()
	{
		return kind;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	@Override
	public String toString()
	{
		return kind + " at line " + line + ", column " + column + ": " + getMessage();
	}
}
