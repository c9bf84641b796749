package org.lokray.fzn.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the FlatZinc Lexer.
 * Each token encapsulates its type, the actual text (lexeme),
 * and its position in the source file for error reporting.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, INTEGER_LITERAL, COMMA)
	private final String lexeme;     // The actual text of the token (e.g., "x", "-12", "::")
	private final Object literal;    // The parsed value of the literal (Long, Double, String or Boolean)
	private final int line;          // The line number in the source file where the token starts
	private final int column;        // The column number in the source file where the token starts

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type    The TokenType of this token.
	 * @param lexeme  The raw string value of the token from the source text.
	 * @param literal The parsed literal value for literal tokens (e.g., for "123" it's the Long 123,
	 *                for "true" it's the Boolean true). Null for non-literal tokens.
	 * @param line    The line number where this token begins.
	 * @param column  The column number where this token begins.
	 */
	public Token(TokenType type, String lexeme, Object literal, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * Provides a string representation of the Token, useful for debugging.
	 * Format: "TokenType 'Lexeme' [Literal] (Line:Column)"
	 */
	@Override
	public String toString()
	{
		String literalStr = (literal != null) ? " [" + literal + "]" : "";
		return type + " '" + lexeme + "'" + literalStr + " (Line:" + line + ", Col:" + column + ")";
	}

	/**
	 * Tokens are equal when type, lexeme and literal match. Position is ignored.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;

		if (type != token.type)
			return false;
		if (!lexeme.equals(token.lexeme))
			return false;
		return Objects.equals(literal, token.literal);
	}

	@Override
	public int hashCode()
	{
		int result = type.hashCode();
		result = 31 * result + lexeme.hashCode();
		result = 31 * result + (literal != null ? literal.hashCode() : 0);
		return result;
	}
}
