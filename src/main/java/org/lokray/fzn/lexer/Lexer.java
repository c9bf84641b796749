package org.lokray.fzn.lexer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads the raw FlatZinc text and converts it into a stream of Tokens.
 * <p>
 * Scanning never fails: whitespace and {@code %} comments are skipped, unknown characters become
 * single-character {@link TokenType#UNKNOWN} tokens and a string that runs off the end of the input
 * becomes an {@link TokenType#UNTERMINATED_STRING} token. Rejecting those is the parser's job.
 * <p>
 * The lexer is {@link Iterable}: every call to {@link #iterator()} scans lazily from the start of the
 * text, so the token sequence can be walked more than once. {@link #scanTokens()} materializes it.
 */
public class Lexer implements Iterable<Token>
{
	private final String source; // The raw FlatZinc text

	// Static map to store reserved keywords for quick lookup
	private static final Map<String, TokenType> keywords;

	static
	{
		keywords = new HashMap<>();
		keywords.put("var", TokenType.VAR);
		keywords.put("array", TokenType.ARRAY);
		keywords.put("of", TokenType.OF);
		keywords.put("constraint", TokenType.CONSTRAINT);
		keywords.put("solve", TokenType.SOLVE);
		keywords.put("predicate", TokenType.PREDICATE);
		keywords.put("satisfy", TokenType.SATISFY);
		keywords.put("minimize", TokenType.MINIMIZE);
		keywords.put("maximize", TokenType.MAXIMIZE);
		keywords.put("int", TokenType.INT);
		keywords.put("bool", TokenType.BOOL);
		keywords.put("float", TokenType.FLOAT);
		keywords.put("set", TokenType.SET);
		keywords.put("ann", TokenType.ANN);
		keywords.put("true", TokenType.BOOLEAN_LITERAL);
		keywords.put("false", TokenType.BOOLEAN_LITERAL);
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source The FlatZinc text to tokenize.
	 */
	public Lexer(String source)
	{
		this.source = source != null ? source : "";
	}

	/**
	 * Scans the entire text and returns a list of tokens ending with an EOF token.
	 */
	public List<Token> scanTokens()
	{
		List<Token> tokens = new ArrayList<>();
		for (Token token : this)
		{
			tokens.add(token);
		}
		return tokens;
	}

	/**
	 * Returns a fresh lazy scan over the text. The last token produced is always EOF.
	 */
	@Override
	public Iterator<Token> iterator()
	{
		return new Cursor();
	}

	static boolean isIdentifierStart(char c)
	{
		return Character.isLetter(c) || c == '_';
	}

	static boolean isIdentifierPart(char c)
	{
		return Character.isLetterOrDigit(c) || c == '_';
	}

	/**
	 * One pass over the source text. Holds the scanning position so independent iterations don't interfere.
	 */
	private final class Cursor implements Iterator<Token>
	{
		private int start = 0;   // Current token's starting position in the source
		private int current = 0; // Current position in the source
		private int line = 1;    // Current line number
		private int column = 1;  // Current column number

		private int startLine = 1;
		private int startColumn = 1;

		private boolean eofEmitted = false;

		@Override
		public boolean hasNext()
		{
			return !eofEmitted;
		}

		@Override
		public Token next()
		{
			if (eofEmitted)
			{
				throw new NoSuchElementException("Token stream already reached EOF.");
			}

			while (!isAtEnd())
			{
				start = current; // Mark the beginning of the current token
				startLine = line;
				startColumn = column;

				Token token = scanToken();
				if (token != null)
				{
					return token;
				}
			}

			eofEmitted = true;
			return new Token(TokenType.EOF, "", null, line, column);
		}

		/**
		 * Scans a single token. Returns null when the consumed characters produce no token (whitespace, comments).
		 */
		private Token scanToken()
		{
			char c = advance();

			switch (c)
			{
				// --- Single-character tokens ---
				case '(':
					return makeToken(TokenType.LEFT_PAREN);
				case ')':
					return makeToken(TokenType.RIGHT_PAREN);
				case '{':
					return makeToken(TokenType.LEFT_BRACE);
				case '}':
					return makeToken(TokenType.RIGHT_BRACE);
				case '[':
					return makeToken(TokenType.LEFT_BRACKET);
				case ']':
					return makeToken(TokenType.RIGHT_BRACKET);
				case ',':
					return makeToken(TokenType.COMMA);
				case ';':
					return makeToken(TokenType.SEMICOLON);
				case '=':
					return makeToken(TokenType.ASSIGN);

				// --- One or two characters ---
				case ':':
					return makeToken(match(':') ? TokenType.COLON_COLON : TokenType.COLON);
				case '.':
					return makeToken(match('.') ? TokenType.DOT_DOT : TokenType.UNKNOWN);
				case '-':
				case '+':
					if (Character.isDigit(peek()))
					{
						return scanNumber();
					}
					return makeToken(TokenType.UNKNOWN);

				// --- Comments ---
				case '%':
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
					return null;

				// --- Literals ---
				case '"':
					return scanString();

				// --- Whitespace ---
				case ' ':
				case '\r':
				case '\t':
					return null;
				case '\n':
					line++;
					column = 1;
					return null;

				default:
					if (Character.isDigit(c))
					{
						return scanNumber();
					}
					if (isIdentifierStart(c))
					{
						return scanIdentifier();
					}
					return makeToken(TokenType.UNKNOWN);
			}
		}

		/**
		 * Scans an identifier or keyword. Keywords are looked up in the static map.
		 */
		private Token scanIdentifier()
		{
			while (isIdentifierPart(peek()))
			{
				advance();
			}

			String text = source.substring(start, current);
			TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
			if (type == TokenType.BOOLEAN_LITERAL)
			{
				return makeToken(type, Boolean.parseBoolean(text));
			}
			return makeToken(type);
		}

		/**
		 * Scans an integer or float literal, with an optional leading sign already consumed.
		 * Handles {@code 0x} / {@code 0o} integer prefixes, fractions and exponents.
		 * A literal too large for a long keeps a null value; the parser reports it.
		 */
		private Token scanNumber()
		{
			int digitsStart = current - 1;
			if (!Character.isDigit(source.charAt(digitsStart)))
			{
				digitsStart = current; // Sign consumed, first digit is at current
				advance();
			}
			boolean negative = source.charAt(start) == '-';

			// Hexadecimal and octal integers
			if (source.charAt(digitsStart) == '0' && (peek() == 'x' || peek() == 'o') && isRadixDigit(peekNext(), peek() == 'x' ? 16 : 8))
			{
				int radix = advance() == 'x' ? 16 : 8;
				while (isRadixDigit(peek(), radix))
				{
					advance();
				}
				String digits = source.substring(digitsStart + 2, current);
				return makeToken(TokenType.INTEGER_LITERAL, parseLong((negative ? "-" : "") + digits, radix));
			}

			while (Character.isDigit(peek()))
			{
				advance();
			}

			boolean isFloatingPoint = false;
			// A '.' followed by a digit is a fraction; "1..5" must stay a range
			if (peek() == '.' && Character.isDigit(peekNext()))
			{
				isFloatingPoint = true;
				advance(); // Consume the '.'
				while (Character.isDigit(peek()))
				{
					advance();
				}
			}

			if (peek() == 'e' || peek() == 'E')
			{
				char afterE = peekNext();
				boolean signedExponent = (afterE == '+' || afterE == '-') && Character.isDigit(peekAt(2));
				if (Character.isDigit(afterE) || signedExponent)
				{
					isFloatingPoint = true;
					advance(); // 'e'
					if (signedExponent)
					{
						advance();
					}
					while (Character.isDigit(peek()))
					{
						advance();
					}
				}
			}

			String numberStr = source.substring(start, current);
			if (isFloatingPoint)
			{
				try
				{
					return makeToken(TokenType.FLOAT_LITERAL, Double.parseDouble(numberStr));
				}
				catch (NumberFormatException e)
				{
					return makeToken(TokenType.FLOAT_LITERAL, null);
				}
			}
			return makeToken(TokenType.INTEGER_LITERAL, parseLong(numberStr, 10));
		}

		private Long parseLong(String digits, int radix)
		{
			try
			{
				return Long.parseLong(digits.startsWith("+") ? digits.substring(1) : digits, radix);
			}
			catch (NumberFormatException e)
			{
				return null;
			}
		}

		private boolean isRadixDigit(char c, int radix)
		{
			return Character.digit(c, radix) >= 0;
		}

		/**
		 * Scans a double-quoted string. Supports the usual backslash escapes.
		 */
		private Token scanString()
		{
			StringBuilder value = new StringBuilder();
			while (peek() != '"' && !isAtEnd())
			{
				char c = advance();
				if (c == '\n')
				{
					line++;
					column = 1;
				}
				if (c == '\\' && !isAtEnd())
				{
					char escaped = advance();
					switch (escaped)
					{
						case 'n' -> value.append('\n');
						case 't' -> value.append('\t');
						case 'r' -> value.append('\r');
						default -> value.append(escaped);
					}
					continue;
				}
				value.append(c);
			}

			if (isAtEnd())
			{
				return makeToken(TokenType.UNTERMINATED_STRING, value.toString());
			}

			advance(); // The closing quote
			return makeToken(TokenType.STRING_LITERAL, value.toString());
		}

		private Token makeToken(TokenType type)
		{
			return makeToken(type, null);
		}

		private Token makeToken(TokenType type, Object literal)
		{
			String text = source.substring(start, current);
			return new Token(type, text, literal, startLine, startColumn);
		}

		private char advance()
		{
			char c = source.charAt(current++);
			column++;
			return c;
		}

		private boolean match(char expected)
		{
			if (isAtEnd() || source.charAt(current) != expected)
			{
				return false;
			}
			current++;
			column++;
			return true;
		}

		private char peek()
		{
			return peekAt(0);
		}

		private char peekNext()
		{
			return peekAt(1);
		}

		private char peekAt(int offset)
		{
			if (current + offset >= source.length())
			{
				return '\0';
			}
			return source.charAt(current + offset);
		}

		private boolean isAtEnd()
		{
			return current >= source.length();
		}
	}
}
