package org.lokray.fzn.lexer;

/**
 * Defines the types of tokens recognized by the FlatZinc Lexer.
 * This enum covers keywords, literals, punctuation, and special tokens.
 */
public enum TokenType
{
	// --- Keywords ---
	// Items
	VAR, ARRAY, OF, CONSTRAINT, SOLVE, PREDICATE,

	// Solve goals
	SATISFY, MINIMIZE, MAXIMIZE,

	// Base types
	INT, BOOL, FLOAT, SET, ANN,

	// --- Literals ---
	IDENTIFIER,
	INTEGER_LITERAL,
	FLOAT_LITERAL,
	STRING_LITERAL,
	BOOLEAN_LITERAL,

	// --- Punctuation & Delimiters ---
	LEFT_PAREN, RIGHT_PAREN,       // ( )
	LEFT_BRACE, RIGHT_BRACE,       // { }
	LEFT_BRACKET, RIGHT_BRACKET,   // [ ]
	COMMA, SEMICOLON,              // , ;
	COLON, COLON_COLON,            // : ::
	ASSIGN,                        // =
	DOT_DOT,                       // ..

	// --- Special Tokens ---
	UNKNOWN,             // Any other single character, kept so the parser can point at it
	UNTERMINATED_STRING, // A string literal that runs to end of input
	EOF
}
