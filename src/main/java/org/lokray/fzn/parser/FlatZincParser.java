package org.lokray.fzn.parser;

import org.lokray.fzn.ast.Annotation;
import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.ArrayAccess;
import org.lokray.fzn.ast.ArrayLiteral;
import org.lokray.fzn.ast.BoolLiteral;
import org.lokray.fzn.ast.CallArgument;
import org.lokray.fzn.ast.FloatLiteral;
import org.lokray.fzn.ast.IntLiteral;
import org.lokray.fzn.ast.RangeLiteral;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.ast.SetLiteral;
import org.lokray.fzn.ast.StringLiteral;
import org.lokray.fzn.lexer.Token;
import org.lokray.fzn.lexer.TokenType;
import org.lokray.fzn.model.ArrayDecl;
import org.lokray.fzn.model.ConstraintCall;
import org.lokray.fzn.model.Domain;
import org.lokray.fzn.model.GoalKind;
import org.lokray.fzn.model.Origin;
import org.lokray.fzn.model.PredicateDecl;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.model.SolveGoal;
import org.lokray.fzn.model.VariableDecl;
import org.lokray.fzn.model.VariableType;
import org.lokray.fzn.semantics.OriginClassifier;
import org.lokray.fzn.semantics.ReferenceResolver;
import org.lokray.fzn.semantics.SymbolTable;
import org.lokray.fzn.util.Debug;
import org.lokray.fzn.util.ErrorReporter;
import org.lokray.fzn.util.SummaryConfig;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * The FlatZincParser is responsible for performing syntactic analysis.
 * It takes the list of tokens from the lexer and builds a {@link SemanticModel}, one
 * {@code ;}-terminated statement at a time. This parser uses a recursive-descent approach.
 * <p>
 * Identifiers inside arguments are resolved while parsing, so a name only resolves to
 * declarations that precede it. Any structural problem is fatal: it is reported through the
 * {@link ErrorReporter} and then thrown as a {@link ParseError} positioned at the first token
 * of the offending statement.
 */
public class FlatZincParser
{
	private static final Set<TokenType> CLOSERS = Set.of(TokenType.RIGHT_PAREN, TokenType.RIGHT_BRACKET, TokenType.RIGHT_BRACE);

	private final List<Token> tokens; // The list of tokens from the lexer
	private final ErrorReporter errorReporter; // For reporting parsing errors
	private final SymbolTable symbolTable = new SymbolTable("model");
	private final ReferenceResolver resolver = new ReferenceResolver(symbolTable);
	private final OriginClassifier originClassifier;
	private final SemanticModel.Builder builder = SemanticModel.builder();

	private int current = 0; // Current position in the token list
	private Token statementStart; // First token of the statement being parsed

	/**
	 * The shape of a type in a declaration: the kind of value plus the domain written with it.
	 */
	private record TypeSpec(
			VariableType type,
			Domain domain)
	{
	}

	/**
	 * Constructs a FlatZincParser with the default configuration.
	 *
	 * @param tokens        The list of tokens produced by the lexer, ending with EOF.
	 * @param errorReporter An instance of ErrorReporter for handling parsing errors.
	 */
	public FlatZincParser(List<Token> tokens, ErrorReporter errorReporter)
	{
		this(tokens, errorReporter, new SummaryConfig());
	}

	public FlatZincParser(List<Token> tokens, ErrorReporter errorReporter, SummaryConfig config)
	{
		if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.EOF)
		{
			throw new IllegalArgumentException("Token list must end with an EOF token.");
		}
		this.tokens = tokens;
		this.errorReporter = errorReporter;
		this.originClassifier = new OriginClassifier(config.getIntroducedPrefix());
		this.statementStart = tokens.get(0);
	}

	/**
	 * Parses the whole token list.
	 *
	 * @return The frozen model.
	 * @throws ParseError if the input is structurally unrecoverable or has no solve goal.
	 */
	public SemanticModel parse()
	{
		Debug.log("Parsing %d tokens", tokens.size());
		Debug.indent();
		while (!isAtEnd())
		{
			statementStart = peek();
			statement();
		}
		Debug.dedent();

		if (!builder.hasSolveGoal())
		{
			statementStart = peek();
			throw error(ParseError.Kind.MISSING_SOLVE, peek(), "Expected a 'solve' item before the end of the model.");
		}

		SemanticModel model = builder.build();
		if (!resolver.getUnresolvedNames().isEmpty())
		{
			Debug.log("%d name(s) left unresolved: %s", resolver.getUnresolvedNames().size(), resolver.getUnresolvedNames());
		}
		Debug.log("Parsed %s", model);
		return model;
	}

	/**
	 * @return Names met in arguments that matched no earlier declaration.
	 */
	public Set<String> getUnresolvedNames()
	{
		return resolver.getUnresolvedNames();
	}

	private void statement()
	{
		switch (peek().getType())
		{
			case PREDICATE -> predicateDeclaration();
			case VAR -> variableDeclaration();
			case ARRAY -> arrayDeclaration();
			case CONSTRAINT -> constraint();
			case SOLVE -> solve();
			case INT, BOOL, FLOAT, SET, INTEGER_LITERAL, FLOAT_LITERAL, LEFT_BRACE -> parameterDeclaration();
			case UNTERMINATED_STRING -> throw error(ParseError.Kind.UNTERMINATED_LITERAL, peek(), "Unterminated string literal.");
			default -> throw error(ParseError.Kind.UNKNOWN_STATEMENT, peek(),
					"Expected 'predicate', 'var', 'array', 'constraint', 'solve' or a parameter declaration.");
		}
	}

	/**
	 * Parses a predicate item. The parameter list is kept as text, only its brackets are checked.
	 * Grammar: `PREDICATE IDENTIFIER ( ... ) ;`
	 */
	private void predicateDeclaration()
	{
		consume(TokenType.PREDICATE, "Expected 'predicate'.");
		Token name = consume(TokenType.IDENTIFIER, "Expected predicate name.");
		consume(TokenType.LEFT_PAREN, "Expected '(' after predicate name.");

		Deque<TokenType> open = new ArrayDeque<>();
		open.push(TokenType.RIGHT_PAREN);
		StringBuilder parameters = new StringBuilder();
		Token last = null;
		while (true)
		{
			Token token = peek();
			if (token.getType() == TokenType.EOF || token.getType() == TokenType.SEMICOLON)
			{
				throw error(ParseError.Kind.MISMATCHED_BRACKET, token, "Unclosed bracket in parameters of predicate '" + name.getLexeme() + "'.");
			}
			if (token.getType() == TokenType.UNTERMINATED_STRING)
			{
				throw error(ParseError.Kind.UNTERMINATED_LITERAL, token, "Unterminated string literal.");
			}
			advance();
			switch (token.getType())
			{
				case LEFT_PAREN -> open.push(TokenType.RIGHT_PAREN);
				case LEFT_BRACKET -> open.push(TokenType.RIGHT_BRACKET);
				case LEFT_BRACE -> open.push(TokenType.RIGHT_BRACE);
				case RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE ->
				{
					if (open.pop() != token.getType())
					{
						throw error(ParseError.Kind.MISMATCHED_BRACKET, token, "Mismatched '" + token.getLexeme() + "' in predicate '" + name.getLexeme() + "'.");
					}
				}
				default ->
				{
				}
			}
			if (open.isEmpty())
			{
				break;
			}
			if (last != null && needsSpace(last, token))
			{
				parameters.append(' ');
			}
			parameters.append(token.getLexeme());
			last = token;
		}
		consume(TokenType.SEMICOLON, "Expected ';' after predicate declaration.");

		builder.addPredicate(new PredicateDecl(name, parameters.toString()));
		Debug.log("Predicate %s", name.getLexeme());
	}

	private static boolean needsSpace(Token previous, Token next)
	{
		if (previous.getType() == TokenType.COMMA || previous.getType() == TokenType.COLON)
		{
			return true;
		}
		boolean nextIsWord = isWord(next.getType());
		return nextIsWord && (isWord(previous.getType()) || previous.getType() == TokenType.RIGHT_BRACKET);
	}

	private static boolean isWord(TokenType type)
	{
		return switch (type)
		{
			case IDENTIFIER, VAR, ARRAY, OF, INT, BOOL, FLOAT, SET, ANN -> true;
			default -> false;
		};
	}

	/**
	 * Parses a decision variable.
	 * Grammar: `VAR TYPE : IDENTIFIER ANNOTATIONS ( = ARGUMENT )? ;`
	 */
	private void variableDeclaration()
	{
		consume(TokenType.VAR, "Expected 'var'.");
		TypeSpec typeSpec = typeSpec();
		consume(TokenType.COLON, "Expected ':' after variable type.");
		Token name = consume(TokenType.IDENTIFIER, "Expected variable name.");
		List<Annotation> annotations = annotations();

		Argument initializer = null;
		if (match(TokenType.ASSIGN))
		{
			initializer = argument();
		}
		consume(TokenType.SEMICOLON, "Expected ';' after variable declaration.");

		declareVariable(name, typeSpec, initializer, annotations, false);
	}

	/**
	 * Parses a parameter, recorded as a constant variable.
	 * Grammar: `TYPE : IDENTIFIER ANNOTATIONS = ARGUMENT ;`
	 */
	private void parameterDeclaration()
	{
		TypeSpec typeSpec = typeSpec();
		consume(TokenType.COLON, "Expected ':' after parameter type.");
		Token name = consume(TokenType.IDENTIFIER, "Expected parameter name.");
		List<Annotation> annotations = annotations();
		consume(TokenType.ASSIGN, "Expected '=' after parameter '" + name.getLexeme() + "'.");
		Argument value = argument();
		consume(TokenType.SEMICOLON, "Expected ';' after parameter declaration.");

		declareVariable(name, typeSpec, value, annotations, true);
	}

	private void declareVariable(Token name, TypeSpec typeSpec, Argument initializer, List<Annotation> annotations, boolean parameter)
	{
		requireFreshName(name);
		Origin origin = originClassifier.classify(name.getLexeme(), annotations);
		VariableDecl variable = new VariableDecl(name, typeSpec.type(), typeSpec.domain(), origin, initializer, annotations, parameter);
		symbolTable.define(variable);
		builder.addVariable(variable);
		Debug.log("%s %s: %s (%s)", parameter ? "Parameter" : "Variable", name.getLexeme(), typeSpec.domain(), origin);
	}

	/**
	 * Parses an array declaration. With an initializer the element count must match the index range.
	 * Grammar: `ARRAY [ INT .. INT ] OF VAR? TYPE : IDENTIFIER ANNOTATIONS ( = [ ARGUMENTS ] )? ;`
	 */
	private void arrayDeclaration()
	{
		consume(TokenType.ARRAY, "Expected 'array'.");
		consume(TokenType.LEFT_BRACKET, "Expected '[' after 'array'.");
		long indexLower = integerValue(consume(TokenType.INTEGER_LITERAL, "Expected index lower bound."));
		consume(TokenType.DOT_DOT, "Expected '..' in array index range.");
		long indexUpper = integerValue(consume(TokenType.INTEGER_LITERAL, "Expected index upper bound."));
		closeWith(TokenType.RIGHT_BRACKET, "array index range");
		consume(TokenType.OF, "Expected 'of' after array index range.");
		boolean isVar = match(TokenType.VAR);
		TypeSpec typeSpec = typeSpec();
		consume(TokenType.COLON, "Expected ':' after array element type.");
		Token name = consume(TokenType.IDENTIFIER, "Expected array name.");
		List<Annotation> annotations = annotations();

		List<Argument> elements = List.of();
		boolean initialized = false;
		if (match(TokenType.ASSIGN))
		{
			Token start = peek();
			if (!check(TokenType.LEFT_BRACKET))
			{
				throw error(ParseError.Kind.UNEXPECTED_TOKEN, start, "Expected '[' to start the elements of array '" + name.getLexeme() + "'.");
			}
			elements = ((ArrayLiteral) argument()).getElements();
			initialized = true;
		}
		consume(TokenType.SEMICOLON, "Expected ';' after array declaration.");

		long length = Math.max(0, indexUpper - indexLower + 1);
		if (initialized && elements.size() != length)
		{
			throw error(ParseError.Kind.ARRAY_LENGTH_MISMATCH, name,
					"Array '" + name.getLexeme() + "' declares " + length + " element(s) but is initialised with " + elements.size() + ".");
		}

		requireFreshName(name);
		Origin origin = originClassifier.classify(name.getLexeme(), annotations);
		ArrayDecl array = new ArrayDecl(name, typeSpec.type(), typeSpec.domain(), isVar, indexLower, indexUpper, elements, initialized, annotations, origin);
		symbolTable.define(array);
		builder.addArray(array);
		Debug.log("Array %s[%d..%d] of %s%s (%s)", name.getLexeme(), indexLower, indexUpper, isVar ? "var " : "", typeSpec.type().getKeyword(), origin);
	}

	/**
	 * Parses a constraint item.
	 * Grammar: `CONSTRAINT IDENTIFIER ( ARGUMENTS ) ANNOTATIONS ;`
	 */
	private void constraint()
	{
		Token keyword = consume(TokenType.CONSTRAINT, "Expected 'constraint'.");
		Token predicate = consume(TokenType.IDENTIFIER, "Expected predicate name after 'constraint'.");
		consume(TokenType.LEFT_PAREN, "Expected '(' after predicate name '" + predicate.getLexeme() + "'.");
		List<Argument> arguments = argumentList(TokenType.RIGHT_PAREN, "arguments of '" + predicate.getLexeme() + "'");
		List<Annotation> annotations = annotations();
		consume(TokenType.SEMICOLON, "Expected ';' after constraint.");

		ConstraintCall call = new ConstraintCall(keyword, predicate, arguments, annotations, builder.nextConstraintIndex());
		builder.addConstraint(call);
		Debug.log("Constraint #%d %s/%d", call.getIndex(), call.getPredicate(), call.getArity());
	}

	/**
	 * Parses the solve item. Only one is allowed per model.
	 * Grammar: `SOLVE ANNOTATIONS ( SATISFY | MINIMIZE ARGUMENT | MAXIMIZE ARGUMENT ) ;`
	 */
	private void solve()
	{
		Token keyword = consume(TokenType.SOLVE, "Expected 'solve'.");
		if (builder.hasSolveGoal())
		{
			throw error(ParseError.Kind.DUPLICATE_SOLVE, keyword, "A model has exactly one 'solve' item.");
		}
		List<Annotation> annotations = annotations();

		GoalKind kind;
		Argument objective = null;
		if (match(TokenType.SATISFY))
		{
			kind = GoalKind.SATISFY;
		}
		else if (match(TokenType.MINIMIZE))
		{
			kind = GoalKind.MINIMIZE;
			objective = argument();
		}
		else if (match(TokenType.MAXIMIZE))
		{
			kind = GoalKind.MAXIMIZE;
			objective = argument();
		}
		else
		{
			throw error(ParseError.Kind.UNEXPECTED_TOKEN, peek(), "Expected 'satisfy', 'minimize' or 'maximize'.");
		}
		consume(TokenType.SEMICOLON, "Expected ';' after solve item.");

		builder.setSolveGoal(new SolveGoal(keyword, kind, objective, annotations));
		Debug.log("Solve %s%s", kind.getKeyword(), objective != null ? " " + objective : "");
	}

	/**
	 * Parses a type as written in a declaration.
	 * Grammar: `BOOL | INT | FLOAT | INT .. INT | FLOAT .. FLOAT | { INTS } | SET OF ( INT | INT .. INT | { INTS } )`
	 */
	private TypeSpec typeSpec()
	{
		if (match(TokenType.BOOL))
		{
			return new TypeSpec(VariableType.BOOL, Domain.unbounded());
		}
		if (match(TokenType.INT))
		{
			return new TypeSpec(VariableType.INT, Domain.unbounded());
		}
		if (match(TokenType.FLOAT))
		{
			return new TypeSpec(VariableType.FLOAT, Domain.unbounded());
		}
		if (match(TokenType.SET))
		{
			consume(TokenType.OF, "Expected 'of' after 'set'.");
			if (match(TokenType.INT))
			{
				return new TypeSpec(VariableType.SET_OF_INT, Domain.unbounded());
			}
			TypeSpec element = typeSpec();
			if (element.type() != VariableType.INT)
			{
				throw error(ParseError.Kind.UNEXPECTED_TOKEN, previous(), "Only sets of integers are supported.");
			}
			return new TypeSpec(VariableType.SET_OF_INT, element.domain());
		}
		if (check(TokenType.INTEGER_LITERAL, TokenType.FLOAT_LITERAL) && check(1, TokenType.DOT_DOT))
		{
			Token lower = advance();
			advance(); // '..'
			Token upper = consume(new TokenType[]{TokenType.INTEGER_LITERAL, TokenType.FLOAT_LITERAL}, "Expected upper bound after '..'.");
			if (lower.getType() == TokenType.INTEGER_LITERAL && upper.getType() == TokenType.INTEGER_LITERAL)
			{
				return new TypeSpec(VariableType.INT, Domain.range(integerValue(lower), integerValue(upper)));
			}
			return new TypeSpec(VariableType.FLOAT, Domain.floatRange(numberValue(lower).doubleValue(), numberValue(upper).doubleValue()));
		}
		if (match(TokenType.LEFT_BRACE))
		{
			List<Long> values = new ArrayList<>();
			if (!check(TokenType.RIGHT_BRACE))
			{
				do
				{
					values.add(integerValue(consume(TokenType.INTEGER_LITERAL, "Expected an integer in set domain.")));
				}
				while (match(TokenType.COMMA));
			}
			closeWith(TokenType.RIGHT_BRACE, "set domain");
			return new TypeSpec(VariableType.INT, Domain.set(values));
		}
		throw error(ParseError.Kind.UNEXPECTED_TOKEN, peek(), "Expected a type.");
	}

	/**
	 * Parses zero or more annotations.
	 * Grammar: `( :: IDENTIFIER ( ( ARGUMENTS ) )? )*`
	 */
	private List<Annotation> annotations()
	{
		List<Annotation> annotations = new ArrayList<>();
		while (match(TokenType.COLON_COLON))
		{
			Token name = consume(TokenType.IDENTIFIER, "Expected annotation name after '::'.");
			List<Argument> arguments = List.of();
			if (match(TokenType.LEFT_PAREN))
			{
				arguments = argumentList(TokenType.RIGHT_PAREN, "arguments of annotation '" + name.getLexeme() + "'");
			}
			annotations.add(new Annotation(name, arguments));
		}
		return annotations;
	}

	/**
	 * Parses comma separated arguments up to and including the closing token. The opening token
	 * has already been consumed. A trailing comma is accepted.
	 */
	private List<Argument> argumentList(TokenType closer, String what)
	{
		List<Argument> arguments = new ArrayList<>();
		if (match(closer))
		{
			return arguments;
		}
		do
		{
			if (check(closer))
			{
				break;
			}
			arguments.add(argument());
		}
		while (match(TokenType.COMMA));
		closeWith(closer, what);
		return arguments;
	}

	/**
	 * Parses a single argument.
	 * Grammar: `INT | FLOAT | BOOL | STRING | NUMBER .. NUMBER | [ ARGUMENTS ] | { ARGUMENTS }
	 * | IDENTIFIER | IDENTIFIER [ ARGUMENT ] | IDENTIFIER ( ARGUMENTS )`
	 */
	private Argument argument()
	{
		Token token = peek();
		switch (token.getType())
		{
			case INTEGER_LITERAL, FLOAT_LITERAL:
			{
				advance();
				if (match(TokenType.DOT_DOT))
				{
					Token upper = consume(new TokenType[]{TokenType.INTEGER_LITERAL, TokenType.FLOAT_LITERAL}, "Expected upper bound after '..'.");
					return new RangeLiteral(numberValue(token), numberValue(upper), token);
				}
				if (token.getType() == TokenType.INTEGER_LITERAL)
				{
					return new IntLiteral(integerValue(token), token);
				}
				return new FloatLiteral(numberValue(token).doubleValue(), token);
			}
			case BOOLEAN_LITERAL:
				advance();
				return new BoolLiteral((Boolean) token.getLiteral(), token);
			case STRING_LITERAL:
				advance();
				return new StringLiteral((String) token.getLiteral(), token);
			case UNTERMINATED_STRING:
				throw error(ParseError.Kind.UNTERMINATED_LITERAL, token, "Unterminated string literal.");
			case LEFT_BRACKET:
				advance();
				return new ArrayLiteral(argumentList(TokenType.RIGHT_BRACKET, "array literal"), token);
			case LEFT_BRACE:
				advance();
				return new SetLiteral(argumentList(TokenType.RIGHT_BRACE, "set literal"), token);
			case IDENTIFIER:
			{
				advance();
				if (match(TokenType.LEFT_BRACKET))
				{
					Reference array = resolver.resolve(token);
					Argument index = argument();
					closeWith(TokenType.RIGHT_BRACKET, "array access on '" + token.getLexeme() + "'");
					return new ArrayAccess(array, index);
				}
				if (match(TokenType.LEFT_PAREN))
				{
					return new CallArgument(token, argumentList(TokenType.RIGHT_PAREN, "arguments of '" + token.getLexeme() + "'"));
				}
				return resolver.resolve(token);
			}
			default:
				if (CLOSERS.contains(token.getType()))
				{
					throw error(ParseError.Kind.MISMATCHED_BRACKET, token, "Unexpected '" + token.getLexeme() + "'.");
				}
				throw error(ParseError.Kind.UNEXPECTED_TOKEN, token, "Expected an argument.");
		}
	}

	/**
	 * Consumes the expected closing bracket. A different closer, a ';' or the end of input means the
	 * nesting is broken.
	 */
	private void closeWith(TokenType closer, String what)
	{
		if (match(closer))
		{
			return;
		}
		Token found = peek();
		if (CLOSERS.contains(found.getType()) || found.getType() == TokenType.SEMICOLON || found.getType() == TokenType.EOF)
		{
			throw error(ParseError.Kind.MISMATCHED_BRACKET, found, "Missing '" + closerText(closer) + "' to close " + what + ".");
		}
		if (found.getType() == TokenType.UNTERMINATED_STRING)
		{
			throw error(ParseError.Kind.UNTERMINATED_LITERAL, found, "Unterminated string literal.");
		}
		throw error(ParseError.Kind.UNEXPECTED_TOKEN, found, "Expected ',' or '" + closerText(closer) + "' in " + what + ".");
	}

	private static String closerText(TokenType closer)
	{
		return switch (closer)
		{
			case RIGHT_PAREN -> ")";
			case RIGHT_BRACKET -> "]";
			case RIGHT_BRACE -> "}";
			default -> closer.name();
		};
	}

	private void requireFreshName(Token name)
	{
		if (symbolTable.isDefined(name.getLexeme()))
		{
			throw error(ParseError.Kind.DUPLICATE_DECLARATION, name, "'" + name.getLexeme() + "' is already declared.");
		}
	}

	private long integerValue(Token token)
	{
		if (!(token.getLiteral() instanceof Long))
		{
			throw error(ParseError.Kind.INVALID_LITERAL, token, "Integer literal '" + token.getLexeme() + "' is out of range.");
		}
		return (Long) token.getLiteral();
	}

	private Number numberValue(Token token)
	{
		if (token.getType() == TokenType.INTEGER_LITERAL)
		{
			return integerValue(token);
		}
		if (!(token.getLiteral() instanceof Double))
		{
			throw error(ParseError.Kind.INVALID_LITERAL, token, "Invalid float literal '" + token.getLexeme() + "'.");
		}
		return (Double) token.getLiteral();
	}

	// --- Helper Methods for Token Manipulation ---

	private Token consume(TokenType type, String message)
	{
		if (check(type))
		{
			return advance();
		}
		throw unexpected(message);
	}

	private Token consume(TokenType[] types, String message)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				return advance();
			}
		}
		throw unexpected(message);
	}

	private ParseError unexpected(String message)
	{
		Token found = peek();
		if (found.getType() == TokenType.UNTERMINATED_STRING)
		{
			return error(ParseError.Kind.UNTERMINATED_LITERAL, found, "Unterminated string literal.");
		}
		return error(ParseError.Kind.UNEXPECTED_TOKEN, found, message);
	}

	private boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	private boolean check(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (peek().getType() == type)
			{
				return true;
			}
		}
		return false;
	}

	private boolean check(int offset, TokenType type)
	{
		return peek(offset).getType() == type;
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	private Token peek(int offset)
	{
		int index = Math.min(current + offset, tokens.size() - 1);
		return tokens.get(index);
	}

	private Token peek()
	{
		return tokens.get(current);
	}

	private Token previous()
	{
		return tokens.get(Math.max(0, current - 1));
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	/**
	 * Reports an error at the start of the current statement and builds the exception to throw.
	 *
	 * @param kind    What went wrong.
	 * @param found   The token where parsing gave up, quoted in the message.
	 * @param message The error message.
	 */
	private ParseError error(ParseError.Kind kind, Token found, String message)
	{
		String where = found.getType() == TokenType.EOF
				? " (found end of input)"
				: " (found '" + found.getLexeme() + "' at line " + found.getLine() + ", column " + found.getColumn() + ")";
		String full = message + where;
		errorReporter.report(statementStart.getLine(), statementStart.getColumn(), full);
		return new ParseError(kind, full, statementStart.getLine(), statementStart.getColumn());
	}
}
