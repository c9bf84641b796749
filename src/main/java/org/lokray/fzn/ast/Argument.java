package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;

/**
 * Base interface for every argument shape that can appear in a constraint call, an annotation,
 * an array initializer or the solve objective. The set of implementations is closed; consumers
 * dispatch through {@link ArgumentVisitor}.
 */
public interface Argument
{
	/**
	 * Accepts an ArgumentVisitor to traverse this argument.
	 *
	 * @param visitor The ArgumentVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ArgumentVisitor<R> visitor);

	/**
	 * Returns the first token that constitutes this argument, for error reporting.
	 */
	Token getFirstToken();
}
