package org.lokray.fzn.model;

import org.lokray.fzn.ast.Annotation;
import org.lokray.fzn.lexer.Token;

import java.util.List;

/**
 * Common view of scalar and array declarations. Both share one namespace in a model.
 */
public interface Declaration
{
	String getName();

	/**
	 * @return The identifier token of the declaration, for error reporting.
	 */
	Token getNameToken();

	Origin getOrigin();

	List<Annotation> getAnnotations();

	default boolean hasAnnotation(String name)
	{
		return getAnnotations().stream().anyMatch(a -> a.getName().equals(name));
	}
}
