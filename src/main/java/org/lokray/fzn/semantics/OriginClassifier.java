package org.lokray.fzn.semantics;

import org.lokray.fzn.ast.Annotation;
import org.lokray.fzn.model.Origin;

import java.util.List;

/**
 * Decides whether a declaration was introduced by the MiniZinc compiler. The compiler names its
 * auxiliary variables with a fixed prefix ({@code X_INTRODUCED_} by default) and may also tag them
 * with {@code var_is_introduced}. If the compiler ever changes its naming, user variables will be
 * mislabelled; the prefix is configurable for that reason.
 */
public class OriginClassifier
{
	public static final String INTRODUCED_ANNOTATION = "var_is_introduced";

	private final String introducedPrefix;

	public OriginClassifier(String introducedPrefix)
	{
		this.introducedPrefix = introducedPrefix;
	}

	public Origin classify(String name, List<Annotation> annotations)
	{
		if (!introducedPrefix.isEmpty() && name.startsWith(introducedPrefix))
		{
			return Origin.INTRODUCED;
		}
		for (Annotation annotation : annotations)
		{
			if (INTRODUCED_ANNOTATION.equals(annotation.getName()))
			{
				return Origin.INTRODUCED;
			}
		}
		return Origin.USER;
	}

	public String getIntroducedPrefix()
	{
		return introducedPrefix;
	}
}
