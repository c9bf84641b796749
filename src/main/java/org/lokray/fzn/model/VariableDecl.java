package org.lokray.fzn.model;

import org.lokray.fzn.ast.Annotation;
import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.BoolLiteral;
import org.lokray.fzn.ast.FloatLiteral;
import org.lokray.fzn.ast.IntLiteral;
import org.lokray.fzn.ast.RangeLiteral;
import org.lokray.fzn.ast.SetLiteral;
import org.lokray.fzn.lexer.Token;

import java.util.List;

/**
 * A scalar declaration: either a decision variable ({@code var 1..10: x;}) or a parameter
 * ({@code int: n = 4;}). Parameters and constant-initialised variables are kept so that
 * references to them resolve.
 */
public class VariableDecl implements Declaration
{
	private final Token name;
	private final VariableType type;
	private final Domain domain;
	private final Origin origin;
	private final Argument initializer; // Null when the declaration binds nothing
	private final List<Annotation> annotations;
	private final boolean parameter;

	public VariableDecl(Token name, VariableType type, Domain domain, Origin origin, Argument initializer, List<Annotation> annotations, boolean parameter)
	{
		if (type == VariableType.BOOL && domain != null && !domain.isUnbounded())
		{
			throw new IllegalArgumentException("Boolean variable '" + name.getLexeme() + "' cannot carry a domain.");
		}
		this.name = name;
		this.type = type;
		this.domain = domain != null ? domain : Domain.unbounded();
		this.origin = origin;
		this.initializer = initializer;
		this.annotations = List.copyOf(annotations);
		this.parameter = parameter;
	}

	@Override
	public String getName()
	{
		return name.getLexeme();
	}

	@Override
	public Token getNameToken()
	{
		return name;
	}

	public VariableType getType()
	{
		return type;
	}

	public Domain getDomain()
	{
		return domain;
	}

	@Override
	public Origin getOrigin()
	{
		return origin;
	}

	public boolean isIntroduced()
	{
		return origin == Origin.INTRODUCED;
	}

	public Argument getInitializer()
	{
		return initializer;
	}

	public boolean hasInitializer()
	{
		return initializer != null;
	}

	@Override
	public List<Annotation> getAnnotations()
	{
		return annotations;
	}

	/**
	 * @return True for a parameter declaration (no {@code var} keyword).
	 */
	public boolean isParameter()
	{
		return parameter;
	}

	/**
	 * A declaration is constant when it is bound to a literal or its integer domain holds a single value.
	 */
	public boolean isConstant()
	{
		if (initializer instanceof IntLiteral || initializer instanceof FloatLiteral || initializer instanceof BoolLiteral
				|| initializer instanceof SetLiteral || initializer instanceof RangeLiteral)
		{
			return true;
		}
		return domain.isSingleton();
	}

	/**
	 * @return The integer value this declaration is fixed to, or null if it is not a fixed integer.
	 */
	public Long getFixedIntValue()
	{
		if (initializer instanceof IntLiteral literal)
		{
			return literal.getValue();
		}
		if (type == VariableType.INT && domain.isSingleton())
		{
			return domain.getMin();
		}
		return null;
	}

	@Override
	public String toString()
	{
		return "VariableDecl(" + getName() + ": " + type + " " + domain + ", " + origin + (parameter ? ", parameter" : "") + ")";
	}
}
