package org.lokray.fzn.model;

import org.lokray.fzn.ast.Annotation;
import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * An array declaration, e.g. {@code array [1..3] of var int: xs = [x, y, z];}.
 * Elements are references to scalar declarations or literals, in index order.
 */
public class ArrayDecl implements Declaration
{
	private final Token name;
	private final VariableType elementType;
	private final Domain elementDomain;
	private final boolean var;
	private final long indexLower;
	private final long indexUpper;
	private final List<Argument> elements;
	private final boolean initialized;
	private final List<Annotation> annotations;
	private final Origin origin;

	public ArrayDecl(Token name, VariableType elementType, Domain elementDomain, boolean var, long indexLower, long indexUpper,
					 List<Argument> elements, boolean initialized, List<Annotation> annotations, Origin origin)
	{
		this.name = name;
		this.elementType = elementType;
		this.elementDomain = elementDomain != null ? elementDomain : Domain.unbounded();
		this.var = var;
		this.indexLower = indexLower;
		this.indexUpper = indexUpper;
		this.elements = List.copyOf(elements);
		this.initialized = initialized;
		this.annotations = List.copyOf(annotations);
		this.origin = origin;
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

	public VariableType getElementType()
	{
		return elementType;
	}

	/**
	 * @return The domain written in the element type (e.g. {@code 1..5} in {@code of var 1..5}), or unbounded.
	 */
	public Domain getElementDomain()
	{
		return elementDomain;
	}

	/**
	 * @return True for an array of decision variables ({@code of var ...}), false for a parameter array.
	 */
	public boolean isVar()
	{
		return var;
	}

	public long getIndexLower()
	{
		return indexLower;
	}

	public long getIndexUpper()
	{
		return indexUpper;
	}

	/**
	 * Declared length from the index range. Zero for {@code 1..0}.
	 */
	public long getLength()
	{
		return Math.max(0, indexUpper - indexLower + 1);
	}

	public List<Argument> getElements()
	{
		return elements;
	}

	public boolean isInitialized()
	{
		return initialized;
	}

	/**
	 * Looks up an element by its declared index.
	 *
	 * @return The element, or null if the index is outside the range or the array has no initializer.
	 */
	public Argument getElement(long index)
	{
		long offset = index - indexLower;
		if (offset < 0 || offset >= elements.size())
		{
			return null;
		}
		return elements.get((int) offset);
	}

	/**
	 * Names of the scalar declarations referenced by the elements, in order. Literal elements are skipped.
	 */
	public List<String> getElementNames()
	{
		List<String> names = new ArrayList<>();
		for (Argument element : elements)
		{
			if (element instanceof Reference reference)
			{
				names.add(reference.getName());
			}
		}
		return names;
	}

	@Override
	public List<Annotation> getAnnotations()
	{
		return annotations;
	}

	@Override
	public Origin getOrigin()
	{
		return origin;
	}

	@Override
	public String toString()
	{
		return "ArrayDecl(" + getName() + ": [" + indexLower + ".." + indexUpper + "] of " + (var ? "var " : "") + elementType + ", " + elements.size() + " elements)";
	}
}
