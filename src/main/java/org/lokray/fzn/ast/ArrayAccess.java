package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;
import org.lokray.fzn.model.ArrayDecl;

/**
 * An array element access {@code xs[3]}.
 */
public class ArrayAccess implements Argument
{
	private final Reference array;
	private final Argument index;

	public ArrayAccess(Reference array, Argument index)
	{
		this.array = array;
		this.index = index;
	}

	public Reference getArray()
	{
		return array;
	}

	public Argument getIndex()
	{
		return index;
	}

	/**
	 * Resolves the accessed element when the array is known and the index is an in-range literal.
	 *
	 * @return The element argument, or null if it cannot be determined.
	 */
	public Argument getElement()
	{
		ArrayDecl decl = array.getArray();
		if (decl == null || !(index instanceof IntLiteral literal))
		{
			return null;
		}
		return decl.getElement(literal.getValue());
	}

	@Override
	public Token getFirstToken()
	{
		return array.getFirstToken();
	}

	@Override
	public <R> R accept(ArgumentVisitor<R> visitor)
	{
		return visitor.visitArrayAccess(this);
	}

	@Override
	public String toString()
	{
		return array.getName() + "[" + index + "]";
	}
}
