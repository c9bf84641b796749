package org.lokray.fzn.ast;

import org.lokray.fzn.lexer.Token;
import org.lokray.fzn.model.ArrayDecl;
import org.lokray.fzn.model.Declaration;
import org.lokray.fzn.model.VariableDecl;

/**
 * A bare identifier used as an argument. It either points at the variable or array declaration
 * that was in scope when it was parsed, or is marked unresolved (annotation keywords such as
 * {@code input_order} and names internal to a solver library end up here).
 */
public class Reference implements Argument
{
	private final Token name;
	private final Declaration declaration; // Null when unresolved

	public Reference(Token name, Declaration declaration)
	{
		this.name = name;
		this.declaration = declaration;
	}

	public static Reference unresolved(Token name)
	{
		return new Reference(name, null);
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public boolean isResolved()
	{
		return declaration != null;
	}

	public Declaration getDeclaration()
	{
		return declaration;
	}

	public boolean isVariable()
	{
		return declaration instanceof VariableDecl;
	}

	public boolean isArray()
	{
		return declaration instanceof ArrayDecl;
	}

	/**
	 * @return The referenced scalar declaration, or null if this is unresolved or names an array.
	 */
	public VariableDecl getVariable()
	{
		return declaration instanceof VariableDecl variable ? variable : null;
	}

	/**
	 * @return The referenced array declaration, or null if this is unresolved or names a scalar.
	 */
	public ArrayDecl getArray()
	{
		return declaration instanceof ArrayDecl array ? array : null;
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public <R> R accept(ArgumentVisitor<R> visitor)
	{
		return visitor.visitReference(this);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
