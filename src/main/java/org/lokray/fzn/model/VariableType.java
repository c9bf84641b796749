package org.lokray.fzn.model;

/**
 * Base types a FlatZinc scalar or array element can have.
 */
public enum VariableType
{
	BOOL("bool"),
	INT("int"),
	FLOAT("float"),
	SET_OF_INT("set of int");

	private final String keyword;

	VariableType(String keyword)
	{
		this.keyword = keyword;
	}

	/**
	 * The type as written in FlatZinc when no domain narrows it.
	 */
	public String getKeyword()
	{
		return keyword;
	}

	public boolean isInteger()
	{
		return this == INT;
	}
}
