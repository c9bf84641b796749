package org.lokray.fzn.model;

public enum GoalKind
{
	SATISFY("satisfy"),
	MINIMIZE("minimize"),
	MAXIMIZE("maximize");

	private final String keyword;

	GoalKind(String keyword)
	{
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}

	public boolean isOptimisation()
	{
		return this != SATISFY;
	}
}
