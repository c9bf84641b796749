package org.lokray.fzn.model;

/**
 * Whether a declaration was written by the modeller or generated by the MiniZinc compiler.
 */
public enum Origin
{
	USER,
	INTRODUCED
}
