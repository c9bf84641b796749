package org.lokray.fzn.ast;

/**
 * Visitor over the closed set of {@link Argument} shapes.
 *
 * @param <R> The return type of the visit methods.
 */
public interface ArgumentVisitor<R>
{
	R visitIntLiteral(IntLiteral literal);

	R visitFloatLiteral(FloatLiteral literal);

	R visitBoolLiteral(BoolLiteral literal);

	R visitStringLiteral(StringLiteral literal);

	R visitRangeLiteral(RangeLiteral range);

	R visitSetLiteral(SetLiteral set);

	R visitArrayLiteral(ArrayLiteral array);

	R visitReference(Reference reference);

	R visitArrayAccess(ArrayAccess access);

	R visitCall(CallArgument call);
}
