package org.lokray.fzn.semantics;

import org.lokray.fzn.ast.Argument;
import org.lokray.fzn.ast.ArgumentVisitor;
import org.lokray.fzn.ast.ArrayAccess;
import org.lokray.fzn.ast.ArrayLiteral;
import org.lokray.fzn.ast.BoolLiteral;
import org.lokray.fzn.ast.CallArgument;
import org.lokray.fzn.ast.FloatLiteral;
import org.lokray.fzn.ast.IntLiteral;
import org.lokray.fzn.ast.RangeLiteral;
import org.lokray.fzn.ast.Reference;
import org.lokray.fzn.ast.SetLiteral;
import org.lokray.fzn.ast.StringLiteral;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Collects every {@link Reference} inside an argument tree, depth first and in source order.
 */
public class ReferenceCollector implements ArgumentVisitor<Void>
{
	private final List<Reference> references = new ArrayList<>();

	public static List<Reference> collect(Argument argument)
	{
		ReferenceCollector collector = new ReferenceCollector();
		argument.accept(collector);
		return collector.references;
	}

	public static List<Reference> collect(Collection<? extends Argument> arguments)
	{
		ReferenceCollector collector = new ReferenceCollector();
		for (Argument argument : arguments)
		{
			argument.accept(collector);
		}
		return collector.references;
	}

	@Override
	public Void visitIntLiteral(IntLiteral literal)
	{
		return null;
	}

	@Override
	public Void visitFloatLiteral(FloatLiteral literal)
	{
		return null;
	}

	@Override
	public Void visitBoolLiteral(BoolLiteral literal)
	{
		return null;
	}

	@Override
	public Void visitStringLiteral(StringLiteral literal)
	{
		return null;
	}

	@Override
	public Void visitRangeLiteral(RangeLiteral range)
	{
		return null;
	}

	@Override
	public Void visitSetLiteral(SetLiteral set)
	{
		set.getElements().forEach(element -> element.accept(this));
		return null;
	}

	@Override
	public Void visitArrayLiteral(ArrayLiteral array)
	{
		array.getElements().forEach(element -> element.accept(this));
		return null;
	}

	@Override
	public Void visitReference(Reference reference)
	{
		references.add(reference);
		return null;
	}

	@Override
	public Void visitArrayAccess(ArrayAccess access)
	{
		access.getArray().accept(this);
		access.getIndex().accept(this);
		return null;
	}

	@Override
	public Void visitCall(CallArgument call)
	{
		call.getArguments().forEach(argument -> argument.accept(this));
		return null;
	}
}
