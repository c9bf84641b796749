package org.lokray.fzn.serialization;

import org.lokray.fzn.ast.Annotation;
import org.lokray.fzn.model.ArrayDecl;
import org.lokray.fzn.model.ConstraintCall;
import org.lokray.fzn.model.Declaration;
import org.lokray.fzn.model.Domain;
import org.lokray.fzn.model.PredicateDecl;
import org.lokray.fzn.model.SemanticModel;
import org.lokray.fzn.model.VariableDecl;
import org.lokray.fzn.model.VariableType;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes a model back out as FlatZinc, one item per line: predicates, then declarations in their
 * original order, then constraints, then the solve item. Parsing the output yields a model with the
 * same declarations, constraints and goal. Comments and layout are not preserved.
 */
public class FlatZincWriter
{
	private static final Comparator<Declaration> SOURCE_ORDER =
			Comparator.comparingInt((Declaration d) -> d.getNameToken().getLine()).thenComparingInt(d -> d.getNameToken().getColumn());

	public void write(SemanticModel model, Writer out) throws IOException
	{
		for (PredicateDecl predicate : model.getPredicates())
		{
			out.write("predicate " + predicate.getName() + "(" + predicate.getParameters() + ");\n");
		}

		List<Declaration> declarations = new ArrayList<>();
		declarations.addAll(model.getVariables().values());
		declarations.addAll(model.getArrays().values());
		declarations.sort(SOURCE_ORDER);
		for (Declaration declaration : declarations)
		{
			if (declaration instanceof VariableDecl variable)
			{
				out.write(variableItem(variable));
			}
			else
			{
				out.write(arrayItem((ArrayDecl) declaration));
			}
			out.write('\n');
		}

		for (ConstraintCall constraint : model.getConstraints())
		{
			out.write("constraint " + constraint + ";\n");
		}
		out.write(model.getSolveGoal() + ";\n");
		out.flush();
	}

	public String toText(SemanticModel model)
	{
		StringWriter out = new StringWriter();
		try
		{
			write(model, out);
		}
		catch (IOException e)
		{
			throw new UncheckedIOException(e);
		}
		return out.toString();
	}

	private String variableItem(VariableDecl variable)
	{
		StringBuilder sb = new StringBuilder();
		if (!variable.isParameter())
		{
			sb.append("var ");
		}
		sb.append(typeText(variable.getType(), variable.getDomain())).append(": ").append(variable.getName());
		sb.append(annotationText(variable.getAnnotations()));
		if (variable.hasInitializer())
		{
			sb.append(" = ").append(variable.getInitializer());
		}
		return sb.append(';').toString();
	}

	private String arrayItem(ArrayDecl array)
	{
		StringBuilder sb = new StringBuilder("array [");
		sb.append(array.getIndexLower()).append("..").append(array.getIndexUpper()).append("] of ");
		if (array.isVar())
		{
			sb.append("var ");
		}
		sb.append(typeText(array.getElementType(), array.getElementDomain())).append(": ").append(array.getName());
		sb.append(annotationText(array.getAnnotations()));
		if (array.isInitialized())
		{
			sb.append(" = ").append(array.getElements().stream().map(Object::toString).collect(Collectors.joining(",", "[", "]")));
		}
		return sb.append(';').toString();
	}

	static String typeText(VariableType type, Domain domain)
	{
		if (type == VariableType.SET_OF_INT)
		{
			return "set of " + (domain.isUnbounded() ? "int" : domain.toString());
		}
		return domain.isUnbounded() ? type.getKeyword() : domain.toString();
	}

	private static String annotationText(List<Annotation> annotations)
	{
		StringBuilder sb = new StringBuilder();
		for (Annotation annotation : annotations)
		{
			sb.append(" :: ").append(annotation);
		}
		return sb.toString();
	}
}
