package org.lokray.fzn.summary;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ConstraintCatalogTest
{
	@Test
	void fallsBackFromTablesToBuiltInsToGenericText()
	{
		ConstraintCatalog catalog = new ConstraintCatalog(Map.of("int_eq", "From the table."), Map.of(), Map.of());

		assertEquals("From the table.", catalog.describe("int_eq", false));
		assertTrue(catalog.describe("int_lin_eq", false).startsWith("Linear equality constraints"));
		assertEquals("Constraints of type my_pred restrict relationships between variables", catalog.describe("my_pred", false));
	}

	@Test
	void categorisedDescriptionWinsOnlyWhenPreferred()
	{
		ConstraintCatalog catalog = new ConstraintCatalog(Map.of("int_eq", "Plain."), Map.of("int_eq", List.of("Comparison")),
				Map.of("int_eq", "Categorised."));

		assertEquals("Categorised.", catalog.describe("int_eq", true));
		assertEquals("Plain.", catalog.describe("int_eq", false));
	}

	@Test
	void primaryCategoryIsAlphabeticallyFirst()
	{
		ConstraintCatalog catalog = new ConstraintCatalog(Map.of(), Map.of("int_lin_le_reif", List.of("Reified", "Linear")), Map.of());

		assertEquals("Linear", catalog.primaryCategory("int_lin_le_reif"));
		assertEquals(ConstraintCatalog.UNCATEGORIZED, catalog.primaryCategory("int_eq"));
	}

	@Test
	void copiesItsInput()
	{
		Map<String, List<String>> categories = new HashMap<>();
		categories.put("int_eq", new ArrayList<>(List.of("Comparison")));
		ConstraintCatalog catalog = new ConstraintCatalog(Map.of(), categories, Map.of());
		categories.get("int_eq").add("Other");

		assertEquals(List.of("Comparison"), catalog.getCategories("int_eq"));
		assertTrue(ConstraintCatalog.empty().isEmpty());
	}
}
