package org.lexlens.engine.processing.extract;

/*
 * This file is part of LexLens.
 *
 * Copyright (C) 2025 LexLens contributors
 *
 * LexLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * LexLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with LexLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.lexlens.engine.catalog.CatalogLoader;
import org.lexlens.engine.catalog.PatternCatalog;
import org.lexlens.engine.om.CategoryMatches;
import org.lexlens.engine.om.Occurrence;

class PhraseExtractorTest {

	private static final PatternCatalog CATALOG = CatalogLoader.defaults();

	// --- helpers -------------------------------------------------------------

	private static PatternCatalog small() {
		Map<String, List<String>> phrases = new LinkedHashMap<>();
		phrases.put("lesiones_hombro", List.of("manguito rotador", "hombro"));
		phrases.put("inss", List.of("INSS"));
		phrases.put("sin_uso", List.of("nunca aparece"));
		return PatternCatalog.of(phrases, null);
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void no_matches_gives_empty_map() {
		assertTrue(PhraseExtractor.extractOccurrences("Texto sin términos relevantes.", CATALOG, "d", 100).isEmpty());
		assertTrue(PhraseExtractor.extractOccurrences("", CATALOG, "d", 100).isEmpty());
		assertTrue(PhraseExtractor.extractOccurrences(null, CATALOG, "d", 100).isEmpty());
	}

	@Test
	void categories_with_matches_only_in_catalog_order() {
		String text = "El INSS valora el hombro.\nRotura del Manguito-Rotador.";
		Map<String, CategoryMatches> out = PhraseExtractor.extractOccurrences(text, small(), "d", 10);

		assertEquals(List.of("lesiones_hombro", "inss"), List.copyOf(out.keySet()));
		CategoryMatches shoulder = out.get("lesiones_hombro");
		assertEquals(2, shoulder.getTotal());
		assertEquals("hombro", shoulder.getOccurrences().get(0).getPhrase());
		assertEquals(1, shoulder.getOccurrences().get(0).getLine());
		Occurrence cuff = shoulder.getOccurrences().get(1);
		assertEquals("Manguito-Rotador", cuff.getMatchedText());
		assertEquals(2, cuff.getLine());
		assertEquals("d", cuff.getDocumentId());
	}

	@Test
	void every_occurrence_points_at_its_match() {
		String text = "Sentencia del TSJ.\nEl INSS denegó la incapacidad permanente parcial solicitada por la limpiadora,"
				+ " con secuelas en el hombro tras la reclamación previa.\nFALLAMOS: estimamos la demanda.";
		Map<String, CategoryMatches> out = PhraseExtractor.extractOccurrences(text, CATALOG, "doc", 15);

		assertTrue(out.size() >= 4);
		for (CategoryMatches m : out.values()) {
			assertTrue(m.getTotal() > 0);
			for (Occurrence o : m.getOccurrences()) {
				assertTrue(o.getPosition() >= 0 && o.getPosition() < text.length());
				String at = text.substring(o.getPosition(), o.getPosition() + o.getMatchedText().length());
				assertEquals(o.getMatchedText(), at);
				assertEquals(o.getPhrase().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", " "),
						at.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", " "));
				assertTrue(o.getContext().contains(o.getMatchedText()));
				assertTrue(o.getContext().length() <= o.getMatchedText().length() + 30);
				long newlines = text.substring(0, o.getPosition()).chars().filter(c -> c == '\n').count();
				assertEquals(newlines + 1, o.getLine());
			}
		}
	}

	@Test
	void context_is_clipped_to_text_bounds() {
		Map<String, CategoryMatches> out = PhraseExtractor.extractOccurrences("INSS", small(), "d", 100);
		assertEquals("INSS", out.get("inss").getOccurrences().get(0).getContext());
	}

	@Test
	void negative_context_window_is_rejected() {
		assertThrows(IllegalArgumentException.class, () -> new PhraseExtractor(() -> CATALOG, -1));
	}
}
