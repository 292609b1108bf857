package org.lexlens.engine.processing.discrepancy;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.lexlens.engine.catalog.CatalogLoader;
import org.lexlens.engine.catalog.PatternCatalog;
import org.lexlens.engine.om.DiscrepancyReport;
import org.lexlens.engine.om.DocumentType;

class DiscrepancyAnalyzerTest {

	private static final PatternCatalog CATALOG = CatalogLoader.defaults();

	private final DiscrepancyAnalyzer analyzer = new DiscrepancyAnalyzer();

	@Test
	void single_mismatch_scores_and_estimates_ipp() {
		DiscrepancyReport r = analyzer.analyze("Rotura completa del manguito rotador calificada como LPNI.", "d1",
				CATALOG);

		assertEquals("d1", r.getDocumentId());
		assertEquals(1, r.getDiscrepancies().size());
		assertEquals(1, r.getEvidence().size());
		// 25 for the high discrepancy + 15 for the structural evidence
		assertEquals(40, r.getDiscrepancyScore());
		assertEquals(0.6, r.getIppProbability(), 1e-9);
		assertTrue(r.getSummary().startsWith("Discrepancias: 1 | Evidencia favorable: 1"));
		assertTrue(r.getSummary().contains("Probabilidad IPP: 60%"));
	}

	@Test
	void score_and_probability_are_capped() {
		DiscrepancyReport r = analyzer.analyze(DiscrepancyDetectorTest.MEDICAL_REPORT, "d2", CATALOG);

		assertEquals(3, r.getDiscrepancies().size());
		assertEquals(1, r.getContradictions().size());
		assertEquals(100, r.getDiscrepancyScore());
		assertEquals(1.0, r.getIppProbability(), 1e-9);
		assertEquals(DocumentType.GENERIC, r.getDocumentType());
		assertTrue(r.getSummary().contains("Alta probabilidad de IPP"));
		assertEquals(5, r.getArguments().size());
	}

	@Test
	void clean_text_gives_zero_score_and_general_advice() {
		DiscrepancyReport r = analyzer.analyze("Texto sin hallazgos.", "d3", CATALOG);
		assertEquals(0, r.getDiscrepancyScore());
		assertEquals(0.0, r.getIppProbability(), 1e-9);
		assertEquals(1, r.getRecommendations().size());
		assertTrue(r.getSummary().contains("Baja probabilidad de IPP"));
	}
}
