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

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.lexlens.engine.om.Discrepancy;
import org.lexlens.engine.om.DiscrepancyType;
import org.lexlens.engine.om.EvidenceItem;
import org.lexlens.engine.om.EvidenceType;
import org.lexlens.engine.om.LegalArgument;
import org.lexlens.engine.om.Recommendation;
import org.lexlens.engine.om.Severity;
import org.lexlens.engine.om.Synthesis;

class ArgumentSynthesizerTest {

	private final ArgumentSynthesizer synthesizer = new ArgumentSynthesizer();

	// --- helpers -------------------------------------------------------------

	private static Discrepancy discrepancy(DiscrepancyType type, String ref) {
		return Discrepancy.builder().type(type).severity(Severity.HIGH).description(type.tag()).evidenceRef(ref).build();
	}

	private static EvidenceItem evidence(EvidenceType type, String description) {
		return EvidenceItem.builder().type(type).description(description).relevance(Severity.HIGH).build();
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void nothing_found_gives_only_the_general_recommendation() {
		Synthesis s = synthesizer.synthesize(List.of(), List.of());
		assertEquals(0, s.getArguments().size());
		assertEquals(1, s.getRecommendations().size());
		assertEquals(Recommendation.Kind.GENERAL, s.getRecommendations().get(0).getKind());
	}

	@Test
	void arguments_follow_principal_specific_defense_order() {
		List<Discrepancy> ds = List.of(discrepancy(DiscrepancyType.LIMITATION_VS_DISCHARGE, "a"),
				discrepancy(DiscrepancyType.CLASSIFICATION_MISMATCH, "b"),
				discrepancy(DiscrepancyType.LIMITATION_VS_DISCHARGE, "c"));
		List<EvidenceItem> ev = List.of(evidence(EvidenceType.FUNCTIONAL_LIMITATION, "e1"),
				evidence(EvidenceType.STRUCTURAL_INJURY, "e2"), evidence(EvidenceType.STRUCTURAL_INJURY, "e3"));

		Synthesis s = synthesizer.synthesize(ds, ev);

		assertEquals(List.of(LegalArgument.Kind.PRINCIPAL, LegalArgument.Kind.SPECIFIC, LegalArgument.Kind.SPECIFIC,
				LegalArgument.Kind.DEFENSE),
				s.getArguments().stream().map(LegalArgument::getKind).collect(Collectors.toList()));
		assertEquals("Aplicación del art. 194.2 LGSS", s.getArguments().get(0).getTitle());
		assertEquals(List.of("e1", "e2"), s.getArguments().get(0).getSupportingEvidence());
		assertEquals(List.of("a", "c"), s.getArguments().get(1).getSupportingEvidence());
		assertEquals(List.of("b"), s.getArguments().get(2).getSupportingEvidence());
	}

	@Test
	void one_recommendation_block_per_evidence_type() {
		List<EvidenceItem> ev = List.of(evidence(EvidenceType.PROLONGED_DURATION, "d"),
				evidence(EvidenceType.STRUCTURAL_INJURY, "s"));
		Synthesis s = synthesizer.synthesize(List.of(discrepancy(DiscrepancyType.CLASSIFICATION_MISMATCH, "x")), ev);

		List<Recommendation> recs = s.getRecommendations();
		assertEquals(3, recs.size());
		assertEquals(Recommendation.Kind.PRINCIPAL, recs.get(0).getKind());
		assertEquals("Utilizar la evidencia de lesiones estructurales graves", recs.get(1).getTitle());
		assertEquals("Destacar la duración prolongada del proceso", recs.get(2).getTitle());
		assertEquals(Severity.MEDIUM, recs.get(2).getPriority());
	}

	@Test
	void evidence_without_discrepancies_has_no_defense_argument() {
		Synthesis s = synthesizer.synthesize(List.of(), List.of(evidence(EvidenceType.STRUCTURAL_INJURY, "s")));
		assertEquals(1, s.getArguments().size());
		assertEquals(LegalArgument.Kind.PRINCIPAL, s.getArguments().get(0).getKind());
		assertEquals(1, s.getRecommendations().size());
	}
}
