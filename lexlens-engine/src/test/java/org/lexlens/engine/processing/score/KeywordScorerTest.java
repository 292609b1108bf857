package org.lexlens.engine.processing.score;

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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.lexlens.engine.om.FactorType;
import org.lexlens.engine.om.PredictionResult;
import org.lexlens.engine.om.ScoringFactor;
import org.lexlens.engine.om.SuccessProbability;
import org.lexlens.engine.om.Verdict;

class KeywordScorerTest {

	private final KeywordScorer scorer = new KeywordScorer();

	// --- helpers -------------------------------------------------------------

	private static Optional<ScoringFactor> factor(PredictionResult r, FactorType type) {
		return r.getFactors().stream().filter(f -> f.getType() == type).findFirst();
	}

	private static ScoringFactor factor(FactorType type, double score) {
		return ScoringFactor.builder().type(type).score(score).weight(type.defaultWeight()).build();
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void favorable_ruling_with_structure_is_favorable_above_floor() {
		String text = "FUNDAMENTOS DE DERECHO. Vistos los hechos y antecedentes, estimamos procedente la "
				+ "incapacidad permanente parcial.";
		PredictionResult r = scorer.score(text);

		assertTrue(r.isFavorable());
		assertTrue(r.getConfidence() > 0.3, () -> "confidence " + r.getConfidence());
		assertEquals(0.35, r.getScore(), 1e-9);
		assertEquals(Verdict.PARTIALLY_FAVORABLE, r.getVerdict());
		assertEquals(PredictionResult.Method.RULES, r.getMethod());
	}

	@Test
	void confidence_always_within_floor_and_ceiling() {
		List<String> texts = List.of("", "texto neutro sin nada",
				"desestimamos rechazamos denegamos infundada insuficiente negligencia",
				"estimamos procedente reconocemos concedemos acreditado justificado fundamentos conclusiones hechos "
						+ "solicitud informe médico lesiones graves accidente laboral secuelas reclamación administrativa "
						+ "previa trámites cumplidos plazos dentro notificación durante la jornada lugar de trabajo "
						+ "medidas de seguridad empresa responsabilidad actor demandado procedimiento instancia "
						+ "resolución recurso fundamento considerando");
		for (String t : texts) {
			double c = scorer.score(t).getConfidence();
			assertTrue(c >= 0.3 && c <= 0.95, () -> "confidence " + c + " for: " + t);
		}
	}

	@Test
	void strongly_favorable_text_reaches_ceiling_verdict() {
		PredictionResult r = scorer.score("estimamos procedente reconocemos fundamentos conclusiones hechos solicitud "
				+ "informe médico lesiones graves accidente laboral secuelas reclamación administrativa previa "
				+ "trámites cumplidos plazos dentro notificación durante la jornada lugar de trabajo medidas de "
				+ "seguridad empresa responsabilidad actor demandado procedimiento instancia resolución recurso "
				+ "fundamento considerando");
		assertEquals(0.95, r.getConfidence(), 1e-9);
		assertEquals(Verdict.VERY_FAVORABLE, r.getVerdict());
		assertEquals(6, r.getFactors().size());
	}

	@Test
	void unfavorable_vocabulary_gives_unfavorable_label() {
		PredictionResult r = scorer.score("Desestimamos la demanda por ser no procedente.");
		assertFalse(r.isFavorable());
		ScoringFactor lexical = factor(r, FactorType.LEXICAL).get();
		assertEquals(-1.0, lexical.getScore(), 1e-9);
		assertTrue(lexical.getDetectedElements().contains("desfavorables: 2"));
	}

	@Test
	void lexical_factor_is_left_out_without_vocabulary_hits() {
		PredictionResult r = scorer.score("El actor presentó recurso.");
		assertTrue(factor(r, FactorType.LEXICAL).isEmpty());
		assertEquals(5, r.getFactors().size());
		assertEquals(0.25, factor(r, FactorType.TERMINOLOGY).get().getScore(), 1e-9);
	}

	@Test
	void scoring_is_idempotent() {
		String text = "Estimamos la demanda; el informe médico acredita lesiones graves.";
		assertEquals(scorer.score(text), scorer.score(text));
	}

	@Test
	void more_favorable_terms_never_lower_the_score() {
		String base = "Se desestima el recurso pero estimamos la pretensión subsidiaria.";
		double previous = scorer.score(base).getScore();
		String text = base;
		for (int i = 0; i < 5; i++) {
			text = text + " Procedente.";
			double now = scorer.score(text).getScore();
			assertTrue(now >= previous, "score dropped after adding a favorable term");
			previous = now;
		}
	}

	@Test
	void success_probability_adds_bonuses_above_threshold() {
		List<ScoringFactor> factors = List.of(factor(FactorType.MEDICAL_EVIDENCE, 0.8), factor(FactorType.PROCEDURE, 0.7),
				factor(FactorType.STRUCTURE, 0.9), factor(FactorType.CONTEXT, 0.2));
		SuccessProbability p = scorer.successProbability(0.5, factors);

		assertEquals(0.65, p.getMeanFactorScore(), 1e-9);
		assertEquals(0.25, p.getBonus(), 1e-9);
		assertEquals(0.825, p.getProbability(), 1e-9);
		assertEquals(SuccessProbability.Band.VERY_HIGH, p.getBand());
	}

	@Test
	void success_probability_is_capped() {
		List<ScoringFactor> factors = List.of(factor(FactorType.MEDICAL_EVIDENCE, 1.0), factor(FactorType.PROCEDURE, 1.0),
				factor(FactorType.STRUCTURE, 1.0));
		assertEquals(0.95, scorer.successProbability(0.95, factors).getProbability(), 1e-9);
	}
}
