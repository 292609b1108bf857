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
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.lexlens.engine.nlp.ClassifierException;
import org.lexlens.engine.nlp.ClassifierVerdict;
import org.lexlens.engine.nlp.FavorabilityClassifier;
import org.lexlens.engine.om.PredictionResult;
import org.lexlens.engine.om.Verdict;

class FavorabilityPredictorTest {

	private static final String TEXT = "Estimamos procedente la incapacidad permanente parcial.";

	private final KeywordScorer scorer = new KeywordScorer();

	@Test
	void without_classifier_rules_decide() {
		FavorabilityPredictor predictor = new FavorabilityPredictor(scorer);
		assertFalse(predictor.hasClassifier());
		assertEquals(scorer.score(TEXT), predictor.predict(TEXT, "d"));
	}

	@Test
	void classifier_verdict_overrides_label_and_confidence() throws Exception {
		FavorabilityClassifier classifier = mock(FavorabilityClassifier.class);
		when(classifier.predictFavorable(TEXT)).thenReturn(new ClassifierVerdict(false, 0.7));

		PredictionResult r = new FavorabilityPredictor(scorer, classifier).predict(TEXT, "d");

		assertFalse(r.isFavorable());
		assertEquals(0.7, r.getConfidence(), 1e-9);
		assertEquals(Verdict.UNFAVORABLE, r.getVerdict());
		assertEquals(PredictionResult.Method.CLASSIFIER, r.getMethod());
		// factor breakdown still comes from the rules
		assertEquals(scorer.score(TEXT).getFactors(), r.getFactors());
		verify(classifier).predictFavorable(TEXT);
	}

	@Test
	void classifier_confidence_is_clamped_to_band() throws Exception {
		FavorabilityClassifier classifier = mock(FavorabilityClassifier.class);
		when(classifier.predictFavorable(anyString())).thenReturn(new ClassifierVerdict(true, 0.999));
		assertEquals(0.95, new FavorabilityPredictor(scorer, classifier).predict(TEXT, "d").getConfidence(), 1e-9);

		when(classifier.predictFavorable(anyString())).thenReturn(new ClassifierVerdict(true, 0.01));
		assertEquals(0.3, new FavorabilityPredictor(scorer, classifier).predict(TEXT, "d").getConfidence(), 1e-9);
	}

	@Test
	void classifier_failure_falls_back_to_rules() throws Exception {
		FavorabilityClassifier failing = mock(FavorabilityClassifier.class);
		when(failing.predictFavorable(anyString())).thenThrow(new ClassifierException("model corrupt"));
		PredictionResult r = new FavorabilityPredictor(scorer, failing).predict(TEXT, "d");
		assertEquals(scorer.score(TEXT), r);
		assertTrue(r.isFavorable());

		FavorabilityClassifier crashing = mock(FavorabilityClassifier.class);
		when(crashing.predictFavorable(anyString())).thenThrow(new IllegalStateException("boom"));
		assertEquals(PredictionResult.Method.RULES,
				new FavorabilityPredictor(scorer, crashing).predict(TEXT, "d").getMethod());
	}

	@Test
	void unusable_classifier_output_falls_back_to_rules() throws Exception {
		FavorabilityClassifier classifier = mock(FavorabilityClassifier.class);
		when(classifier.predictFavorable(anyString())).thenReturn(null);
		PredictionResult rules = scorer.score(TEXT);
		assertEquals(rules, new FavorabilityPredictor(scorer, classifier).predict(TEXT, "d"));

		when(classifier.predictFavorable(anyString())).thenReturn(new ClassifierVerdict(true, Double.NaN));
		assertEquals(rules, new FavorabilityPredictor(scorer, classifier).predict(TEXT, "d"));
	}
}
