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

import org.lexlens.engine.nlp.ClassifierException;
import org.lexlens.engine.nlp.ClassifierVerdict;
import org.lexlens.engine.nlp.FavorabilityClassifier;
import org.lexlens.engine.om.PredictionResult;
import org.lexlens.engine.util.Logger;

/**
 * Produces the verdict for a text: the keyword scorer's result, overridden by
 * the statistical classifier when one is configured and succeeds.
 * <p>
 * An override keeps the rule factor breakdown, replaces favorability and
 * confidence (clamped to the profile's band), and recomputes the label and
 * the success probability. A failing classifier is logged and the rule
 * result is returned unchanged.
 */
public final class FavorabilityPredictor {

	private final KeywordScorer scorer;
	private final FavorabilityClassifier classifier;

	public FavorabilityPredictor(KeywordScorer scorer) {
		this(scorer, null);
	}

	public FavorabilityPredictor(KeywordScorer scorer, FavorabilityClassifier classifier) {
		this.scorer = scorer;
		this.classifier = classifier;
	}

	public boolean hasClassifier() {
		return classifier != null;
	}

	public PredictionResult predict(String text, String documentId) {
		PredictionResult rules = scorer.score(text);
		if (classifier == null) {
			return rules;
		}
		ClassifierVerdict verdict;
		try {
			verdict = classifier.predictFavorable(text);
		} catch (ClassifierException | RuntimeException e) {
			Logger.warn("Classifier failed for {}; using rule-based verdict: {}", documentId, e.getMessage());
			return rules;
		}
		if (verdict == null || Double.isNaN(verdict.getConfidence())) {
			Logger.warn("Classifier returned no usable verdict for {}; using rule-based verdict", documentId);
			return rules;
		}
		double confidence = KeywordScorer.clamp(verdict.getConfidence(), scorer.getProfile().getConfidenceFloor(),
				scorer.getProfile().getConfidenceCeiling());
		return rules.toBuilder()
				.favorable(verdict.isFavorable())
				.confidence(confidence)
				.verdict(scorer.verdictFor(verdict.isFavorable(), confidence))
				.successProbability(scorer.successProbability(confidence, rules.getFactors()))
				.method(PredictionResult.Method.CLASSIFIER)
				.build();
	}
}
