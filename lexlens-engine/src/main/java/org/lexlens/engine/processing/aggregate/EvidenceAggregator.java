package org.lexlens.engine.processing.aggregate;

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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.lexlens.engine.conf.AggregationProfile;
import org.lexlens.engine.om.AggregatePrediction;
import org.lexlens.engine.om.CategoryMatches;
import org.lexlens.engine.om.CorpusRanking;
import org.lexlens.engine.om.CorpusReport;
import org.lexlens.engine.om.CourtInstance;
import org.lexlens.engine.om.DocumentAnalysis;
import org.lexlens.engine.om.KeyFactor;
import org.lexlens.engine.om.Occurrence;
import org.lexlens.engine.om.RiskAnalysis;
import org.lexlens.engine.om.Severity;

/**
 * Merges per-document analyses into the corpus ranking, the weighted
 * favorable probability and the risk analysis.
 * <p>
 * Only processed documents contribute; analyses carrying an error are
 * counted in the report and otherwise ignored.
 */
public final class EvidenceAggregator {

	static final int KEY_FACTORS = 5;
	static final int DOMINANT_CATEGORIES = 3;

	private final AggregationProfile profile;

	public EvidenceAggregator() {
		this(AggregationProfile.defaults());
	}

	public EvidenceAggregator(AggregationProfile profile) {
		this.profile = profile;
	}

	public AggregationProfile getProfile() {
		return profile;
	}

	public CorpusReport aggregate(Collection<DocumentAnalysis> documents) {
		List<DocumentAnalysis> processed = new ArrayList<>();
		int failed = 0;
		for (DocumentAnalysis d : documents) {
			if (d.isProcessed()) {
				processed.add(d);
			} else {
				failed++;
			}
		}
		CorpusRanking ranking = rank(processed);
		return CorpusReport.builder()
				.ranking(ranking)
				.prediction(predict(processed))
				.risk(risk(ranking, processed))
				.processedDocuments(processed.size())
				.failedDocuments(failed)
				.computedAt(Instant.now())
				.build();
	}

	/** Report for an empty corpus, used as the placeholder before anything is computed. */
	public CorpusReport emptyReport() {
		return aggregate(List.of());
	}

	// ---- Ranking -------------------------------------------------------------

	/** Sums totals per category and concatenates occurrences; descending by total, stable on ties. */
	public CorpusRanking rank(List<DocumentAnalysis> documents) {
		Map<String, List<Occurrence>> merged = new LinkedHashMap<>();
		for (DocumentAnalysis d : documents) {
			for (CategoryMatches m : d.getMatches().values()) {
				merged.computeIfAbsent(m.getCategory(), k -> new ArrayList<>()).addAll(m.getOccurrences());
			}
		}
		List<CategoryMatches> entries = new ArrayList<>(merged.size());
		merged.forEach((name, occ) -> {
			if (!occ.isEmpty()) entries.add(new CategoryMatches(name, occ));
		});
		entries.sort(Comparator.comparingInt(CategoryMatches::getTotal).reversed());
		return new CorpusRanking(entries);
	}

	// ---- Prediction ----------------------------------------------------------

	public AggregatePrediction predict(List<DocumentAnalysis> documents) {
		int n = documents.size();
		if (n == 0) {
			return AggregatePrediction.builder()
					.probabilityFavorable(0.5)
					.probabilityUnfavorable(0.5)
					.rawProbability(0.5)
					.dataConfidence(0.1)
					.trend(AggregatePrediction.Trend.BALANCED)
					.method(AggregatePrediction.Method.NO_DATA)
					.build();
		}

		AggregatePrediction.AggregatePredictionBuilder out = AggregatePrediction.builder();
		List<DocumentAnalysis> favorable = new ArrayList<>();
		List<DocumentAnalysis> unfavorable = new ArrayList<>();
		double favorableWeight = 0;
		double totalWeight = 0;
		for (DocumentAnalysis d : documents) {
			double w = weightOf(CourtInstanceClassifier.classify(d.getDocumentId()));
			out.documentWeight(d.getDocumentId(), w);
			totalWeight += w;
			if (d.isFavorable()) {
				favorableWeight += w;
				favorable.add(d);
			} else {
				unfavorable.add(d);
			}
		}

		double raw = favorableWeight / totalWeight;
		double p;
		double dataConfidence;
		AggregatePrediction.Method method;
		if (n < profile.getSmallCorpusSize()) {
			p = 0.5 + (raw - 0.5) * profile.getDampening();
			dataConfidence = 0.3;
			method = AggregatePrediction.Method.DAMPENED;
		} else {
			p = Math.max(profile.getBandLow(), Math.min(profile.getBandHigh(), raw));
			dataConfidence = Math.min(0.8, n / 10.0);
			method = AggregatePrediction.Method.REALISM_BAND;
		}

		return out.probabilityFavorable(p)
				.probabilityUnfavorable(1.0 - p)
				.rawProbability(raw)
				.dataConfidence(dataConfidence)
				.favorableCount(favorable.size())
				.unfavorableCount(unfavorable.size())
				.favorableFactors(keyFactors(favorable))
				.unfavorableFactors(keyFactors(unfavorable))
				.trend(p > 0.6 ? AggregatePrediction.Trend.FAVORABLE
						: p < 0.4 ? AggregatePrediction.Trend.UNFAVORABLE : AggregatePrediction.Trend.BALANCED)
				.method(method)
				.build();
	}

	double weightOf(CourtInstance instance) {
		switch (instance) {
		case SUPREME:
			return profile.getSupremeWeight();
		case APPELLATE:
			return profile.getAppellateWeight();
		default:
			return profile.getOtherWeight();
		}
	}

	/** Categories present in the most documents of one outcome. */
	static List<KeyFactor> keyFactors(List<DocumentAnalysis> side) {
		if (side.isEmpty()) return List.of();
		Map<String, Integer> docFrequency = new LinkedHashMap<>();
		for (DocumentAnalysis d : side) {
			d.getMatches().keySet().forEach(c -> docFrequency.merge(c, 1, Integer::sum));
		}
		return docFrequency.entrySet().stream()
				.sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
				.limit(KEY_FACTORS)
				.map(e -> {
					double pct = 100.0 * e.getValue() / side.size();
					Severity impact = pct > 70 ? Severity.HIGH : pct > 40 ? Severity.MEDIUM : Severity.LOW;
					return new KeyFactor(e.getKey(), e.getValue(), pct, impact);
				})
				.collect(Collectors.toList());
	}

	// ---- Risk ----------------------------------------------------------------

	public RiskAnalysis risk(CorpusRanking ranking, List<DocumentAnalysis> documents) {
		Map<Severity, Integer> perTier = new EnumMap<>(Severity.class);
		for (CategoryMatches m : ranking.getEntries()) {
			Severity tier = profile.riskTier(m.getCategory());
			if (tier != null) perTier.merge(tier, m.getTotal(), Integer::sum);
		}
		int high = perTier.getOrDefault(Severity.HIGH, 0);
		int medium = perTier.getOrDefault(Severity.MEDIUM, 0);
		int low = perTier.getOrDefault(Severity.LOW, 0);

		int n = documents.size();
		long supreme = documents.stream()
				.filter(d -> CourtInstanceClassifier.classify(d.getDocumentId()) == CourtInstance.SUPREME).count();
		long appellate = documents.stream()
				.filter(d -> CourtInstanceClassifier.classify(d.getDocumentId()) == CourtInstance.APPELLATE).count();
		double supremeRatio = n == 0 ? 0 : (double) supreme / n;
		double appellateRatio = n == 0 ? 0 : (double) appellate / n;
		double multiplier = 1 + profile.getSupremeRiskMultiplier() * supremeRatio
				+ profile.getAppellateRiskMultiplier() * appellateRatio;
		double value = (high * 3 + medium * 2 + low) * multiplier;

		Severity level;
		if (n < profile.getSmallCorpusSize()) {
			level = value > profile.getSmallCorpusRiskThreshold() ? Severity.MEDIUM : Severity.LOW;
		} else if (value > profile.getHighRiskThreshold()) {
			level = Severity.HIGH;
		} else if (value > profile.getMediumRiskThreshold()) {
			level = Severity.MEDIUM;
		} else {
			level = Severity.LOW;
		}

		return RiskAnalysis.builder()
				.highTierOccurrences(high)
				.mediumTierOccurrences(medium)
				.lowTierOccurrences(low)
				.supremeRatio(supremeRatio)
				.appellateRatio(appellateRatio)
				.instanceMultiplier(multiplier)
				.weightedValue(value)
				.level(level)
				.dominantCategories(ranking.top(DOMINANT_CATEGORIES).stream().map(CategoryMatches::getCategory)
						.collect(Collectors.toList()))
				.recommendedActions(actionsFor(level))
				.build();
	}

	private static List<String> actionsFor(Severity level) {
		switch (level) {
		case HIGH:
			return List.of("Revisar exhaustivamente los procedimientos administrativos",
					"Verificar el cumplimiento de plazos y trámites",
					"Consultar con especialistas en derecho laboral",
					"Preparar argumentos sólidos basados en jurisprudencia");
		case MEDIUM:
			return List.of("Revisar la documentación médica", "Verificar criterios de valoración",
					"Mantener seguimiento del caso");
		default:
			return List.of("Seguimiento estándar del caso", "Mantener la documentación actualizada");
		}
	}
}
