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

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.lexlens.engine.catalog.PatternCatalog;
import org.lexlens.engine.om.DetectionResult;
import org.lexlens.engine.om.Discrepancy;
import org.lexlens.engine.om.DiscrepancyReport;
import org.lexlens.engine.om.EvidenceItem;
import org.lexlens.engine.om.EvidenceType;
import org.lexlens.engine.om.Severity;
import org.lexlens.engine.om.Synthesis;

/**
 * Full discrepancy analysis of one document: detection, synthesis, the
 * 0-100 discrepancy score, the IPP probability and a short summary.
 */
public final class DiscrepancyAnalyzer {

	private final DiscrepancyDetector detector;
	private final ArgumentSynthesizer synthesizer;

	public DiscrepancyAnalyzer() {
		this(new DiscrepancyDetector(), new ArgumentSynthesizer());
	}

	public DiscrepancyAnalyzer(DiscrepancyDetector detector, ArgumentSynthesizer synthesizer) {
		this.detector = detector;
		this.synthesizer = synthesizer;
	}

	public DiscrepancyReport analyze(String text, String documentId, PatternCatalog catalog) {
		DetectionResult found = detector.detect(text, catalog);
		Synthesis synthesis = synthesizer.synthesize(found.getDiscrepancies(), found.getEvidence());

		int score = discrepancyScore(found);
		double ipp = ippProbability(found);
		return DiscrepancyReport.builder()
				.documentId(documentId)
				.documentType(DocumentTypeDetector.detect(text))
				.discrepancies(found.getDiscrepancies())
				.evidence(found.getEvidence())
				.contradictions(found.getContradictions())
				.arguments(synthesis.getArguments())
				.recommendations(synthesis.getRecommendations())
				.discrepancyScore(score)
				.ippProbability(ipp)
				.summary(summary(found, score, ipp))
				.build();
	}

	/**
	 * 25 / 15 / 10 per high / medium / low discrepancy, 15 / 10 / 5 per
	 * evidence item by relevance, 10 per contradiction; capped at 100.
	 */
	static int discrepancyScore(DetectionResult r) {
		int score = 0;
		for (Discrepancy d : r.getDiscrepancies()) {
			score += d.getSeverity() == Severity.HIGH ? 25 : d.getSeverity() == Severity.MEDIUM ? 15 : 10;
		}
		for (EvidenceItem e : r.getEvidence()) {
			score += e.getRelevance() == Severity.HIGH ? 15 : e.getRelevance() == Severity.MEDIUM ? 10 : 5;
		}
		score += 10 * r.getContradictions().size();
		return Math.min(100, score);
	}

	static double ippProbability(DetectionResult r) {
		double p = 0;
		if (!r.getEvidence().isEmpty()) p += 0.3;
		p += Math.min(0.4, 0.1 * r.getDiscrepancies().size());
		Set<EvidenceType> types = r.getEvidence().stream().map(EvidenceItem::getType).collect(Collectors.toSet());
		if (types.contains(EvidenceType.STRUCTURAL_INJURY)) p += 0.2;
		if (types.contains(EvidenceType.FUNCTIONAL_LIMITATION)) p += 0.2;
		if (types.contains(EvidenceType.PROLONGED_DURATION)) p += 0.1;
		return Math.min(1.0, p);
	}

	private static String summary(DetectionResult r, int score, double ipp) {
		StringBuilder sb = new StringBuilder();
		sb.append("Discrepancias: ").append(r.getDiscrepancies().size())
				.append(" | Evidencia favorable: ").append(r.getEvidence().size())
				.append(" | Contradicciones: ").append(r.getContradictions().size())
				.append(" | Puntuación: ").append(score).append("/100")
				.append(" | Probabilidad IPP: ").append(String.format(Locale.ROOT, "%.0f%%", ipp * 100))
				.append('\n');
		if (ipp >= 0.7) {
			sb.append("Alta probabilidad de IPP: la evidencia respalda la incapacidad permanente parcial.");
		} else if (ipp >= 0.5) {
			sb.append("Probabilidad media de IPP: hay indicios, se requiere análisis adicional.");
		} else {
			sb.append("Baja probabilidad de IPP: la evidencia disponible no respalda claramente la calificación.");
		}
		List<String> top = r.getDiscrepancies().stream().limit(3).map(Discrepancy::getDescription)
				.collect(Collectors.toList());
		for (int i = 0; i < top.size(); i++) {
			sb.append('\n').append(i + 1).append(". ").append(top.get(i));
		}
		return sb.toString();
	}
}
