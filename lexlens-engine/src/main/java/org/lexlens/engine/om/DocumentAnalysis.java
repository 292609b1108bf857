package org.lexlens.engine.om;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable result of analyzing one document. An analysis carrying an
 * {@code error} is "unprocessed": it has no matches, no prediction and no
 * discrepancy report, and aggregation counts it without using it.
 */
@Value
public class DocumentAnalysis {

	String documentId;
	int textLength;
	/** Non-empty categories only, in catalog order. */
	Map<String, CategoryMatches> matches;
	PredictionResult prediction;
	DiscrepancyReport discrepancyReport;
	List<CitedPassage> citedPassages;
	String error;

	@Builder
	private DocumentAnalysis(String documentId, int textLength, Map<String, CategoryMatches> matches,
			PredictionResult prediction, DiscrepancyReport discrepancyReport, List<CitedPassage> citedPassages,
			String error) {
		this.documentId = documentId;
		this.textLength = textLength;
		this.matches = matches == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(matches));
		this.prediction = prediction;
		this.discrepancyReport = discrepancyReport;
		this.citedPassages = citedPassages == null ? List.of() : List.copyOf(citedPassages);
		this.error = error;
	}

	public static DocumentAnalysis unprocessed(String documentId, String error) {
		return DocumentAnalysis.builder()
				.documentId(documentId)
				.error(error == null ? "unknown failure" : error)
				.build();
	}

	public boolean isProcessed() {
		return error == null;
	}

	public boolean isFavorable() {
		return prediction != null && prediction.isFavorable();
	}

	public int getTotalOccurrences() {
		int n = 0;
		for (CategoryMatches m : matches.values()) {
			n += m.getTotal();
		}
		return n;
	}

	public List<Discrepancy> getDiscrepancies() {
		return discrepancyReport == null ? List.of() : discrepancyReport.getDiscrepancies();
	}

	public List<EvidenceItem> getEvidence() {
		return discrepancyReport == null ? List.of() : discrepancyReport.getEvidence();
	}

	public List<LegalArgument> getArguments() {
		return discrepancyReport == null ? List.of() : discrepancyReport.getArguments();
	}

	public List<Recommendation> getRecommendations() {
		return discrepancyReport == null ? List.of() : discrepancyReport.getRecommendations();
	}
}
