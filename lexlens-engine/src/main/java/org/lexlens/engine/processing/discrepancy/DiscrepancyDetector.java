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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.lexlens.engine.catalog.PatternCatalog;
import org.lexlens.engine.catalog.PatternGroup;
import org.lexlens.engine.om.DetectionResult;
import org.lexlens.engine.om.Discrepancy;
import org.lexlens.engine.om.DiscrepancyType;
import org.lexlens.engine.om.EvidenceItem;
import org.lexlens.engine.om.EvidenceType;
import org.lexlens.engine.om.Severity;

/**
 * Cross-references the catalog's pattern groups to flag medical/legal
 * mismatches, collects favorable evidence and finds internal contradictions.
 * Finding nothing yields empty lists; {@link #detect} does not throw for
 * texts without matches.
 */
public final class DiscrepancyDetector {

	/** Processes shorter than this many months do not count as prolonged. */
	static final int PROLONGED_MONTHS = 12;

	private static final Pattern DURATION = Pattern.compile(
			"(?:durante\\s+)?(\\d{1,4})\\s*(mes(?:es)?|años?)(?![\\p{L}])",
			Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

	private final List<CrossReferenceRule> rules;

	public DiscrepancyDetector() {
		this(CrossReferenceRule.defaults());
	}

	public DiscrepancyDetector(List<CrossReferenceRule> rules) {
		this.rules = List.copyOf(rules);
	}

	public DetectionResult detect(String text, PatternCatalog catalog) {
		if (text == null || text.isBlank()) {
			return DetectionResult.empty();
		}
		DetectionResult.DetectionResultBuilder out = DetectionResult.builder();

		for (CrossReferenceRule rule : rules) {
			List<PatternHit> a = rule.getConditionA().find(text, catalog);
			if (a.isEmpty()) continue;
			List<PatternHit> b = rule.getConditionB().find(text, catalog);
			if (b.isEmpty()) continue;
			Discrepancy.DiscrepancyBuilder d = Discrepancy.builder()
					.type(rule.getType())
					.severity(rule.getSeverity())
					.description(rule.getDescription())
					.contradiction(b.get(0).getText())
					.argument(rule.getArgument())
					.position(a.get(0).getPosition());
			a.forEach(hit -> d.evidenceRef(hit.getText()));
			out.discrepancy(d.build());
		}

		for (PatternHit hit : PatternHit.findAll(catalog.patterns(PatternGroup.INTERNAL_CONTRADICTION), text)) {
			out.contradiction(Discrepancy.builder()
					.type(DiscrepancyType.INTERNAL_CONTRADICTION)
					.severity(Severity.HIGH)
					.description("Contradicción interna detectada en el informe")
					.evidenceRef(hit.getText())
					.contradiction(hit.getText())
					.argument("Las contradicciones internas debilitan la credibilidad del informe")
					.position(hit.getPosition())
					.build());
		}

		for (PatternHit hit : PatternHit.findAll(catalog.patterns(PatternGroup.STRUCTURAL_INJURY), text)) {
			out.evidenceItem(EvidenceItem.builder()
					.type(EvidenceType.STRUCTURAL_INJURY)
					.description("Lesión estructural grave confirmada: " + hit.getText())
					.relevance(Severity.HIGH)
					.argument("Las lesiones estructurales graves son incompatibles con LPNI")
					.position(hit.getPosition())
					.build());
		}
		for (PatternHit hit : PatternHit.findAll(catalog.patterns(PatternGroup.FUNCTIONAL_LIMITATION), text)) {
			out.evidenceItem(EvidenceItem.builder()
					.type(EvidenceType.FUNCTIONAL_LIMITATION)
					.description("Limitación funcional objetiva: " + hit.getText())
					.relevance(Severity.HIGH)
					.argument("Las limitaciones funcionales objetivas indican incapacidad para el trabajo")
					.position(hit.getPosition())
					.build());
		}
		EvidenceItem duration = prolongedDuration(text);
		if (duration != null) {
			out.evidenceItem(duration);
		}
		return out.build();
	}

	/**
	 * Evidence from the first stated duration ("N meses", "N años") when its
	 * figure reaches {@value #PROLONGED_MONTHS}. Later figures are not considered.
	 */
	static EvidenceItem prolongedDuration(String text) {
		Matcher m = DURATION.matcher(text);
		if (!m.find()) {
			return null;
		}
		int n = Integer.parseInt(m.group(1));
		if (n < PROLONGED_MONTHS) {
			return null;
		}
		return EvidenceItem.builder()
				.type(EvidenceType.PROLONGED_DURATION)
				.description("Proceso de " + n + " " + m.group(2).toLowerCase(Locale.ROOT) + " de duración")
				.relevance(Severity.MEDIUM)
				.argument("La duración prolongada descarta una simple lesión no invalidante")
				.position(m.start())
				.build();
	}
}
