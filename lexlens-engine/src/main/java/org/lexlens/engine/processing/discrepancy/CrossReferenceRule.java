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
import java.util.regex.Pattern;

import org.lexlens.engine.catalog.PatternCatalog;
import org.lexlens.engine.catalog.PatternGroup;
import org.lexlens.engine.om.DiscrepancyType;
import org.lexlens.engine.om.Severity;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * {@code conditionA AND conditionB => discrepancy}. Condition A supplies the
 * evidence references, condition B the contradicting text.
 */
@Value
@Builder
public class CrossReferenceRule {

	/** Something to look for in a text: a catalog pattern group or a fixed regex. */
	public interface Condition {
		List<PatternHit> find(String text, PatternCatalog catalog);

		static Condition group(PatternGroup group) {
			return (text, catalog) -> PatternHit.findAll(catalog.patterns(group), text);
		}

		static Condition regex(String regex) {
			Pattern p = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
			return (text, catalog) -> PatternHit.findAll(List.of(p), text);
		}
	}

	@NonNull
	Condition conditionA;
	@NonNull
	Condition conditionB;
	@NonNull
	DiscrepancyType type;
	@NonNull
	Severity severity;
	String description;
	String argument;

	/** The rules applied by default, in reporting order. */
	public static List<CrossReferenceRule> defaults() {
		return List.of(
				CrossReferenceRule.builder()
						.conditionA(Condition.group(PatternGroup.STRUCTURAL_INJURY))
						.conditionB(Condition.group(PatternGroup.LPNI_TERMINOLOGY))
						.type(DiscrepancyType.CLASSIFICATION_MISMATCH)
						.severity(Severity.HIGH)
						.description("Se documentan lesiones graves (rotura completa, cirugía reconstructiva) "
								+ "pero el caso se califica como LPNI")
						.argument("Una rotura completa del supraespinoso con cirugía reconstructiva no puede "
								+ "ser calificada como LPNI")
						.build(),
				CrossReferenceRule.builder()
						.conditionA(Condition.group(PatternGroup.FUNCTIONAL_LIMITATION))
						.conditionB(Condition.regex("alta\\s+médica.*?(?:no\\s+presenta\\s+limitación|no\\s+impide)"))
						.type(DiscrepancyType.LIMITATION_VS_DISCHARGE)
						.severity(Severity.HIGH)
						.description("Se documentan limitaciones funcionales específicas pero se da el alta "
								+ "médica sin limitaciones")
						.argument("Las limitaciones activas documentadas contradicen la conclusión de alta "
								+ "sin limitaciones")
						.build(),
				CrossReferenceRule.builder()
						.conditionA(Condition.group(PatternGroup.OBJECTIVE_EVIDENCE))
						.conditionB(Condition.regex("(?:molestias?|dolor\\s+leve|síntomas?\\s+menores?)"))
						.type(DiscrepancyType.EVIDENCE_VS_CONCLUSION)
						.severity(Severity.MEDIUM)
						.description("La evidencia objetiva de lesiones graves contradice una conclusión de "
								+ "síntomas menores")
						.argument("La evidencia objetiva (RMN, biomecánica) debe prevalecer sobre las "
								+ "conclusiones subjetivas")
						.build());
	}
}
