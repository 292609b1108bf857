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

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.lexlens.engine.om.Discrepancy;
import org.lexlens.engine.om.DiscrepancyType;
import org.lexlens.engine.om.EvidenceItem;
import org.lexlens.engine.om.EvidenceType;
import org.lexlens.engine.om.LegalArgument;
import org.lexlens.engine.om.Recommendation;
import org.lexlens.engine.om.Severity;
import org.lexlens.engine.om.Synthesis;

/**
 * Turns findings into legal arguments and defense recommendations.
 * <p>
 * Arguments, in order: the principal art. 194.2 LGSS argument (only with
 * evidence), one specific argument per distinct discrepancy type in detection
 * order, and a defense-strategy argument (only with discrepancies).
 * Recommendations: one block for the discrepancies, one per evidence type
 * present, and the generic block only when there is nothing else.
 */
public final class ArgumentSynthesizer {

	private static final Map<DiscrepancyType, String[]> SPECIFIC = new EnumMap<>(DiscrepancyType.class);
	private static final Map<EvidenceType, String[]> EVIDENCE_BLOCKS = new EnumMap<>(EvidenceType.class);

	static {
		SPECIFIC.put(DiscrepancyType.CLASSIFICATION_MISMATCH, new String[] {
				"Incompatibilidad de la LPNI con lesiones graves",
				"Las lesiones estructurales graves documentadas son anatómicamente incompatibles con una LPNI." });
		SPECIFIC.put(DiscrepancyType.LIMITATION_VS_DISCHARGE, new String[] {
				"Contradicción entre limitaciones documentadas y alta médica",
				"Las limitaciones funcionales objetivas contradicen directamente la conclusión de alta sin limitaciones." });
		SPECIFIC.put(DiscrepancyType.EVIDENCE_VS_CONCLUSION, new String[] {
				"Prevalencia de la evidencia objetiva",
				"Las pruebas objetivas (RMN, biomecánica, cirugía) deben prevalecer sobre conclusiones de síntomas menores." });
		SPECIFIC.put(DiscrepancyType.INTERNAL_CONTRADICTION, new String[] {
				"Contradicciones internas del informe",
				"Las contradicciones internas debilitan la credibilidad de la conclusión del informe." });

		EVIDENCE_BLOCKS.put(EvidenceType.STRUCTURAL_INJURY, new String[] {
				"Utilizar la evidencia de lesiones estructurales graves",
				"Presentar informes de imagen (RMN) como prueba objetiva",
				"Argumentar que las lesiones estructurales requieren cirugía reconstructiva",
				"Demostrar que la gravedad anatómica excluye la LPNI" });
		EVIDENCE_BLOCKS.put(EvidenceType.FUNCTIONAL_LIMITATION, new String[] {
				"Enfatizar las limitaciones funcionales objetivas",
				"Presentar informes de biomecánica como prueba objetiva",
				"Demostrar que las limitaciones activas impiden el trabajo habitual",
				"Argumentar que la diferencia entre movilidad pasiva y activa es determinante" });
		EVIDENCE_BLOCKS.put(EvidenceType.PROLONGED_DURATION, new String[] {
				"Destacar la duración prolongada del proceso",
				"Documentar la cronología completa de bajas, recaídas y tratamientos",
				"Argumentar que la persistencia de limitaciones descarta una lesión no invalidante" });
	}

	public Synthesis synthesize(List<Discrepancy> discrepancies, List<EvidenceItem> evidence) {
		Synthesis.SynthesisBuilder out = Synthesis.builder();

		if (!evidence.isEmpty()) {
			out.argument(LegalArgument.builder()
					.kind(LegalArgument.Kind.PRINCIPAL)
					.title("Aplicación del art. 194.2 LGSS")
					.content("Disminución igual o superior al 33% en el rendimiento normal de la profesión habitual. "
							+ "Evidencia específica: " + evidence.size() + " elementos documentados.")
					.supportingEvidence(evidence.stream().limit(2).map(EvidenceItem::getDescription)
							.collect(Collectors.toList()))
					.strength(Severity.HIGH)
					.build());
		}

		Set<DiscrepancyType> seen = new LinkedHashSet<>();
		for (Discrepancy d : discrepancies) {
			if (!seen.add(d.getType())) continue;
			List<String> refs = discrepancies.stream().filter(x -> x.getType() == d.getType())
					.flatMap(x -> x.getEvidenceRefs().stream()).collect(Collectors.toList());
			String[] tpl = SPECIFIC.get(d.getType());
			out.argument(LegalArgument.builder()
					.kind(LegalArgument.Kind.SPECIFIC)
					.title(tpl[0])
					.content(tpl[1] + " Hallazgos: " + refs.size() + ".")
					.supportingEvidence(refs)
					.strength(d.getSeverity())
					.build());
		}

		if (!discrepancies.isEmpty()) {
			out.argument(LegalArgument.builder()
					.kind(LegalArgument.Kind.DEFENSE)
					.title("Estrategia de defensa específica")
					.content("Enfocar la defensa en las " + discrepancies.size()
							+ " discrepancias detectadas entre la evidencia médica y la calificación legal.")
					.strength(Severity.HIGH)
					.build());

			out.recommendation(Recommendation.builder()
					.kind(Recommendation.Kind.PRINCIPAL)
					.title("Enfocar la defensa en las discrepancias detectadas")
					.content("Se han detectado " + discrepancies.size()
							+ " discrepancias que pueden servir de argumento central de la defensa.")
					.action("Destacar las contradicciones entre evidencia médica y calificación legal")
					.action("Presentar la evidencia objetiva como prueba de incapacidad")
					.priority(Severity.HIGH)
					.build());
		}

		Map<EvidenceType, Long> byType = evidence.stream()
				.collect(Collectors.groupingBy(EvidenceItem::getType, () -> new EnumMap<>(EvidenceType.class),
						Collectors.counting()));
		byType.forEach((type, count) -> {
			String[] tpl = EVIDENCE_BLOCKS.get(type);
			Recommendation.RecommendationBuilder r = Recommendation.builder()
					.kind(Recommendation.Kind.EVIDENCE)
					.title(tpl[0])
					.content(count + " elemento(s) de tipo " + type.tag() + " documentados.")
					.priority(type == EvidenceType.PROLONGED_DURATION ? Severity.MEDIUM : Severity.HIGH);
			for (int i = 1; i < tpl.length; i++) {
				r.action(tpl[i]);
			}
			out.recommendation(r.build());
		});

		if (discrepancies.isEmpty() && evidence.isEmpty()) {
			out.recommendation(Recommendation.builder()
					.kind(Recommendation.Kind.GENERAL)
					.title("Estrategia general de defensa")
					.content("No se han detectado discrepancias ni evidencia específica en el documento.")
					.action("Preparar argumentos basados en el art. 194.2 LGSS")
					.action("Documentar todas las limitaciones funcionales")
					.action("Aportar evidencia de la duración del proceso")
					.priority(Severity.MEDIUM)
					.build());
		}
		return out.build();
	}
}
