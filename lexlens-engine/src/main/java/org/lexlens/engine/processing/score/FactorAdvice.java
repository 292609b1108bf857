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

import java.util.EnumMap;
import java.util.Map;

import org.lexlens.engine.om.FactorType;

/**
 * Short drafting advice per factor, bucketed at 0.8 / 0.6 / 0.4.
 */
final class FactorAdvice {

	private static final Map<FactorType, String[]> TEXT = new EnumMap<>(FactorType.class);

	static {
		TEXT.put(FactorType.STRUCTURE, new String[] {
				"Estructura excelente: incluye todos los apartados necesarios.",
				"Buena estructura; considere añadir los apartados que faltan.",
				"Estructura parcial; añada apartados como argumentos o conclusiones.",
				"Estructura deficiente; incluya hechos, argumentos, conclusiones y solicitud." });
		TEXT.put(FactorType.MEDICAL_EVIDENCE, new String[] {
				"Evidencia médica excelente.",
				"Buena evidencia médica; detalle más las lesiones y secuelas.",
				"Evidencia médica moderada; aporte informes médicos y detalle de lesiones.",
				"Evidencia médica insuficiente; aporte informes médicos y dictámenes periciales." });
		TEXT.put(FactorType.PROCEDURE, new String[] {
				"Procedimiento excelente: reclamación previa, trámites y plazos documentados.",
				"Buen procedimiento; verifique que todos los trámites estén documentados.",
				"Procedimiento moderado; documente la reclamación administrativa previa y los trámites.",
				"Procedimiento deficiente; incluya la reclamación administrativa previa y todos los trámites." });
		TEXT.put(FactorType.CONTEXT, new String[] {
				"Contexto laboral excelente.",
				"Buen contexto laboral; añada detalles sobre medidas de seguridad.",
				"Contexto laboral moderado; precise lugar de trabajo y jornada.",
				"Contexto laboral deficiente; incluya lugar de trabajo, jornada y responsabilidad empresarial." });
		TEXT.put(FactorType.TERMINOLOGY, new String[] {
				"Terminología jurídica excelente.",
				"Buena terminología jurídica; considere más términos técnicos.",
				"Terminología jurídica moderada; use términos como actor, demandado o fundamento.",
				"Terminología jurídica deficiente; use términos como actor, demandado, procedimiento o fundamento." });
	}

	private FactorAdvice() {
	}

	static String forScore(FactorType type, double score) {
		String[] text = TEXT.get(type);
		if (text == null) return "";
		if (score >= 0.8) return text[0];
		if (score >= 0.6) return text[1];
		if (score >= 0.4) return text[2];
		return text[3];
	}
}
