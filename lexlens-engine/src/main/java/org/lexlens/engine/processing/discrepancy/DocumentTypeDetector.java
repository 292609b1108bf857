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
import java.util.stream.Collectors;

import org.lexlens.engine.om.DocumentType;

/**
 * Guesses whether a text is a ruling or a medical report by counting
 * indicator phrases. A side wins with at least three indicators and strictly
 * more than the other; anything else is generic.
 */
public final class DocumentTypeDetector {

	static final int MIN_INDICATORS = 3;

	private static final List<Pattern> RULING = compile("tribunal supremo", "sts", "sentencia", "magistrado",
			"magistrada", "fallamos", "estimamos", "desestimamos", "resuelvo", "resolvemos", "parte dispositiva",
			"fundamentos de derecho", "antecedentes de hecho");

	private static final List<Pattern> MEDICAL = compile("informe médico", "diagnóstico", "tratamiento",
			"evolución", "pronóstico", "exploración física", "pruebas complementarias", "alta médica", "baja médica",
			"limitaciones funcionales", "capacidad laboral");

	private DocumentTypeDetector() {
	}

	public static DocumentType detect(String text) {
		if (text == null || text.isBlank()) return DocumentType.GENERIC;
		long ruling = RULING.stream().filter(p -> p.matcher(text).find()).count();
		long medical = MEDICAL.stream().filter(p -> p.matcher(text).find()).count();
		if (ruling > medical && ruling >= MIN_INDICATORS) return DocumentType.RULING;
		if (medical > ruling && medical >= MIN_INDICATORS) return DocumentType.MEDICAL_REPORT;
		return DocumentType.GENERIC;
	}

	private static List<Pattern> compile(String... phrases) {
		return List.of(phrases).stream()
				.map(s -> Pattern.compile("(?<![\\p{L}\\p{N}])" + s.replace(" ", "\\s+") + "(?![\\p{L}\\p{N}])",
						Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
				.collect(Collectors.toUnmodifiableList());
	}
}
