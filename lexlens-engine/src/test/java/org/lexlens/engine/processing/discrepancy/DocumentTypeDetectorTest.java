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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.lexlens.engine.om.DocumentType;

class DocumentTypeDetectorTest {

	@Test
	void ruling_needs_three_indicators() {
		assertEquals(DocumentType.RULING, DocumentTypeDetector.detect(
				"SENTENCIA. Antecedentes de hecho. Fundamentos de derecho. FALLAMOS: estimamos el recurso."));
		assertEquals(DocumentType.GENERIC, DocumentTypeDetector.detect("Sentencia. Fallamos."));
	}

	@Test
	void medical_report_is_recognized() {
		assertEquals(DocumentType.MEDICAL_REPORT, DocumentTypeDetector.detect(
				"Informe médico: diagnóstico de tendinopatía, tratamiento rehabilitador y pronóstico reservado."));
	}

	@Test
	void ties_and_blank_text_are_generic() {
		assertEquals(DocumentType.GENERIC, DocumentTypeDetector.detect(
				"Sentencia del magistrado; fallamos. Informe médico con diagnóstico y tratamiento."));
		assertEquals(DocumentType.GENERIC, DocumentTypeDetector.detect(" "));
	}
}
