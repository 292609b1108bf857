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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.lexlens.engine.om.CourtInstance;

class CourtInstanceClassifierTest {

	@Test
	void classifies_by_name_markers() {
		assertEquals(CourtInstance.SUPREME, CourtInstanceClassifier.classify("STS_1234_2021.pdf"));
		assertEquals(CourtInstance.SUPREME, CourtInstanceClassifier.classify("sentencia-tribunal-supremo.txt"));
		assertEquals(CourtInstance.APPELLATE, CourtInstanceClassifier.classify("tsj-madrid-2020.pdf"));
		assertEquals(CourtInstance.APPELLATE, CourtInstanceClassifier.classify("Tribunal_Superior_Galicia.txt"));
		assertEquals(CourtInstance.OTHER, CourtInstanceClassifier.classify("juzgado_social_3.pdf"));
		assertEquals(CourtInstance.OTHER, CourtInstanceClassifier.classify("costs.pdf"));
		assertEquals(CourtInstance.OTHER, CourtInstanceClassifier.classify(null));
	}
}
