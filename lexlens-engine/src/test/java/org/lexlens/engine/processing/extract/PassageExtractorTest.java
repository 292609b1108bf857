package org.lexlens.engine.processing.extract;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.lexlens.engine.om.CitedPassage;

class PassageExtractorTest {

	@Test
	void extracts_reasoning_after_connectors_in_text_order() {
		String text = "Considerando que la actora presenta limitación funcional objetiva en el hombro. "
				+ "Por lo que procede estimar la demanda interpuesta contra el INSS.";
		List<CitedPassage> out = PassageExtractor.extract(text);

		assertEquals(2, out.size());
		assertEquals("la actora presenta limitación funcional objetiva en el hombro.", out.get(0).getText());
		assertEquals("procede estimar la demanda interpuesta contra el INSS.", out.get(1).getText());
		assertTrue(out.get(0).getPosition() < out.get(1).getPosition());
	}

	@Test
	void short_passages_are_dropped() {
		assertTrue(PassageExtractor.extract("Por ello se estima. Vistos los autos.").isEmpty());
		assertTrue(PassageExtractor.extract(null).isEmpty());
	}
}
