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

import org.junit.jupiter.api.Test;

class TextWindowTest {

	@Test
	void line_numbers_count_preceding_newlines() {
		TextWindow w = new TextWindow("a\nbb\n\nccc");
		assertEquals(1, w.lineOf(0));
		assertEquals(1, w.lineOf(1));
		assertEquals(2, w.lineOf(2));
		assertEquals(3, w.lineOf(5));
		assertEquals(4, w.lineOf(6));
	}

	@Test
	void context_is_symmetric_and_clipped() {
		TextWindow w = new TextWindow("0123456789");
		assertEquals("234567", w.context(4, 6, 2));
		assertEquals("0123456789", w.context(0, 10, 50));
		assertEquals("45", w.context(4, 6, 0));
	}
}
