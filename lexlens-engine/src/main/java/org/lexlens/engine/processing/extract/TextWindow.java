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

import java.util.Arrays;

/**
 * Line and context lookups over one text. Newline offsets are indexed once
 * so line numbers cost a binary search per match.
 */
public final class TextWindow {

	private final String text;
	private final int[] newlines;

	public TextWindow(String text) {
		this.text = text == null ? "" : text;
		int count = 0;
		for (int i = 0; i < this.text.length(); i++) {
			if (this.text.charAt(i) == '\n') count++;
		}
		this.newlines = new int[count];
		int n = 0;
		for (int i = 0; i < this.text.length(); i++) {
			if (this.text.charAt(i) == '\n') newlines[n++] = i;
		}
	}

	/** 1-based line of {@code offset}: newlines strictly before it, plus one. */
	public int lineOf(int offset) {
		int idx = Arrays.binarySearch(newlines, offset);
		int before = idx >= 0 ? idx : -idx - 1;
		return before + 1;
	}

	/** {@code radius} chars on each side of [start, end), clipped to the text. */
	public String context(int start, int end, int radius) {
		int from = Math.max(0, start - radius);
		int to = Math.min(text.length(), end + radius);
		return text.substring(from, to);
	}
}
