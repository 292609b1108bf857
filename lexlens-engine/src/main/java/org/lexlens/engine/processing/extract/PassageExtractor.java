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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.lexlens.engine.om.CitedPassage;

/**
 * Pulls reasoning passages out of a ruling: the sentence that follows
 * connectors such as "por lo que", "considerando que" or "fundamentos de
 * derecho". Passages of 20 chars or fewer are noise and are dropped.
 */
public final class PassageExtractor {

	static final int MIN_LENGTH = 20;

	private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

	private static final List<Pattern> CONNECTORS = List.of(
			Pattern.compile("por\\s+(?:lo\\s+)?que\\s+([^.]*?\\.)", FLAGS),
			Pattern.compile("fundamentos?\\s+(?:de\\s+)?derecho\\s+([^.]*?\\.)", FLAGS),
			Pattern.compile("considerando\\s+que\\s+([^.]*?\\.)", FLAGS),
			Pattern.compile("vistos\\s+([^.]*?\\.)", FLAGS),
			Pattern.compile("resultando\\s+([^.]*?\\.)", FLAGS),
			Pattern.compile("en\\s+su\\s+virtud\\s+([^.]*?\\.)", FLAGS),
			Pattern.compile("por\\s+ello\\s+([^.]*?\\.)", FLAGS));

	private PassageExtractor() {
	}

	public static List<CitedPassage> extract(String text) {
		List<CitedPassage> out = new ArrayList<>();
		if (text == null || text.isEmpty()) return out;
		for (Pattern p : CONNECTORS) {
			Matcher m = p.matcher(text);
			while (m.find()) {
				String passage = m.group(1).strip();
				if (passage.length() > MIN_LENGTH) {
					out.add(new CitedPassage(passage, m.start()));
				}
			}
		}
		out.sort(Comparator.comparingInt(CitedPassage::getPosition));
		return out;
	}
}
