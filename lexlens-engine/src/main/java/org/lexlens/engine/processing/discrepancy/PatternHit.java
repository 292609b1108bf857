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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Value;

/** One regex match: the matched text and where it starts. */
@Value
public class PatternHit {
	String text;
	int position;

	/** All matches of all patterns, pattern by pattern. */
	public static List<PatternHit> findAll(List<Pattern> patterns, String text) {
		List<PatternHit> out = new ArrayList<>();
		for (Pattern p : patterns) {
			Matcher m = p.matcher(text);
			while (m.find()) {
				out.add(new PatternHit(m.group(), m.start()));
			}
		}
		return out;
	}
}
