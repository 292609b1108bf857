package org.lexlens.engine.om;

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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.Value;

/**
 * Occurrences of one category in one document (or a whole corpus).
 */
@Value
public class CategoryMatches {

	String category;
	List<Occurrence> occurrences;

	public CategoryMatches(String category, List<Occurrence> occurrences) {
		this.category = category;
		this.occurrences = List.copyOf(occurrences);
	}

	public int getTotal() {
		return occurrences.size();
	}

	/** Distinct catalog variants that matched, in first-seen order. */
	public Set<String> getPhrasesFound() {
		Set<String> out = new LinkedHashSet<>();
		for (Occurrence o : occurrences) {
			out.add(o.getPhrase());
		}
		return out;
	}
}
