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

import java.util.List;
import java.util.Optional;

import lombok.Value;

/**
 * Categories merged across a corpus, ordered by descending total. Ties keep
 * first-seen order.
 */
@Value
public class CorpusRanking {

	List<CategoryMatches> entries;

	public CorpusRanking(List<CategoryMatches> entries) {
		this.entries = List.copyOf(entries);
	}

	public static CorpusRanking empty() {
		return new CorpusRanking(List.of());
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public Optional<CategoryMatches> get(String category) {
		return entries.stream().filter(e -> e.getCategory().equals(category)).findFirst();
	}

	public int totalOf(String category) {
		return get(category).map(CategoryMatches::getTotal).orElse(0);
	}

	public List<CategoryMatches> top(int n) {
		return entries.subList(0, Math.min(n, entries.size()));
	}
}
