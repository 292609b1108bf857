package org.lexlens.engine.catalog;

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
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import lombok.Value;

/**
 * A named category and its phrase variants, trimmed and de-duplicated
 * ignoring case and separator style (first spelling wins), so variants that
 * compile to the same matcher are kept once.
 */
@Value
public class Category {

	String name;
	List<String> phrases;

	public Category(String name, Collection<String> phrases) {
		if (StringUtils.isBlank(name)) {
			throw new ConfigurationException("Category name must not be empty");
		}
		this.name = name.trim();
		this.phrases = normalize(phrases);
	}

	public boolean containsPhrase(String phrase) {
		return indexOf(phrase) >= 0;
	}

	int indexOf(String phrase) {
		if (phrase == null) return -1;
		String key = phraseKey(phrase);
		for (int i = 0; i < phrases.size(); i++) {
			if (phraseKey(phrases.get(i)).equals(key)) {
				return i;
			}
		}
		return -1;
	}

	static String key(String s) {
		return s.trim().toLowerCase(Locale.ROOT);
	}

	/** Spaces, hyphens and underscores are one separator, as in {@link PatternCatalog#compilePhrase}. */
	static String phraseKey(String s) {
		return StringUtils.strip(PatternCatalog.SEPARATORS.matcher(s).replaceAll(" ")).toLowerCase(Locale.ROOT);
	}

	static List<String> normalize(Collection<String> raw) {
		List<String> out = new ArrayList<>();
		if (raw == null) return out;
		Set<String> seen = new HashSet<>();
		for (String p : raw) {
			if (StringUtils.isBlank(p)) continue;
			String trimmed = StringUtils.normalizeSpace(p);
			if (seen.add(phraseKey(trimmed))) {
				out.add(trimmed);
			}
		}
		return List.copyOf(out);
	}
}
