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
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Matcher;

import org.lexlens.engine.catalog.CatalogRegistry;
import org.lexlens.engine.catalog.Category;
import org.lexlens.engine.catalog.PatternCatalog;
import org.lexlens.engine.catalog.PatternCatalog.PhrasePattern;
import org.lexlens.engine.conf.ConfigLoader;
import org.lexlens.engine.om.CategoryMatches;
import org.lexlens.engine.om.Occurrence;

/**
 * Scans a text against the phrase catalog.
 * <p>
 * Instances are bound to a catalog source, normally
 * {@link CatalogRegistry#current()}, and resolve it on every call; an edit
 * published to the registry is therefore seen by the very next extraction.
 */
public final class PhraseExtractor {

	private static final Comparator<Occurrence> BY_POSITION = Comparator.comparingInt(Occurrence::getPosition);

	private final Supplier<PatternCatalog> catalogSource;
	private final int contextWindow;

	public PhraseExtractor(CatalogRegistry registry, int contextWindow) {
		this(registry::current, contextWindow);
	}

	public PhraseExtractor(Supplier<PatternCatalog> catalogSource, int contextWindow) {
		if (contextWindow < 0) {
			throw new IllegalArgumentException("contextWindow must be >= 0: " + contextWindow);
		}
		this.catalogSource = catalogSource;
		this.contextWindow = contextWindow;
	}

	public PhraseExtractor(CatalogRegistry registry) {
		this(registry, ConfigLoader.DEFAULT_CONTEXT_WINDOW);
	}

	public Map<String, CategoryMatches> extract(String text, String documentId) {
		return extractOccurrences(text, catalogSource.get(), documentId, contextWindow);
	}

	/**
	 * Matches every variant of every category. Categories without matches are
	 * left out; the rest keep catalog order, with occurrences sorted by
	 * position.
	 */
	public static Map<String, CategoryMatches> extractOccurrences(String text, PatternCatalog catalog,
			String documentId, int contextWindow) {
		if (text == null || text.isEmpty()) {
			return Collections.emptyMap();
		}
		TextWindow window = new TextWindow(text);
		Map<String, CategoryMatches> out = new LinkedHashMap<>();
		for (Category category : catalog.getCategories()) {
			List<Occurrence> found = new ArrayList<>();
			for (PhrasePattern pp : catalog.phrasePatterns(category.getName())) {
				Matcher m = pp.getPattern().matcher(text);
				while (m.find()) {
					found.add(Occurrence.builder()
							.category(category.getName())
							.phrase(pp.getPhrase())
							.matchedText(m.group())
							.position(m.start())
							.line(window.lineOf(m.start()))
							.context(window.context(m.start(), m.end(), contextWindow))
							.documentId(documentId)
							.build());
				}
			}
			if (!found.isEmpty()) {
				found.sort(BY_POSITION);
				out.put(category.getName(), new CategoryMatches(category.getName(), found));
			}
		}
		return out;
	}
}
