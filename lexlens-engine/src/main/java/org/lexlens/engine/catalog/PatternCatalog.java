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
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.apache.commons.lang3.StringUtils;

import org.lexlens.engine.catalog.ConfigurationException.Reason;

import lombok.Value;

/**
 * Immutable snapshot of the phrase catalog and the regex pattern groups.
 * <p>
 * All regexes are compiled once, when the snapshot is built. Phrase variants
 * match case-insensitively on word boundaries, and any run of whitespace,
 * hyphens or underscores in a variant matches any such run in the text.
 * <p>
 * Edits never mutate a snapshot: each {@code with...} method validates the
 * change and returns a new catalog with a higher {@link #getVersion()}.
 * {@link CatalogRegistry} publishes them.
 */
public final class PatternCatalog {

	private static final AtomicLong VERSIONS = new AtomicLong();

	static final Pattern SEPARATORS = Pattern.compile("[\\s_\\-]+");
	private static final String SEPARATOR_REGEX = "[\\s_\\-]+";
	private static final String WORD_START = "(?<![\\p{L}\\p{N}])";
	private static final String WORD_END = "(?![\\p{L}\\p{N}])";
	private static final int PHRASE_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

	/** A catalog variant with its compiled matcher. */
	@Value
	public static class PhrasePattern {
		String phrase;
		Pattern pattern;
	}

	private final Map<String, Category> categories;
	private final Map<String, List<PhrasePattern>> phrasePatterns;
	private final Map<PatternGroup, List<String>> groupSources;
	private final Map<PatternGroup, List<Pattern>> groups;
	private final long version;

	private PatternCatalog(List<Category> cats, Map<PatternGroup, List<String>> groupSources) {
		Map<String, Category> byName = new LinkedHashMap<>();
		Map<String, String> seen = new HashMap<>();
		Map<String, List<PhrasePattern>> compiled = new HashMap<>();
		for (Category c : cats) {
			String prior = seen.put(Category.key(c.getName()), c.getName());
			if (prior != null) {
				throw new ConfigurationException(Reason.CONFLICT,
						"Duplicate category name: '" + c.getName() + "' (already defined as '" + prior + "')");
			}
			byName.put(c.getName(), c);
			List<PhrasePattern> pp = new ArrayList<>();
			for (String phrase : c.getPhrases()) {
				Pattern p = compilePhrase(phrase);
				if (p != null) {
					pp.add(new PhrasePattern(phrase, p));
				}
			}
			compiled.put(c.getName(), List.copyOf(pp));
		}

		Map<PatternGroup, List<String>> sources = new EnumMap<>(PatternGroup.class);
		Map<PatternGroup, List<Pattern>> patterns = new EnumMap<>(PatternGroup.class);
		for (PatternGroup g : PatternGroup.values()) {
			List<String> src = groupSources.getOrDefault(g, List.of());
			List<Pattern> ps = new ArrayList<>(src.size());
			for (String regex : src) {
				try {
					ps.add(Pattern.compile(regex, g.flags()));
				} catch (PatternSyntaxException e) {
					throw new ConfigurationException("Invalid regex in group " + g.key() + ": " + regex, e);
				}
			}
			sources.put(g, List.copyOf(src));
			patterns.put(g, List.copyOf(ps));
		}

		this.categories = Collections.unmodifiableMap(byName);
		this.phrasePatterns = Collections.unmodifiableMap(compiled);
		this.groupSources = Collections.unmodifiableMap(sources);
		this.groups = Collections.unmodifiableMap(patterns);
		this.version = VERSIONS.incrementAndGet();
	}

	/**
	 * Builds a catalog from a category to phrase-list mapping and the regex
	 * groups.
	 *
	 * @throws ConfigurationException if the mapping is null or empty, a name
	 *                                is blank or duplicated (ignoring case),
	 *                                or a regex does not compile
	 */
	public static PatternCatalog of(Map<String, ? extends Collection<String>> phrases,
			Map<PatternGroup, ? extends Collection<String>> groups) {
		if (phrases == null || phrases.isEmpty()) {
			throw new ConfigurationException("Phrase catalog is empty");
		}
		List<Category> cats = new ArrayList<>(phrases.size());
		for (Map.Entry<String, ? extends Collection<String>> e : phrases.entrySet()) {
			cats.add(new Category(e.getKey(), e.getValue()));
		}
		return new PatternCatalog(cats, copyGroups(groups));
	}

	// ---- Read API -------------------------------------------------------------

	public long getVersion() {
		return version;
	}

	public int size() {
		return categories.size();
	}

	public List<Category> getCategories() {
		return List.copyOf(categories.values());
	}

	/** Case-insensitive lookup. */
	public Optional<Category> getCategory(String name) {
		if (StringUtils.isBlank(name)) return Optional.empty();
		String key = Category.key(name);
		return categories.values().stream().filter(c -> Category.key(c.getName()).equals(key)).findFirst();
	}

	public List<PhrasePattern> phrasePatterns(String category) {
		return phrasePatterns.getOrDefault(category, List.of());
	}

	public List<Pattern> patterns(PatternGroup group) {
		return groups.get(group);
	}

	public List<String> patternSources(PatternGroup group) {
		return groupSources.get(group);
	}

	/** Category name to phrase list, in catalog order. */
	public Map<String, List<String>> toMapping() {
		Map<String, List<String>> out = new LinkedHashMap<>();
		categories.values().forEach(c -> out.put(c.getName(), c.getPhrases()));
		return out;
	}

	// ---- Edits ----------------------------------------------------------------

	public PatternCatalog withCategory(String name, Collection<String> phrases) {
		requireName(name, "Category name");
		if (getCategory(name).isPresent()) {
			throw new ConfigurationException(Reason.CONFLICT, "Category already exists: " + name.trim());
		}
		List<Category> cats = new ArrayList<>(categories.values());
		cats.add(new Category(name, phrases));
		return new PatternCatalog(cats, groupSources);
	}

	public PatternCatalog withoutCategory(String name) {
		Category target = require(name);
		if (categories.size() == 1) {
			throw new ConfigurationException("Cannot delete the last category: " + target.getName());
		}
		List<Category> cats = new ArrayList<>(categories.values());
		cats.remove(target);
		return new PatternCatalog(cats, groupSources);
	}

	public PatternCatalog withCategoryRenamed(String oldName, String newName) {
		requireName(oldName, "Current category name");
		requireName(newName, "New category name");
		Category source = require(oldName);
		String target = newName.trim();
		if (source.getName().equals(target)) {
			return this;
		}
		Optional<Category> clash = getCategory(target);
		if (clash.isPresent() && clash.get() != source) {
			throw new ConfigurationException(Reason.CONFLICT, "Category already exists: " + target);
		}
		List<Category> cats = new ArrayList<>(categories.size());
		for (Category c : categories.values()) {
			cats.add(c == source ? new Category(target, c.getPhrases()) : c);
		}
		return new PatternCatalog(cats, groupSources);
	}

	/** Adds a variant; a duplicate (ignoring case and separators) leaves the catalog unchanged. */
	public PatternCatalog withPhrase(String category, String phrase) {
		requireName(phrase, "Phrase");
		Category source = require(category);
		if (source.containsPhrase(phrase)) {
			return this;
		}
		List<String> phrases = new ArrayList<>(source.getPhrases());
		phrases.add(phrase);
		return replacing(source, new Category(source.getName(), phrases));
	}

	public PatternCatalog withoutPhrase(String category, String phrase) {
		requireName(phrase, "Phrase");
		Category source = require(category);
		int idx = source.indexOf(phrase);
		if (idx < 0) {
			throw new ConfigurationException(Reason.NOT_FOUND,
					"Phrase not found in " + source.getName() + ": " + phrase.trim());
		}
		List<String> phrases = new ArrayList<>(source.getPhrases());
		phrases.remove(idx);
		return replacing(source, new Category(source.getName(), phrases));
	}

	/**
	 * Renames a variant in place. If the new spelling already exists the old
	 * variant is simply dropped.
	 */
	public PatternCatalog withPhraseRenamed(String category, String oldPhrase, String newPhrase) {
		requireName(oldPhrase, "Current phrase");
		requireName(newPhrase, "New phrase");
		Category source = require(category);
		int idx = source.indexOf(oldPhrase);
		if (idx < 0) {
			throw new ConfigurationException(Reason.NOT_FOUND,
					"Phrase not found in " + source.getName() + ": " + oldPhrase.trim());
		}
		List<String> phrases = new ArrayList<>(source.getPhrases());
		int existing = source.indexOf(newPhrase);
		if (existing >= 0 && existing != idx) {
			phrases.remove(idx);
		} else {
			phrases.set(idx, newPhrase);
		}
		return replacing(source, new Category(source.getName(), phrases));
	}

	/** Replaces every category, keeping the pattern groups. */
	public PatternCatalog withMapping(Map<String, ? extends Collection<String>> phrases) {
		return of(phrases, groupSources);
	}

	// ---- Internals ------------------------------------------------------------

	private PatternCatalog replacing(Category oldCat, Category newCat) {
		List<Category> cats = new ArrayList<>(categories.size());
		for (Category c : categories.values()) {
			cats.add(c == oldCat ? newCat : c);
		}
		return new PatternCatalog(cats, groupSources);
	}

	private Category require(String name) {
		requireName(name, "Category name");
		return getCategory(name).orElseThrow(
				() -> new ConfigurationException(Reason.NOT_FOUND, "Category not found: " + name.trim()));
	}

	private static void requireName(String value, String what) {
		if (StringUtils.isBlank(value)) {
			throw new ConfigurationException(what + " must not be empty");
		}
	}

	private static Map<PatternGroup, List<String>> copyGroups(Map<PatternGroup, ? extends Collection<String>> groups) {
		Map<PatternGroup, List<String>> out = new EnumMap<>(PatternGroup.class);
		if (groups != null) {
			groups.forEach((g, list) -> {
				List<String> clean = new ArrayList<>();
				if (list != null) {
					list.stream().filter(StringUtils::isNotBlank).map(String::trim).forEach(clean::add);
				}
				out.put(g, clean);
			});
		}
		return out;
	}

	/** Null when the variant has no literal content (separators only). */
	static Pattern compilePhrase(String phrase) {
		StringBuilder sb = new StringBuilder(WORD_START);
		int parts = 0;
		for (String part : SEPARATORS.split(phrase.trim())) {
			if (part.isEmpty()) continue;
			if (parts++ > 0) sb.append(SEPARATOR_REGEX);
			sb.append(Pattern.quote(part));
		}
		if (parts == 0) return null;
		return Pattern.compile(sb.append(WORD_END).toString(), PHRASE_FLAGS);
	}

	@Override
	public String toString() {
		return "PatternCatalog[v" + version + ", " + categories.size() + " categories]";
	}
}
