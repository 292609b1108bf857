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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

import org.lexlens.engine.conf.ConfigLoader;
import org.lexlens.engine.util.Logger;

/**
 * Reads the phrase catalog and the pattern groups from CSV.
 * <p>
 * Phrase file columns: {@code category,phrase}. One row per variant; a row
 * with an empty phrase declares an empty category.<br>
 * Pattern-group file columns: {@code group,regex}.
 * <p>
 * Locations are tried on the filesystem first, then on the classpath.
 */
public final class CatalogLoader {

	public static final String DEFAULT_PHRASES = "catalog/phrases.csv";
	public static final String DEFAULT_PATTERN_GROUPS = "catalog/pattern-groups.csv";

	private static final CSVFormat CSV = CSVFormat.DEFAULT.withDelimiter(',').withHeader().withIgnoreHeaderCase()
			.withTrim().withCommentMarker('#');

	private CatalogLoader() {
	}

	/** Bundled catalog. */
	public static PatternCatalog defaults() {
		return load(DEFAULT_PHRASES, DEFAULT_PATTERN_GROUPS);
	}

	public static PatternCatalog fromConfig(ConfigLoader config) {
		return load(config.getCatalogFile(), config.getPatternGroupsFile());
	}

	public static PatternCatalog load(String phrasesLocation, String groupsLocation) {
		Map<String, List<String>> phrases;
		try (Reader r = open(phrasesLocation)) {
			phrases = readPhrases(r);
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read phrase catalog " + phrasesLocation, e);
		}
		Map<PatternGroup, List<String>> groups;
		try (Reader r = open(groupsLocation)) {
			groups = readGroups(r);
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read pattern groups " + groupsLocation, e);
		}
		PatternCatalog catalog = PatternCatalog.of(phrases, groups);
		Logger.info("Loaded catalog {} from {} ({} pattern groups from {})", catalog, phrasesLocation,
				groups.size(), groupsLocation);
		return catalog;
	}

	static Map<String, List<String>> readPhrases(Reader reader) throws IOException {
		Map<String, List<String>> out = new LinkedHashMap<>();
		int row = 0, badRows = 0;
		try (CSVParser csv = new CSVParser(reader, CSV)) {
			requireColumns(csv, "category", "phrase");
			for (CSVRecord rec : csv) {
				row++;
				String category = rec.get("category");
				if (StringUtils.isBlank(category)) {
					badRows++;
					continue;
				}
				List<String> list = out.computeIfAbsent(category, k -> new ArrayList<>());
				String phrase = rec.isSet("phrase") ? rec.get("phrase") : null;
				if (StringUtils.isNotBlank(phrase)) {
					list.add(phrase);
				}
			}
		}
		if (badRows > 0) {
			Logger.warn("Skipped {} of {} catalog rows with no category", badRows, row);
		}
		return out;
	}

	static Map<PatternGroup, List<String>> readGroups(Reader reader) throws IOException {
		Map<PatternGroup, List<String>> out = new EnumMap<>(PatternGroup.class);
		try (CSVParser csv = new CSVParser(reader, CSV)) {
			requireColumns(csv, "group", "regex");
			for (CSVRecord rec : csv) {
				String regex = rec.get("regex");
				if (StringUtils.isBlank(regex)) continue;
				out.computeIfAbsent(PatternGroup.fromKey(rec.get("group")), k -> new ArrayList<>()).add(regex);
			}
		}
		return out;
	}

	private static void requireColumns(CSVParser csv, String... columns) {
		Map<String, Integer> header = csv.getHeaderMap();
		for (String col : columns) {
			if (header == null || header.keySet().stream().noneMatch(col::equalsIgnoreCase)) {
				throw new ConfigurationException("Missing CSV column '" + col + "'");
			}
		}
	}

	private static Reader open(String location) throws IOException {
		if (StringUtils.isBlank(location)) {
			throw new ConfigurationException("Catalog location is not configured");
		}
		Path p = Path.of(location);
		if (Files.isReadable(p)) {
			return Files.newBufferedReader(p, StandardCharsets.UTF_8);
		}
		InputStream in = CatalogLoader.class.getClassLoader().getResourceAsStream(location);
		if (in == null) {
			throw new ConfigurationException("Catalog resource not found on filesystem or classpath: " + location);
		}
		return new InputStreamReader(in, StandardCharsets.UTF_8);
	}
}
