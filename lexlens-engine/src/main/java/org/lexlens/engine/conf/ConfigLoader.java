package org.lexlens.engine.conf;

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

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.lexlens.engine.om.FactorType;
import org.lexlens.engine.util.Logger;

/**
 * Loads engine configuration from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/lexlens.properties</code> from
 * the classpath. You can override this by setting the system property
 * <code>lexlens.config</code> to a file path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Catalog locations are tried on the filesystem first, then on the
 * classpath (see {@code CatalogLoader}).</li>
 * <li>Numeric values that fail to parse fall back to their defaults with a
 * warning; {@link #validate()} reports them as issues.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/lexlens.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "lexlens.config";

	// ---- Property keys -------------------------------------------------------
	static final String K_CATALOG_FILE = "CATALOG_FILE";
	static final String K_PATTERN_GROUPS_FILE = "PATTERN_GROUPS_FILE";
	static final String K_CONTEXT_WINDOW = "CONTEXT_WINDOW";
	static final String K_CLASSIFIER_MODEL_PATH = "CLASSIFIER_MODEL_PATH";
	static final String K_PARALLEL_DOCUMENT_LIMIT = "PARALLEL_DOCUMENT_LIMIT";

	static final String K_CACHE_TTL_SECONDS = "CORPUS_CACHE_TTL_SECONDS";
	static final String K_RECOMPUTE_TIMEOUT_MS = "CORPUS_RECOMPUTE_TIMEOUT_MS";

	static final String K_CONFIDENCE_FLOOR = "CONFIDENCE_FLOOR";
	static final String K_CONFIDENCE_CEILING = "CONFIDENCE_CEILING";

	static final String K_WEIGHT_SUPREME = "INSTANCE_WEIGHT_SUPREME";
	static final String K_WEIGHT_APPELLATE = "INSTANCE_WEIGHT_APPELLATE";
	static final String K_WEIGHT_OTHER = "INSTANCE_WEIGHT_OTHER";
	static final String K_DAMPENING = "SMALL_CORPUS_DAMPENING";
	static final String K_BAND_LOW = "REALISM_BAND_LOW";
	static final String K_BAND_HIGH = "REALISM_BAND_HIGH";

	public static final int DEFAULT_CONTEXT_WINDOW = 100;
	public static final long DEFAULT_CACHE_TTL_SECONDS = 300;
	public static final long DEFAULT_RECOMPUTE_TIMEOUT_MS = 5000;

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/** Wraps already-loaded properties; used by embedding applications. */
	public ConfigLoader(Properties source) {
		if (source != null) {
			properties.putAll(source);
		}
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Checks the loaded values without failing. Returns human-readable issues
	 * so the caller can decide whether to abort.
	 *
	 * @return list of issues; empty if the configuration looks usable
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		requireNonBlank(K_CATALOG_FILE, issues);
		requireNonBlank(K_PATTERN_GROUPS_FILE, issues);

		requirePositiveNumber(K_CONTEXT_WINDOW, issues);
		requirePositiveNumber(K_CACHE_TTL_SECONDS, issues);
		requirePositiveNumber(K_RECOMPUTE_TIMEOUT_MS, issues);

		for (FactorType t : FactorType.values()) {
			String raw = getOptional(t.propertyKey(), null);
			if (raw != null && parseDouble(raw) == null) {
				issues.add("Weight " + t.propertyKey() + " is not a number: '" + raw + "'");
			} else if (raw != null && parseDouble(raw) < 0) {
				issues.add("Weight " + t.propertyKey() + " must not be negative");
			}
		}

		double floor = getDouble(K_CONFIDENCE_FLOOR, 0.3);
		double ceiling = getDouble(K_CONFIDENCE_CEILING, 0.95);
		if (floor < 0 || ceiling > 1 || floor >= ceiling) {
			issues.add(K_CONFIDENCE_FLOOR + " must be below " + K_CONFIDENCE_CEILING + " and both within [0,1].");
		}

		double low = getDouble(K_BAND_LOW, 0.15);
		double high = getDouble(K_BAND_HIGH, 0.85);
		if (low < 0 || high > 1 || low >= high) {
			issues.add(K_BAND_LOW + " must be below " + K_BAND_HIGH + " and both within [0,1].");
		}

		String model = getOptional(K_CLASSIFIER_MODEL_PATH, null);
		if (model != null && !Files.isReadable(Path.of(model))
				&& getClass().getClassLoader().getResource(model) == null) {
			issues.add("Warning: classifier model not found, rule-based scoring only: " + model);
		}
		return issues;
	}

	/** Phrase catalog CSV ({@code category,phrase}). */
	public String getCatalogFile() {
		return getRequired(K_CATALOG_FILE);
	}

	/** Pattern-group CSV ({@code group,regex}). */
	public String getPatternGroupsFile() {
		return getRequired(K_PATTERN_GROUPS_FILE);
	}

	/** Characters of context captured on each side of a match. */
	public int getContextWindow() {
		return (int) getPositiveLong(K_CONTEXT_WINDOW, DEFAULT_CONTEXT_WINDOW);
	}

	/** Optional OpenNLP document-categorizer model; empty when not configured. */
	public String getClassifierModelPath() {
		return getOptional(K_CLASSIFIER_MODEL_PATH, "");
	}

	public Duration getCorpusCacheTtl() {
		return Duration.ofSeconds(getPositiveLong(K_CACHE_TTL_SECONDS, DEFAULT_CACHE_TTL_SECONDS));
	}

	public Duration getCorpusRecomputeTimeout() {
		return Duration.ofMillis(getPositiveLong(K_RECOMPUTE_TIMEOUT_MS, DEFAULT_RECOMPUTE_TIMEOUT_MS));
	}

	/**
	 * Documents analyzed concurrently in a batch. Defaults to ~25% of the
	 * available cores and never exceeds the core count.
	 */
	public int getParallelDocumentLimit() {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int defaultLimit = Math.max(1, (int) Math.floor(cores / 4.0));

		String raw = getOptional(K_PARALLEL_DOCUMENT_LIMIT, null);
		if (raw != null) {
			try {
				int val = Integer.parseInt(raw.trim());
				if (val <= 0)
					return defaultLimit;
				return Math.min(val, cores);
			} catch (NumberFormatException nfe) {
				Logger.warn("Invalid integer for parallel limit: '{}'. Using default {}", raw, defaultLimit);
			}
		}
		return defaultLimit;
	}

	public ScoringProfile getScoringProfile() {
		ScoringProfile defaults = ScoringProfile.defaults();
		Map<FactorType, Double> weights = new EnumMap<>(FactorType.class);
		for (FactorType t : FactorType.values()) {
			double w = getDouble(t.propertyKey(), t.defaultWeight());
			weights.put(t, w < 0 ? t.defaultWeight() : w);
		}
		return defaults.toBuilder()
				.weights(weights)
				.confidenceFloor(getDouble(K_CONFIDENCE_FLOOR, defaults.getConfidenceFloor()))
				.confidenceCeiling(getDouble(K_CONFIDENCE_CEILING, defaults.getConfidenceCeiling()))
				.build();
	}

	public AggregationProfile getAggregationProfile() {
		AggregationProfile defaults = AggregationProfile.defaults();
		return defaults.toBuilder()
				.supremeWeight(getDouble(K_WEIGHT_SUPREME, defaults.getSupremeWeight()))
				.appellateWeight(getDouble(K_WEIGHT_APPELLATE, defaults.getAppellateWeight()))
				.otherWeight(getDouble(K_WEIGHT_OTHER, defaults.getOtherWeight()))
				.dampening(getDouble(K_DAMPENING, defaults.getDampening()))
				.bandLow(getDouble(K_BAND_LOW, defaults.getBandLow()))
				.bandHigh(getDouble(K_BAND_HIGH, defaults.getBandHigh()))
				.build();
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = Files.newInputStream(file)) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null || v.isBlank()) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private double getDouble(String key, double defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		Double d = parseDouble(raw);
		if (d == null) {
			Logger.warn("Invalid number for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
		return d;
	}

	private long getPositiveLong(String key, long defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			long v = Long.parseLong(raw);
			return v > 0 ? v : defaultVal;
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private static Double parseDouble(String raw) {
		try {
			return Double.valueOf(raw.trim());
		} catch (NumberFormatException nfe) {
			return null;
		}
	}

	private void requireNonBlank(String key, List<String> issues) {
		String v = properties.getProperty(key);
		if (v == null || v.trim().isEmpty()) {
			issues.add("Missing required property: " + key);
		}
	}

	private void requirePositiveNumber(String key, List<String> issues) {
		String raw = getOptional(key, null);
		if (raw == null)
			return;
		try {
			if (Long.parseLong(raw) <= 0) {
				issues.add(key + " must be a positive integer: '" + raw + "'");
			}
		} catch (NumberFormatException nfe) {
			issues.add(key + " must be a positive integer: '" + raw + "'");
		}
	}
}
