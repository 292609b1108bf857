package org.lexlens.engine;

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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

import org.lexlens.engine.catalog.CatalogLoader;
import org.lexlens.engine.catalog.CatalogRegistry;
import org.lexlens.engine.catalog.PatternCatalog;
import org.lexlens.engine.conf.ConfigLoader;
import org.lexlens.engine.nlp.ClassifierException;
import org.lexlens.engine.nlp.DoccatFavorabilityClassifier;
import org.lexlens.engine.nlp.FavorabilityClassifier;
import org.lexlens.engine.om.CategoryMatches;
import org.lexlens.engine.om.CorpusReport;
import org.lexlens.engine.om.DiscrepancyReport;
import org.lexlens.engine.om.DocumentAnalysis;
import org.lexlens.engine.processing.aggregate.CorpusService;
import org.lexlens.engine.processing.aggregate.EvidenceAggregator;
import org.lexlens.engine.processing.discrepancy.DiscrepancyAnalyzer;
import org.lexlens.engine.processing.extract.PassageExtractor;
import org.lexlens.engine.processing.extract.PhraseExtractor;
import org.lexlens.engine.processing.score.FavorabilityPredictor;
import org.lexlens.engine.processing.score.KeywordScorer;
import org.lexlens.engine.util.ExtractionException;
import org.lexlens.engine.util.Logger;
import org.lexlens.engine.util.TextExtractor;

/**
 * Entry point for calling services: per-document analysis, discrepancy
 * reports and corpus aggregation over one live pattern catalog.
 * <p>
 * Every document is analyzed against a single catalog snapshot taken at the
 * start of the call, so a concurrent catalog edit never mixes two catalog
 * versions inside one analysis. Failures are returned as unprocessed
 * analyses, never thrown.
 */
public class LexLensEngine implements AutoCloseable {

	private final CatalogRegistry registry;
	private final FavorabilityPredictor predictor;
	private final DiscrepancyAnalyzer discrepancyAnalyzer;
	private final EvidenceAggregator aggregator;
	private final CorpusService corpus;
	private final int contextWindow;
	private final int parallelism;

	public LexLensEngine() {
		this(new ConfigLoader());
	}

	public LexLensEngine(ConfigLoader cfg) {
		this(cfg, new CatalogRegistry(CatalogLoader.fromConfig(cfg)), loadClassifier(cfg));
	}

	/**
	 * @param classifier optional statistical classifier; {@code null} for
	 *                   rule-based scoring only
	 */
	public LexLensEngine(ConfigLoader cfg, CatalogRegistry registry, FavorabilityClassifier classifier) {
		for (String issue : cfg.validate()) {
			Logger.warn("Configuration: {}", issue);
		}
		this.registry = registry;
		this.predictor = new FavorabilityPredictor(new KeywordScorer(cfg.getScoringProfile()), classifier);
		this.discrepancyAnalyzer = new DiscrepancyAnalyzer();
		this.aggregator = new EvidenceAggregator(cfg.getAggregationProfile());
		this.corpus = new CorpusService(aggregator, cfg.getCorpusCacheTtl(), cfg.getCorpusRecomputeTimeout());
		this.contextWindow = cfg.getContextWindow();
		this.parallelism = cfg.getParallelDocumentLimit();
		Logger.info("LexLens engine ready: catalog v{} ({} categories), classifier={}, parallelism={}",
				registry.current().getVersion(), registry.current().size(), predictor.hasClassifier(), parallelism);
	}

	/** Loads the configured doccat model, or returns null when none is configured or it fails to load. */
	static FavorabilityClassifier loadClassifier(ConfigLoader cfg) {
		String model = cfg.getClassifierModelPath();
		if (model == null || model.isBlank()) {
			return null;
		}
		try {
			return DoccatFavorabilityClassifier.load(model);
		} catch (ClassifierException e) {
			Logger.warn("Classifier model unavailable, using rule-based scoring only: {}", e.getMessage());
			return null;
		}
	}

	// ---- Per document --------------------------------------------------------

	public DocumentAnalysis analyzeDocument(String text, String documentId) {
		if (text == null) {
			return DocumentAnalysis.unprocessed(documentId, "No text supplied");
		}
		PatternCatalog catalog = registry.current();
		try {
			Map<String, CategoryMatches> matches = PhraseExtractor.extractOccurrences(text, catalog, documentId,
					contextWindow);
			DocumentAnalysis analysis = DocumentAnalysis.builder()
					.documentId(documentId)
					.textLength(text.length())
					.matches(matches)
					.prediction(predictor.predict(text, documentId))
					.discrepancyReport(discrepancyAnalyzer.analyze(text, documentId, catalog))
					.citedPassages(PassageExtractor.extract(text))
					.build();
			Logger.debug("Analyzed {}: {} occurrences in {} categories, verdict {}", documentId,
					analysis.getTotalOccurrences(), matches.size(), analysis.getPrediction().getVerdict());
			return analysis;
		} catch (RuntimeException e) {
			Logger.error("Analysis failed for {}", e, documentId);
			return DocumentAnalysis.unprocessed(documentId, "Analysis failed: " + e.getMessage());
		}
	}

	public DiscrepancyReport analyzeDiscrepancies(String text, String documentId) {
		return discrepancyAnalyzer.analyze(text == null ? "" : text, documentId, registry.current());
	}

	/** Reads the file through the extractor; an extraction failure yields an unprocessed analysis. */
	public DocumentAnalysis analyzeFile(Path path, TextExtractor extractor) {
		String documentId = String.valueOf(path.getFileName());
		String text;
		try {
			text = extractor.extractText(path);
		} catch (ExtractionException e) {
			Logger.warn("Text extraction failed for {}: {}", path, e.getMessage());
			return DocumentAnalysis.unprocessed(documentId, e.getMessage());
		} catch (RuntimeException e) {
			Logger.error("Text extractor crashed on {}", e, path);
			return DocumentAnalysis.unprocessed(documentId, "Text extraction failed: " + e.getMessage());
		}
		return analyzeDocument(text, documentId);
	}

	// ---- Batches -------------------------------------------------------------

	/** Analyzes id-to-text pairs in parallel; results follow the input order. */
	public List<DocumentAnalysis> analyzeAll(Map<String, String> texts) {
		return runBatch(new ArrayList<>(texts.keySet()), id -> analyzeDocument(texts.get(id), id), id -> id);
	}

	public List<DocumentAnalysis> analyzeFiles(Collection<Path> paths, TextExtractor extractor) {
		return runBatch(new ArrayList<>(paths), p -> analyzeFile(p, extractor), p -> String.valueOf(p.getFileName()));
	}

	private <T> List<DocumentAnalysis> runBatch(List<T> items, Function<T, DocumentAnalysis> task,
			Function<T, String> idOf) {
		if (items.isEmpty()) return List.of();
		int poolSize = Math.max(1, Math.min(parallelism, items.size()));
		ExecutorService exec = Executors.newFixedThreadPool(poolSize, r -> {
			Thread t = new Thread(r, "lexlens-worker");
			t.setDaemon(true);
			return t;
		});
		try {
			List<Future<DocumentAnalysis>> futures = new ArrayList<>(items.size());
			for (T item : items) {
				futures.add(exec.submit(() -> task.apply(item)));
			}
			List<DocumentAnalysis> out = new ArrayList<>(items.size());
			for (int i = 0; i < futures.size(); i++) {
				out.add(collect(futures.get(i), idOf.apply(items.get(i))));
			}
			Logger.info("Batch complete: {} documents, {} unprocessed", out.size(),
					out.stream().filter(d -> !d.isProcessed()).count());
			return out;
		} finally {
			exec.shutdownNow();
		}
	}

	private static DocumentAnalysis collect(Future<DocumentAnalysis> future, String id) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return DocumentAnalysis.unprocessed(id, "Interrupted");
		} catch (ExecutionException e) {
			Logger.error("Worker failed for {}", e.getCause(), id);
			return DocumentAnalysis.unprocessed(id, "Analysis failed: " + e.getCause().getMessage());
		}
	}

	// ---- Corpus --------------------------------------------------------------

	/** One-shot aggregation of the given analyses, bypassing the cache. */
	public CorpusReport aggregateCorpus(Collection<DocumentAnalysis> documents) {
		return aggregator.aggregate(documents);
	}

	/** The cached, incrementally maintained corpus. */
	public CorpusService corpus() {
		return corpus;
	}

	public CatalogRegistry catalog() {
		return registry;
	}

	@Override
	public void close() {
		corpus.close();
	}
}
