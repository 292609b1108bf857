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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.lexlens.engine.conf.ConfigLoader;
import org.lexlens.engine.om.AggregatePrediction;
import org.lexlens.engine.om.CorpusReport;
import org.lexlens.engine.om.DocumentAnalysis;
import org.lexlens.engine.util.Logger;
import org.lexlens.engine.util.TextExtractor;

/**
 * Command-line entry point: analyzes UTF-8 text files (or every {@code .txt}
 * file of a directory) and logs each verdict followed by the corpus summary.
 *
 * <pre>
 * java -Dlexlens.config=/path/lexlens.properties org.lexlens.engine.LexLensMain rulings/ extra.txt
 * </pre>
 */
public class LexLensMain {

	private final ConfigLoader cfg;

	public LexLensMain() {
		this.cfg = new ConfigLoader();
	}

	public static void main(String[] args) {
		if (args.length == 0) {
			Logger.error("Usage: LexLensMain <file-or-directory>...");
			System.exit(2);
		}
		new LexLensMain().run(args);
	}

	private void run(String[] args) {
		List<Path> inputs = collectInputs(args);
		Logger.info("Documents to analyze: {}", inputs.size());

		try (LexLensEngine engine = new LexLensEngine(cfg)) {
			List<DocumentAnalysis> analyses = engine.analyzeFiles(inputs, TextExtractor.plainText());
			for (DocumentAnalysis a : analyses) {
				if (!a.isProcessed()) {
					Logger.warn("{}: not processed ({})", a.getDocumentId(), a.getError());
					continue;
				}
				Logger.info("{}: {} (confidence {}), {} occurrences, {} discrepancies", a.getDocumentId(),
						a.getPrediction().getVerdict(), String.format("%.2f", a.getPrediction().getConfidence()),
						a.getTotalOccurrences(), a.getDiscrepancies().size());
			}

			engine.corpus().addAll(analyses);
			logSummary(engine.corpus().report());
		}
	}

	private static void logSummary(CorpusReport report) {
		AggregatePrediction p = report.getPrediction();
		Logger.info("Corpus: {} processed, {} failed", report.getProcessedDocuments(), report.getFailedDocuments());
		Logger.info("Favorable probability {} ({}, data confidence {}, {})", String.format("%.2f",
				p.getProbabilityFavorable()), p.getTrend(), String.format("%.2f", p.getDataConfidence()),
				p.getMethod());
		Logger.info("Top categories: {}", report.getRanking().top(5).stream()
				.map(m -> m.getCategory() + "=" + m.getTotal()).collect(Collectors.joining(", ")));
		Logger.info("Risk level {} (weighted {})", report.getRisk().getLevel(),
				String.format("%.1f", report.getRisk().getWeightedValue()));
		if (report.isStale()) {
			Logger.warn("Corpus report is stale: {}", report.getError());
		}
	}

	private static List<Path> collectInputs(String[] args) {
		List<Path> out = new ArrayList<>();
		for (String arg : args) {
			Path p = Path.of(arg);
			if (Files.isDirectory(p)) {
				try (Stream<Path> files = Files.list(p)) {
					files.filter(f -> f.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt")).sorted()
							.forEach(out::add);
				} catch (IOException e) {
					Logger.warn("Cannot list {}: {}", p, e.getMessage());
				}
			} else {
				out.add(p);
			}
		}
		return out;
	}
}
