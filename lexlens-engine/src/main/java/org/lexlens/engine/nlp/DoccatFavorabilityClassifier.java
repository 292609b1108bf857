package org.lexlens.engine.nlp;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

import org.lexlens.engine.util.Logger;

import opennlp.tools.doccat.DoccatModel;
import opennlp.tools.doccat.DocumentCategorizerME;
import opennlp.tools.tokenize.SimpleTokenizer;

/**
 * {@link FavorabilityClassifier} backed by an OpenNLP document-categorizer
 * model with the categories {@value #FAVORABLE} and {@value #UNFAVORABLE}.
 * <p>
 * The model is shared; categorizers are kept per thread.
 */
public final class DoccatFavorabilityClassifier implements FavorabilityClassifier {

	public static final String FAVORABLE = "favorable";
	public static final String UNFAVORABLE = "unfavorable";

	private final ThreadLocal<DocumentCategorizerME> categorizer;

	public DoccatFavorabilityClassifier(DoccatModel model) throws ClassifierException {
		DocumentCategorizerME check = new DocumentCategorizerME(model);
		if (check.getIndex(FAVORABLE) < 0 || check.getIndex(UNFAVORABLE) < 0) {
			throw new ClassifierException("Doccat model must define the categories '" + FAVORABLE + "' and '"
					+ UNFAVORABLE + "'");
		}
		this.categorizer = ThreadLocal.withInitial(() -> new DocumentCategorizerME(model));
	}

	/**
	 * Loads a serialized model, filesystem first, then classpath.
	 *
	 * @throws ClassifierException if the model is missing or unreadable
	 */
	public static DoccatFavorabilityClassifier load(String location) throws ClassifierException {
		if (StringUtils.isBlank(location)) {
			throw new ClassifierException("No classifier model configured");
		}
		try (InputStream in = tryOpen(location)) {
			if (in == null) {
				throw new ClassifierException("Classifier model not found: " + location);
			}
			DoccatFavorabilityClassifier c = new DoccatFavorabilityClassifier(new DoccatModel(in));
			Logger.info("Loaded favorability classifier from {}", location);
			return c;
		} catch (IOException e) {
			throw new ClassifierException("Failed to read classifier model " + location, e);
		}
	}

	@Override
	public ClassifierVerdict predictFavorable(String text) throws ClassifierException {
		String[] tokens = SimpleTokenizer.INSTANCE.tokenize(Objects.toString(text, "").toLowerCase(Locale.ROOT));
		if (tokens.length == 0) {
			throw new ClassifierException("Nothing to classify: empty text");
		}
		DocumentCategorizerME doccat = categorizer.get();
		double[] probs;
		try {
			probs = doccat.categorize(tokens);
		} catch (RuntimeException e) {
			throw new ClassifierException("Doccat categorization failed", e);
		}
		double pFav = probs[doccat.getIndex(FAVORABLE)];
		double pUnfav = probs[doccat.getIndex(UNFAVORABLE)];
		double norm = pFav + pUnfav;
		if (!(norm > 0)) {
			throw new ClassifierException("Doccat returned no probability mass for the outcome categories");
		}
		boolean favorable = pFav >= pUnfav;
		return new ClassifierVerdict(favorable, Math.max(pFav, pUnfav) / norm);
	}

	private static InputStream tryOpen(String location) throws IOException {
		Path p = Path.of(location);
		if (Files.isReadable(p)) {
			return Files.newInputStream(p);
		}
		return DoccatFavorabilityClassifier.class.getClassLoader().getResourceAsStream(location);
	}
}
