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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import opennlp.tools.doccat.BagOfWordsFeatureGenerator;
import opennlp.tools.doccat.DoccatFactory;
import opennlp.tools.doccat.DoccatModel;
import opennlp.tools.doccat.DocumentCategorizerME;
import opennlp.tools.doccat.DocumentSample;
import opennlp.tools.doccat.FeatureGenerator;
import opennlp.tools.util.ObjectStreamUtils;
import opennlp.tools.util.TrainingParameters;
import opennlp.tools.util.model.ModelUtil;

class DoccatFavorabilityClassifierTest {

	@TempDir
	static Path tmp;

	private static DoccatModel model;

	@BeforeAll
	static void trainTinyModel() throws IOException {
		model = train(FAVORABLE_SAMPLES, DoccatFavorabilityClassifier.FAVORABLE, UNFAVORABLE_SAMPLES,
				DoccatFavorabilityClassifier.UNFAVORABLE);
	}

	// --- helpers -------------------------------------------------------------

	private static final String[] FAVORABLE_SAMPLES = {
			"estimamos la demanda y reconocemos la incapacidad",
			"procede estimar el recurso y conceder la prestacion",
			"estimamos el recurso procedente",
			"reconocemos el derecho del actor",
			"se concede la incapacidad permanente parcial" };

	private static final String[] UNFAVORABLE_SAMPLES = {
			"desestimamos la demanda por infundada",
			"rechazamos el recurso y denegamos la prestacion",
			"desestimamos el recurso no procedente",
			"se deniega el derecho del actor",
			"no acreditado se rechaza la incapacidad" };

	private static DoccatModel train(String[] first, String firstCategory, String[] second, String secondCategory)
			throws IOException {
		List<DocumentSample> samples = new ArrayList<>();
		for (int rep = 0; rep < 5; rep++) {
			for (String s : first) {
				samples.add(new DocumentSample(firstCategory, s.split(" ")));
			}
			for (String s : second) {
				samples.add(new DocumentSample(secondCategory, s.split(" ")));
			}
		}
		TrainingParameters params = ModelUtil.createDefaultTrainingParameters();
		params.put(TrainingParameters.CUTOFF_PARAM, Integer.toString(1));
		params.put(TrainingParameters.ITERATIONS_PARAM, Integer.toString(100));
		DoccatFactory factory = new DoccatFactory(new FeatureGenerator[] { new BagOfWordsFeatureGenerator() });
		return DocumentCategorizerME.train("es", ObjectStreamUtils.createObjectStream(samples), params, factory);
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void classifies_clear_cases() throws Exception {
		DoccatFavorabilityClassifier c = new DoccatFavorabilityClassifier(model);

		ClassifierVerdict fav = c.predictFavorable("Estimamos el recurso y reconocemos la incapacidad.");
		assertTrue(fav.isFavorable());
		assertTrue(fav.getConfidence() > 0.5 && fav.getConfidence() <= 1.0);

		ClassifierVerdict unfav = c.predictFavorable("Desestimamos y rechazamos la demanda.");
		assertFalse(unfav.isFavorable());
	}

	@Test
	void loads_serialized_model_from_filesystem() throws Exception {
		Path file = tmp.resolve("favorability.bin");
		try (OutputStream out = Files.newOutputStream(file)) {
			model.serialize(out);
		}
		DoccatFavorabilityClassifier c = DoccatFavorabilityClassifier.load(file.toString());
		assertTrue(c.predictFavorable("estimamos el recurso").isFavorable());
	}

	@Test
	void missing_model_or_wrong_categories_are_rejected() throws Exception {
		assertThrows(ClassifierException.class, () -> DoccatFavorabilityClassifier.load(tmp.resolve("none.bin").toString()));
		assertThrows(ClassifierException.class, () -> DoccatFavorabilityClassifier.load(" "));

		DoccatModel other = train(FAVORABLE_SAMPLES, "si", UNFAVORABLE_SAMPLES, "no");
		assertThrows(ClassifierException.class, () -> new DoccatFavorabilityClassifier(other));
	}

	@Test
	void empty_text_is_a_classifier_error() throws Exception {
		DoccatFavorabilityClassifier c = new DoccatFavorabilityClassifier(model);
		assertThrows(ClassifierException.class, () -> c.predictFavorable("   "));
		assertThrows(ClassifierException.class, () -> c.predictFavorable(null));
	}
}
