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
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Corpus-level probability of a favorable outcome, weighted by court
 * instance and calibrated for corpus size.
 */
@Value
@Builder
public class AggregatePrediction {

	public enum Trend {
		FAVORABLE, BALANCED, UNFAVORABLE
	}

	public enum Method {
		/** No processed document; neutral estimate. */
		NO_DATA,
		/** Small corpus, pulled toward 0.5. */
		DAMPENED,
		/** Clamped into the realism band. */
		REALISM_BAND
	}

	double probabilityFavorable;
	double probabilityUnfavorable;
	/** Uncalibrated weighted share, before dampening or clamping. */
	double rawProbability;
	double dataConfidence;
	/** Authority weight used for each document id. */
	@Singular
	Map<String, Double> documentWeights;
	int favorableCount;
	int unfavorableCount;
	@Singular
	List<KeyFactor> favorableFactors;
	@Singular
	List<KeyFactor> unfavorableFactors;
	Trend trend;
	Method method;

	public int getCorpusSize() {
		return favorableCount + unfavorableCount;
	}
}
