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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.lexlens.engine.om.FactorType;

import lombok.Builder;
import lombok.Value;

/**
 * Weights and thresholds of the keyword scorer. The defaults are the
 * calibrated values observed in production; every one of them can be
 * overridden through {@link ConfigLoader}.
 */
@Value
@Builder(toBuilder = true)
public class ScoringProfile {

	@Builder.Default
	Map<FactorType, Double> weights = defaultWeights();

	@Builder.Default
	double confidenceFloor = 0.3;
	@Builder.Default
	double confidenceCeiling = 0.95;

	/** Confidence at or above which a verdict is "very" (un)favorable. */
	@Builder.Default
	double strongThreshold = 0.8;
	/** Confidence at or above which a verdict is plainly (un)favorable. */
	@Builder.Default
	double moderateThreshold = 0.6;

	/** Factor score above which the success-probability bonus applies. */
	@Builder.Default
	double bonusThreshold = 0.7;
	@Builder.Default
	double evidenceBonus = 0.10;
	@Builder.Default
	double procedureBonus = 0.10;
	@Builder.Default
	double structureBonus = 0.05;
	@Builder.Default
	double successCeiling = 0.95;

	public static ScoringProfile defaults() {
		return ScoringProfile.builder().build();
	}

	public double weight(FactorType type) {
		Double w = weights.get(type);
		return w == null ? type.defaultWeight() : w;
	}

	static Map<FactorType, Double> defaultWeights() {
		Map<FactorType, Double> m = new EnumMap<>(FactorType.class);
		for (FactorType t : FactorType.values()) {
			m.put(t, t.defaultWeight());
		}
		return Collections.unmodifiableMap(m);
	}
}
