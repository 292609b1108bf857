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

import java.util.Locale;
import java.util.Map;

import org.lexlens.engine.om.Severity;

import lombok.Builder;
import lombok.Value;

/**
 * Calibration constants for corpus aggregation: court-instance weights,
 * small-corpus dampening, the realism band and the risk thresholds.
 */
@Value
@Builder(toBuilder = true)
public class AggregationProfile {

	@Builder.Default
	double supremeWeight = 1.5;
	@Builder.Default
	double appellateWeight = 1.2;
	@Builder.Default
	double otherWeight = 1.0;

	/** Corpora smaller than this are dampened toward 0.5 instead of clamped. */
	@Builder.Default
	int smallCorpusSize = 3;
	@Builder.Default
	double dampening = 0.3;
	@Builder.Default
	double bandLow = 0.15;
	@Builder.Default
	double bandHigh = 0.85;

	@Builder.Default
	double supremeRiskMultiplier = 0.5;
	@Builder.Default
	double appellateRiskMultiplier = 0.2;
	@Builder.Default
	double highRiskThreshold = 100;
	@Builder.Default
	double mediumRiskThreshold = 50;
	/** Below {@link #smallCorpusSize} documents risk is MEDIUM above this value and never HIGH. */
	@Builder.Default
	double smallCorpusRiskThreshold = 30;

	/** Category name (lower case) to risk tier; unlisted categories carry no risk weight. */
	@Builder.Default
	Map<String, Severity> riskTiers = Map.of(
			"reclamacion_administrativa", Severity.HIGH,
			"procedimiento_legal", Severity.HIGH,
			"fundamentos_juridicos", Severity.HIGH,
			"lesiones_permanentes", Severity.MEDIUM,
			"accidente_laboral", Severity.MEDIUM,
			"prestaciones", Severity.MEDIUM,
			"inss", Severity.LOW,
			"personal_limpieza", Severity.LOW,
			"lesiones_hombro", Severity.LOW);

	public static AggregationProfile defaults() {
		return AggregationProfile.builder().build();
	}

	public Severity riskTier(String category) {
		return category == null ? null : riskTiers.get(category.toLowerCase(Locale.ROOT));
	}
}
