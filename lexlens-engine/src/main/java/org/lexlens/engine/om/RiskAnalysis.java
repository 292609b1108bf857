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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Corpus risk from tiered category totals scaled by court authority.
 */
@Value
@Builder
public class RiskAnalysis {
	int highTierOccurrences;
	int mediumTierOccurrences;
	int lowTierOccurrences;
	double supremeRatio;
	double appellateRatio;
	double instanceMultiplier;
	/** (high x 3 + medium x 2 + low) x instance multiplier. */
	double weightedValue;
	Severity level;
	@Singular
	List<String> dominantCategories;
	@Singular
	List<String> recommendedActions;
}
