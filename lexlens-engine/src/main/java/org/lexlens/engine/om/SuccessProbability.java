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

import lombok.Value;

/**
 * Blend of verdict confidence and mean factor score, with the per-factor
 * bonus already applied.
 */
@Value
public class SuccessProbability {

	public enum Band {
		VERY_HIGH, HIGH, MEDIUM, LOW;

		public static Band of(double p) {
			if (p >= 0.8) return VERY_HIGH;
			if (p >= 0.6) return HIGH;
			if (p >= 0.4) return MEDIUM;
			return LOW;
		}
	}

	double probability;
	double meanFactorScore;
	double bonus;
	Band band;
}
