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

/**
 * Graded favorability label. Strength comes from the confidence buckets of
 * the scoring profile.
 */
public enum Verdict {

	VERY_FAVORABLE(true), FAVORABLE(true), PARTIALLY_FAVORABLE(true),
	PARTIALLY_UNFAVORABLE(false), UNFAVORABLE(false), VERY_UNFAVORABLE(false);

	private final boolean favorable;

	Verdict(boolean favorable) {
		this.favorable = favorable;
	}

	public boolean isFavorable() {
		return favorable;
	}

	public static Verdict of(boolean favorable, double confidence, double strong, double moderate) {
		if (confidence >= strong) {
			return favorable ? VERY_FAVORABLE : VERY_UNFAVORABLE;
		}
		if (confidence >= moderate) {
			return favorable ? FAVORABLE : UNFAVORABLE;
		}
		return favorable ? PARTIALLY_FAVORABLE : PARTIALLY_UNFAVORABLE;
	}
}
