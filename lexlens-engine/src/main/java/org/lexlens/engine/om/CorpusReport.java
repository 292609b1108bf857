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

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

/**
 * Everything derived from the current set of document analyses. A report
 * flagged {@code stale} is the last good value served after a failed or
 * timed-out recomputation; {@code error} then says why.
 */
@Value
@Builder(toBuilder = true)
public class CorpusReport {
	CorpusRanking ranking;
	AggregatePrediction prediction;
	RiskAnalysis risk;
	int processedDocuments;
	int failedDocuments;
	Instant computedAt;
	boolean stale;
	String error;

	public CorpusReport asStale(String reason) {
		return toBuilder().stale(true).error(reason).build();
	}
}
