package org.lexlens.engine.processing.aggregate;

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

import java.time.Duration;

/**
 * The corpus recomputation did not finish within its time budget.
 */
public class AggregationTimeoutException extends Exception {

	private static final long serialVersionUID = 1L;

	public AggregationTimeoutException(Duration budget) {
		super("Corpus recomputation exceeded " + budget.toMillis() + " ms");
	}
}
