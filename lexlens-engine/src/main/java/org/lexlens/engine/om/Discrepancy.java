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
 * A detected mismatch between medical findings and the legal classification,
 * or an internal contradiction of a report.
 */
@Value
@Builder
public class Discrepancy {
	DiscrepancyType type;
	String description;
	Severity severity;
	/** Matched snippets that triggered the rule. */
	@Singular
	List<String> evidenceRefs;
	String contradiction;
	String argument;
	int position;
}
