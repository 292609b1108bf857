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
 * The six factors of the rule-based favorability score, with their default
 * weights and the property key that overrides each weight.
 */
public enum FactorType {

	LEXICAL("lexical_polarity", "WEIGHT_LEXICAL", 0.25),
	STRUCTURE("structural_completeness", "WEIGHT_STRUCTURE", 0.20),
	MEDICAL_EVIDENCE("medical_evidence", "WEIGHT_EVIDENCE", 0.20),
	PROCEDURE("procedural_compliance", "WEIGHT_PROCEDURE", 0.15),
	CONTEXT("occupational_context", "WEIGHT_CONTEXT", 0.10),
	TERMINOLOGY("legal_terminology", "WEIGHT_TERMINOLOGY", 0.10);

	private final String tag;
	private final String propertyKey;
	private final double defaultWeight;

	FactorType(String tag, String propertyKey, double defaultWeight) {
		this.tag = tag;
		this.propertyKey = propertyKey;
		this.defaultWeight = defaultWeight;
	}

	public String tag() {
		return tag;
	}

	public String propertyKey() {
		return propertyKey;
	}

	public double defaultWeight() {
		return defaultWeight;
	}
}
