package org.lexlens.engine.catalog;

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
import java.util.regex.Pattern;

/**
 * Named regex groups the discrepancy detector cross-references.
 */
public enum PatternGroup {

	STRUCTURAL_INJURY("structural_injury", 0),
	FUNCTIONAL_LIMITATION("functional_limitation", 0),
	/** Two-clause spans; "." must cross line breaks. */
	INTERNAL_CONTRADICTION("internal_contradiction", Pattern.DOTALL),
	LPNI_TERMINOLOGY("lpni_terminology", 0),
	IPP_TERMINOLOGY("ipp_terminology", 0),
	OBJECTIVE_EVIDENCE("objective_evidence", 0);

	private final String key;
	private final int extraFlags;

	PatternGroup(String key, int extraFlags) {
		this.key = key;
		this.extraFlags = extraFlags;
	}

	public String key() {
		return key;
	}

	int flags() {
		return Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | extraFlags;
	}

	/** Resolves a CSV key; accepts both {@code structural_injury} and {@code STRUCTURAL_INJURY}. */
	public static PatternGroup fromKey(String raw) {
		if (raw != null) {
			String k = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
			for (PatternGroup g : values()) {
				if (g.key.equals(k)) {
					return g;
				}
			}
		}
		throw new ConfigurationException("Unknown pattern group: '" + raw + "'");
	}
}
