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

import java.util.List;
import java.util.Locale;

import org.lexlens.engine.om.CourtInstance;

/**
 * Guesses the issuing court from a document id or file name: {@code sts_...}
 * or {@code tribunal_supremo...} is the Supreme Court, {@code tsj_...} or
 * {@code tribunal_superior...} a regional High Court.
 */
public final class CourtInstanceClassifier {

	private static final List<String> SUPREME = List.of("sts_", "sts-", "sts ", "tribunal_supremo", "tribunal-supremo");
	private static final List<String> APPELLATE = List.of("tsj_", "tsj-", "tsj ", "tribunal_superior",
			"tribunal-superior");

	private CourtInstanceClassifier() {
	}

	public static CourtInstance classify(String documentId) {
		if (documentId == null) return CourtInstance.OTHER;
		String id = documentId.toLowerCase(Locale.ROOT);
		if (SUPREME.stream().anyMatch(id::contains)) return CourtInstance.SUPREME;
		if (APPELLATE.stream().anyMatch(id::contains)) return CourtInstance.APPELLATE;
		return CourtInstance.OTHER;
	}
}
