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

import lombok.Builder;
import lombok.Value;

/**
 * One matched instance of a catalog phrase. {@code position} is the char
 * offset of the match in the source text and {@code line} is 1-based.
 */
@Value
@Builder
public class Occurrence {
	String category;
	/** Catalog variant that produced the match. */
	String phrase;
	/** Text as it appears in the document. */
	String matchedText;
	int position;
	int line;
	String context;
	String documentId;
}
