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

/** Kind of favorable medical evidence collected from a report. */
public enum EvidenceType {

	STRUCTURAL_INJURY("lesion_estructural_grave"),
	FUNCTIONAL_LIMITATION("limitacion_funcional_objetiva"),
	PROLONGED_DURATION("duracion_prolongada");

	private final String tag;

	EvidenceType(String tag) {
		this.tag = tag;
	}

	public String tag() {
		return tag;
	}
}
