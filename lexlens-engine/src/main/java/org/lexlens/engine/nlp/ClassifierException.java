package org.lexlens.engine.nlp;

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
 * Failure of the optional statistical classifier. Never reaches callers of
 * the engine: scoring falls back to the rule-based verdict.
 */
public class ClassifierException extends Exception {

	private static final long serialVersionUID = 1L;

	public ClassifierException(String message) {
		super(message);
	}

	public ClassifierException(String message, Throwable cause) {
		super(message, cause);
	}
}
