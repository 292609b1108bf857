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

/**
 * Malformed or inconsistent catalog configuration. Fatal when loading;
 * on an update the edit is rejected and the published catalog is kept.
 */
public class ConfigurationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public enum Reason {
		/** Empty, blank or otherwise unusable input. */
		INVALID,
		/** The referenced category or phrase does not exist. */
		NOT_FOUND,
		/** The target name is already taken. */
		CONFLICT
	}

	private final Reason reason;

	public ConfigurationException(String message) {
		this(Reason.INVALID, message);
	}

	public ConfigurationException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
		this.reason = Reason.INVALID;
	}

	public Reason getReason() {
		return reason;
	}
}
