package org.lexlens.engine.util;

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

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Upstream collaborator that turns a source file into UTF-8 text. The engine
 * is agnostic to the file format; PDF or office readers plug in here.
 */
@FunctionalInterface
public interface TextExtractor {

	String extractText(Path path) throws ExtractionException;

	/** Reads the file as UTF-8 plain text. */
	static TextExtractor plainText() {
		return path -> {
			if (path == null || !Files.isReadable(path)) {
				throw new ExtractionException(path, "File is not readable: " + path);
			}
			try {
				return Files.readString(path, StandardCharsets.UTF_8);
			} catch (CharacterCodingException e) {
				throw new ExtractionException(path, "File is not valid UTF-8: " + path, e);
			} catch (IOException e) {
				throw new ExtractionException(path, "Failed to read " + path + ": " + e.getMessage(), e);
			}
		};
	}
}
