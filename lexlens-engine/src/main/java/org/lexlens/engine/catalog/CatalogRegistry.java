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

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import org.lexlens.engine.util.Logger;

/**
 * Holder of the published catalog. Readers call {@link #current()} on every
 * use and never block; edits are serialized, validated against the current
 * snapshot and published atomically. A rejected edit throws
 * {@link ConfigurationException} and leaves the published catalog as it was.
 */
public final class CatalogRegistry {

	private final AtomicReference<PatternCatalog> current;
	private final Object writeLock = new Object();

	public CatalogRegistry(PatternCatalog initial) {
		this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial catalog"));
	}

	public PatternCatalog current() {
		return current.get();
	}

	public PatternCatalog createCategory(String name, Collection<String> phrases) {
		return apply("create category " + name, c -> c.withCategory(name, phrases));
	}

	public PatternCatalog renameCategory(String oldName, String newName) {
		return apply("rename category " + oldName + " -> " + newName, c -> c.withCategoryRenamed(oldName, newName));
	}

	public PatternCatalog deleteCategory(String name) {
		return apply("delete category " + name, c -> c.withoutCategory(name));
	}

	public PatternCatalog addPhrase(String category, String phrase) {
		return apply("add phrase to " + category, c -> c.withPhrase(category, phrase));
	}

	public PatternCatalog removePhrase(String category, String phrase) {
		return apply("remove phrase from " + category, c -> c.withoutPhrase(category, phrase));
	}

	public PatternCatalog renamePhrase(String category, String oldPhrase, String newPhrase) {
		return apply("rename phrase in " + category, c -> c.withPhraseRenamed(category, oldPhrase, newPhrase));
	}

	public PatternCatalog replaceAll(Map<String, ? extends Collection<String>> phrases) {
		return apply("replace catalog", c -> c.withMapping(phrases));
	}

	private PatternCatalog apply(String what, UnaryOperator<PatternCatalog> edit) {
		synchronized (writeLock) {
			PatternCatalog before = current.get();
			PatternCatalog after;
			try {
				after = edit.apply(before);
			} catch (ConfigurationException e) {
				Logger.warn("Rejected catalog edit ({}): {}", what, e.getMessage());
				throw e;
			}
			if (after != before) {
				current.set(after);
				Logger.info("Catalog edit applied ({}): v{} -> v{}, {} categories", what, before.getVersion(),
						after.getVersion(), after.size());
			}
			return after;
		}
	}
}
