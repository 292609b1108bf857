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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CatalogLoaderTest {

	@TempDir
	Path tmp;

	@Test
	void bundled_catalog_loads_all_categories_and_groups() {
		PatternCatalog c = CatalogLoader.defaults();

		assertTrue(c.getCategory("incapacidad_permanente_parcial").isPresent());
		assertTrue(c.getCategory("lesiones_permanentes").get().containsPhrase("LPNI"));
		assertTrue(c.getCategory("procedimiento_legal").isPresent());
		for (PatternGroup g : PatternGroup.values()) {
			assertFalse(c.patterns(g).isEmpty(), g.key());
		}
	}

	@Test
	void reads_phrases_in_file_order_and_empty_categories() throws Exception {
		String csv = "# comment\nCategory,Phrase\ninss,INSS\ninss,Seguridad Social\nvacia,\n,huérfana\n";
		Map<String, List<String>> out = CatalogLoader.readPhrases(new StringReader(csv));

		assertEquals(List.of("inss", "vacia"), List.copyOf(out.keySet()));
		assertEquals(List.of("INSS", "Seguridad Social"), out.get("inss"));
		assertTrue(out.get("vacia").isEmpty());
	}

	@Test
	void missing_column_is_a_configuration_error() {
		assertThrows(ConfigurationException.class,
				() -> CatalogLoader.readPhrases(new StringReader("name,phrase\na,b\n")));
	}

	@Test
	void unknown_group_is_a_configuration_error() {
		assertThrows(ConfigurationException.class,
				() -> CatalogLoader.readGroups(new StringReader("group,regex\nbogus,x\n")));
	}

	@Test
	void filesystem_location_wins_over_classpath() throws Exception {
		Path phrases = tmp.resolve("phrases.csv");
		Files.writeString(phrases, "category,phrase\nsolo,única\n", StandardCharsets.UTF_8);

		PatternCatalog c = CatalogLoader.load(phrases.toString(), CatalogLoader.DEFAULT_PATTERN_GROUPS);

		assertEquals(1, c.size());
		assertEquals(List.of("única"), c.getCategory("solo").get().getPhrases());
	}

	@Test
	void missing_location_or_empty_file_fails_at_load() throws Exception {
		assertThrows(ConfigurationException.class,
				() -> CatalogLoader.load(tmp.resolve("none.csv").toString(), CatalogLoader.DEFAULT_PATTERN_GROUPS));

		Path empty = tmp.resolve("empty.csv");
		Files.writeString(empty, "category,phrase\n", StandardCharsets.UTF_8);
		assertThrows(ConfigurationException.class,
				() -> CatalogLoader.load(empty.toString(), CatalogLoader.DEFAULT_PATTERN_GROUPS));
	}
}
