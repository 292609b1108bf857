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

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.lexlens.engine.om.CorpusReport;
import org.lexlens.engine.om.DocumentAnalysis;

/**
 * The set of analyzed documents plus the cached corpus report derived from
 * them. Adding or removing a document invalidates the cache; reads go
 * through {@link CorpusCache}.
 */
public final class CorpusService implements AutoCloseable {

	private final Map<String, DocumentAnalysis> documents = new LinkedHashMap<>();
	private volatile List<DocumentAnalysis> snapshot = List.of();
	private final CorpusCache cache;

	public CorpusService(EvidenceAggregator aggregator, Duration ttl, Duration timeout) {
		this.cache = new CorpusCache(() -> aggregator.aggregate(snapshot), aggregator.emptyReport(), ttl, timeout);
	}

	/** Adds the analysis, replacing any earlier one with the same document id. */
	public void add(DocumentAnalysis analysis) {
		synchronized (documents) {
			documents.put(analysis.getDocumentId(), analysis);
			publish();
		}
	}

	public void addAll(Collection<DocumentAnalysis> analyses) {
		synchronized (documents) {
			for (DocumentAnalysis a : analyses) {
				documents.put(a.getDocumentId(), a);
			}
			publish();
		}
	}

	public boolean remove(String documentId) {
		synchronized (documents) {
			boolean removed = documents.remove(documentId) != null;
			if (removed) publish();
			return removed;
		}
	}

	public void clear() {
		synchronized (documents) {
			documents.clear();
			publish();
		}
	}

	public List<DocumentAnalysis> documents() {
		return snapshot;
	}

	public CorpusReport report() {
		return cache.get();
	}

	@Override
	public void close() {
		cache.close();
	}

	private void publish() {
		snapshot = List.copyOf(documents.values());
		cache.invalidate();
	}
}
