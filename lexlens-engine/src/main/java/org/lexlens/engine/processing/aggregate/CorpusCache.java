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
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

import org.lexlens.engine.om.CorpusReport;
import org.lexlens.engine.util.Logger;

import com.github.benmanes.caffeine.cache.AsyncLoadingCache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * TTL-bound holder of the corpus report, backed by a single-key Caffeine
 * {@link AsyncLoadingCache}.
 * <p>
 * Reads never block once a report exists: an expired value is served (flagged
 * stale) while Caffeine runs one load for the key. Only the very first read
 * waits, and no longer than the recompute timeout. A recomputation that fails
 * or times out leaves the last good report in place, marked stale with the
 * reason.
 * <p>
 * Loads run on a single worker thread, so at most one is ever executing.
 */
public final class CorpusCache implements AutoCloseable {

	private static final String KEY = "corpus";
	private static final String CLOSED = "Corpus cache closed";

	private static final class LastGood {
		final CorpusReport report;
		final String error;

		LastGood(CorpusReport report, String error) {
			this.report = report;
			this.error = error;
		}
	}

	private final Supplier<CorpusReport> computation;
	private final CorpusReport placeholder;
	private final Duration timeout;
	private final ExecutorService worker;
	private final AsyncLoadingCache<String, CorpusReport> cache;

	private final AtomicReference<LastGood> lastGood = new AtomicReference<>();
	private final AtomicLong recomputations = new AtomicLong();
	private volatile boolean closed;

	public CorpusCache(Supplier<CorpusReport> computation, CorpusReport placeholder, Duration ttl, Duration timeout) {
		this(computation, placeholder, ttl, timeout, System::nanoTime);
	}

	CorpusCache(Supplier<CorpusReport> computation, CorpusReport placeholder, Duration ttl, Duration timeout,
			LongSupplier nanoClock) {
		this.computation = Objects.requireNonNull(computation, "computation");
		this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
		if (ttl.isNegative() || timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("ttl must be >= 0 and timeout > 0");
		}
		this.timeout = timeout;
		this.worker = Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "lexlens-corpus-refresh");
			t.setDaemon(true);
			return t;
		});
		// maintenance runs on the caller; loads go to the worker
		this.cache = Caffeine.newBuilder()
				.expireAfterWrite(ttl)
				.ticker(nanoClock::getAsLong)
				.executor(Runnable::run)
				.buildAsync((key, executor) -> load());
	}

	/**
	 * Current corpus report. Fresh values are returned as is; anything else
	 * starts (or joins) the background load.
	 */
	public CorpusReport get() {
		LastGood last = lastGood.get();
		if (closed) {
			return (last != null ? last.report : placeholder).asStale(CLOSED);
		}
		CompletableFuture<CorpusReport> present = cache.getIfPresent(KEY);
		if (present != null && present.isDone() && !present.isCompletedExceptionally()) {
			return present.join();
		}
		CompletableFuture<CorpusReport> loading = cache.get(KEY);
		if (last != null) {
			return last.report.asStale(last.error != null ? last.error : "Corpus report expired; refresh in progress");
		}
		try {
			return await(loading);
		} catch (AggregationTimeoutException e) {
			Logger.warn("First corpus computation: {}", e.getMessage());
			return placeholder.asStale(e.getMessage());
		}
	}

	/** Marks the cached value expired; the next read starts a recomputation. */
	public void invalidate() {
		cache.synchronous().invalidate(KEY);
	}

	/** Number of recomputations started so far. */
	long recomputations() {
		return recomputations.get();
	}

	@Override
	public void close() {
		closed = true;
		worker.shutdownNow();
		cache.synchronous().invalidateAll();
	}

	private CompletableFuture<CorpusReport> load() {
		recomputations.incrementAndGet();
		Logger.debug("Recomputing corpus report (run {})", recomputations.get());

		CompletableFuture<CorpusReport> promise = new CompletableFuture<>();
		Future<?> task;
		try {
			task = worker.submit(() -> {
				try {
					publish(promise, computation.get());
				} catch (RuntimeException e) {
					promise.completeExceptionally(e);
				}
			});
		} catch (RejectedExecutionException e) {
			promise.completeExceptionally(new CancellationException(CLOSED));
			return promise;
		}

		promise.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((report, error) -> {
			if (error != null) {
				task.cancel(true);
				keepLastGood(describe(unwrap(error)));
			}
		});
		return promise;
	}

	// last good is recorded before the promise completes so waiters always see it
	private void publish(CompletableFuture<CorpusReport> promise, CorpusReport report) {
		if (promise.isDone()) {
			return;
		}
		lastGood.set(new LastGood(report, null));
		promise.complete(report);
		Logger.debug("Corpus report published: {} processed, {} failed", report.getProcessedDocuments(),
				report.getFailedDocuments());
	}

	private void keepLastGood(String reason) {
		LastGood previous = lastGood.updateAndGet(g -> g == null ? null : new LastGood(g.report, reason));
		if (previous == null) {
			Logger.warn("{}; no previous corpus report to fall back on", reason);
		} else {
			Logger.warn("{}; serving last good corpus report", reason);
		}
	}

	private CorpusReport await(CompletableFuture<CorpusReport> loading) throws AggregationTimeoutException {
		try {
			return loading.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return placeholder.asStale("Interrupted while waiting for corpus report");
		} catch (TimeoutException e) {
			throw new AggregationTimeoutException(timeout);
		} catch (ExecutionException | CancellationException e) {
			Throwable cause = unwrap(e);
			if (cause instanceof TimeoutException) {
				throw new AggregationTimeoutException(timeout);
			}
			return placeholder.asStale(describe(cause));
		}
	}

	private String describe(Throwable error) {
		if (error instanceof TimeoutException) {
			return new AggregationTimeoutException(timeout).getMessage();
		}
		if (error instanceof CancellationException) {
			return error.getMessage() != null ? error.getMessage() : CLOSED;
		}
		return "Corpus recomputation failed: " + error.getMessage();
	}

	private static Throwable unwrap(Throwable t) {
		while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
			t = t.getCause();
		}
		return t;
	}
}
