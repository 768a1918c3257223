package com.GlobeLine.fpl_cache.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.GlobeLine.fpl_cache.cache.CacheEntry;
import com.GlobeLine.fpl_cache.cache.CacheKey;
import com.GlobeLine.fpl_cache.cache.CacheStore;
import com.GlobeLine.fpl_cache.cache.FetchOptions;
import com.GlobeLine.fpl_cache.cache.FetchResult;
import com.GlobeLine.fpl_cache.cache.Freshness;
import com.GlobeLine.fpl_cache.cache.Invalidator;
import com.GlobeLine.fpl_cache.config.CacheProperties;
import com.GlobeLine.fpl_cache.exception.CacheStoreException;
import com.GlobeLine.fpl_cache.exception.CorruptEntryException;
import com.GlobeLine.fpl_cache.exception.UpstreamUnavailableException;
import com.GlobeLine.fpl_cache.loader.LoadResult;
import com.GlobeLine.fpl_cache.loader.UpstreamLoader;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * Read-through fetch logic: serve from the disk cache when the entry is fresh, revalidate it
 * when it is stale, otherwise load from upstream and store the result.
 *
 * Concurrent fetches for the same key share one in-flight operation, so the upstream sees a
 * single call and every waiter observes the same outcome. A waiter that cancels or times out
 * only detaches itself; the shared load keeps running for the others.
 *
 * This class has no knowledge of metrics; it reports events to a {@link FetchEventObserver}.
 */
@Component
public class FetchOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(FetchOrchestrator.class);

	private final CacheStore cacheStore;
	private final Invalidator invalidator;
	private final Clock clock;
	private final CacheProperties properties;
	private FetchEventObserver eventObserver;
	private final ConcurrentHashMap<CacheKey, Mono<FetchResult>> inFlightRequests = new ConcurrentHashMap<>();

	public FetchOrchestrator(
			CacheStore cacheStore,
			Invalidator invalidator,
			Clock clock,
			CacheProperties properties) {
		this.cacheStore = cacheStore;
		this.invalidator = invalidator;
		this.clock = clock;
		this.properties = properties;
	}

	public void setObserver(FetchEventObserver observer) {
		this.eventObserver = observer;
	}

	/**
	 * Returns the payload for {@code key}, from cache or via {@code loader}.
	 *
	 * @return Mono of the result; errors with {@link UpstreamUnavailableException} only when the
	 *         loader failed and no cached entry can be served instead
	 */
	public Mono<FetchResult> fetch(CacheKey key, UpstreamLoader loader, FetchOptions options) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(loader, "loader");
		FetchOptions effective = options != null ? options : FetchOptions.defaults();

		return Mono.defer(() -> {
			Mono<FetchResult> inFlight = inFlightRequests.get(key);
			if (inFlight != null) {
				logger.debug("In-flight fetch found for key: {}, sharing the same operation", key);
				notifyObserver(FetchEventObserver::onInFlightSharing);
				return awaitShared(key, inFlight, loader, effective);
			}

			// released before the outcome reaches waiters, so a later caller never joins a finished flight
			Mono<FetchResult> fetchOperation = resolve(key, loader, effective)
					.doOnSuccess(result -> release(key, "success"))
					.doOnError(ex -> release(key, "error"))
					.doOnCancel(() -> release(key, "cancel"))
					.cache();

			Mono<FetchResult> existing = inFlightRequests.putIfAbsent(key, fetchOperation);
			if (existing != null) {
				logger.debug("Another caller created the in-flight fetch for key: {}, using it", key);
				notifyObserver(FetchEventObserver::onInFlightSharing);
				return awaitShared(key, existing, loader, effective);
			}
			return awaitShared(key, fetchOperation, loader, effective);
		});
	}

	/**
	 * Number of keys with a load currently in flight.
	 */
	public int inFlightCount() {
		return inFlightRequests.size();
	}

	public Mono<Void> evict(CacheKey key) {
		return Mono.<Void>fromRunnable(() -> cacheStore.delete(key))
				.subscribeOn(Schedulers.boundedElastic());
	}

	public Mono<Integer> purge() {
		return Mono.fromCallable(cacheStore::purge)
				.subscribeOn(Schedulers.boundedElastic());
	}

	/**
	 * Deletes entries that expired at or before {@code cutoff}. Keys with a load in flight are skipped.
	 *
	 * Each key's in-flight slot is held while its entry is re-read and deleted, so a fetch cannot
	 * store a fresh entry in between; a fetch arriving meanwhile waits for the slot and then loads.
	 *
	 * @return the keys that were removed
	 */
	public Mono<List<CacheKey>> sweepExpired(Instant cutoff) {
		return Mono.fromCallable(() -> {
			List<CacheKey> removed = new ArrayList<>();
			for (CacheKey key : cacheStore.listExpired(cutoff)) {
				if (sweepOne(key, cutoff)) {
					removed.add(key);
				}
			}
			return removed;
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private boolean sweepOne(CacheKey key, Instant cutoff) {
		Sinks.Empty<Void> released = Sinks.empty();
		// completes empty: waiters take that as "slot free" and start their own fetch
		Mono<FetchResult> reservation = released.asMono().then(Mono.<FetchResult>empty());
		if (inFlightRequests.putIfAbsent(key, reservation) != null) {
			logger.debug("Skipping sweep of key: {}, a fetch is in flight", key);
			return false;
		}
		try {
			if (!stillExpired(key, cutoff)) {
				logger.debug("Key: {} was refreshed since it was listed, keeping it", key);
				return false;
			}
			cacheStore.delete(key);
			return true;
		} finally {
			inFlightRequests.remove(key, reservation);
			released.tryEmitEmpty();
		}
	}

	private boolean stillExpired(CacheKey key, Instant cutoff) {
		try {
			return cacheStore.get(key)
					.map(entry -> !cutoff.isBefore(entry.expiresAt()))
					.orElse(false);
		} catch (CorruptEntryException ex) {
			return true;
		}
	}

	private void release(CacheKey key, String signal) {
		inFlightRequests.remove(key);
		logger.debug("Removed in-flight fetch for key: {} (signal: {})", key, signal);
	}

	/**
	 * Waits on a shared flight. A flight always ends with a result or an error, so an empty
	 * completion means the slot was only reserved by a sweep; the fetch then starts over.
	 */
	private Mono<FetchResult> awaitShared(CacheKey key, Mono<FetchResult> shared, UpstreamLoader loader,
			FetchOptions options) {
		Mono<FetchResult> waited = options.waitTimeout() != null ? shared.timeout(options.waitTimeout()) : shared;
		return waited.switchIfEmpty(Mono.defer(() -> fetch(key, loader, options)));
	}

	private Mono<FetchResult> resolve(CacheKey key, UpstreamLoader loader, FetchOptions options) {
		return readEntry(key)
				.flatMap(entry -> resolveExisting(key, entry, loader, options))
				.switchIfEmpty(Mono.defer(() -> {
					logger.debug("Cache miss for key: {}, loading from upstream", key);
					notifyObserver(FetchEventObserver::onCacheMiss);
					return loadFromUpstream(key, loader, options, null);
				}));
	}

	private Mono<FetchResult> resolveExisting(CacheKey key, CacheEntry entry, UpstreamLoader loader, FetchOptions options) {
		Freshness freshness = invalidator.classify(entry, clock.instant(), loader.supportsRevalidation());
		switch (freshness) {
			case FRESH -> {
				logger.debug("Cache hit for key: {}", key);
				notifyObserver(FetchEventObserver::onCacheHit);
				return Mono.just(FetchResult.cached(entry));
			}
			case STALE -> {
				logger.debug("Entry for key: {} is stale, revalidating", key);
				notifyObserver(FetchEventObserver::onCacheMiss);
				return revalidate(key, entry, loader, options);
			}
			default -> {
				logger.debug("Entry for key: {} expired at {}, refetching", key, entry.expiresAt());
				notifyObserver(FetchEventObserver::onCacheMiss);
				return loadFromUpstream(key, loader, options, entry);
			}
		}
	}

	private Mono<FetchResult> revalidate(CacheKey key, CacheEntry entry, UpstreamLoader loader, FetchOptions options) {
		return withLoaderTimeout(Mono.defer(() -> loader.revalidate(entry.validationMetadata())), options)
				.flatMap(outcome -> {
					if (!outcome.changed()) {
						CacheEntry renewed = entry.withStoredAt(clock.instant());
						logger.info("Upstream reports key: {} unchanged, renewed until {}", key, renewed.expiresAt());
						notifyObserver(FetchEventObserver::onRevalidated);
						return writeEntry(renewed).thenReturn(FetchResult.revalidated(renewed));
					}
					if (outcome.result() != null) {
						logger.info("Upstream reports key: {} changed, storing the new payload", key);
						return store(key, outcome.result(), options).map(FetchResult::upstream);
					}
					return Mono.<FetchResult>empty();
				})
				.onErrorResume(ex -> {
					logger.warn("Revalidation failed for key: {}, falling back to a full fetch. Error: {}",
							key, ex.getMessage());
					return Mono.empty();
				})
				.switchIfEmpty(Mono.defer(() -> loadFromUpstream(key, loader, options, entry)));
	}

	private Mono<FetchResult> loadFromUpstream(CacheKey key, UpstreamLoader loader, FetchOptions options, CacheEntry fallback) {
		return withLoaderTimeout(Mono.defer(loader::fetchFull), options)
				.switchIfEmpty(Mono.error(() -> new IllegalStateException("Loader completed without a result")))
				.flatMap(result -> store(key, result, options))
				.map(entry -> {
					logger.info("Loaded key: {} from upstream", key);
					return FetchResult.upstream(entry);
				})
				.onErrorResume(ex -> degrade(key, fallback, options, ex));
	}

	private Mono<FetchResult> degrade(CacheKey key, CacheEntry fallback, FetchOptions options, Throwable error) {
		notifyObserver(FetchEventObserver::onUpstreamFailure);
		boolean allowStale = options.allowStale() != null ? options.allowStale() : properties.serveStaleOnError();

		if (fallback != null && allowStale) {
			logger.warn("Upstream fetch failed for key: {} - returning stale entry stored at {}. Error: {}",
					key, fallback.storedAt(), error.getMessage());
			notifyObserver(FetchEventObserver::onStaleServed);
			return Mono.just(FetchResult.degraded(fallback));
		}

		if (fallback != null) {
			logger.error("Upstream fetch failed for key: {} and stale fallback is disabled for this call", key, error);
		} else {
			logger.error("Upstream fetch failed for key: {} and nothing is cached", key, error);
		}
		return Mono.error(new UpstreamUnavailableException(key, error));
	}

	private Mono<CacheEntry> store(CacheKey key, LoadResult result, FetchOptions options) {
		Duration ttl = options.ttl() != null ? options.ttl() : properties.defaultTtl();
		CacheEntry entry = new CacheEntry(key, result.payload(), clock.instant(), ttl.getSeconds(), result.metadata());
		return writeEntry(entry).thenReturn(entry);
	}

	/**
	 * Persists an entry. A failed write is logged and otherwise ignored: the caller still
	 * receives the data it just loaded and the previous entry stays on disk.
	 */
	private Mono<Void> writeEntry(CacheEntry entry) {
		return Mono.<Void>fromRunnable(() -> cacheStore.put(entry))
				.subscribeOn(Schedulers.boundedElastic())
				.onErrorResume(CacheStoreException.class, ex -> {
					logger.error("Failed to persist cache entry for key: {}", entry.key(), ex);
					return Mono.empty();
				});
	}

	private Mono<CacheEntry> readEntry(CacheKey key) {
		return Mono.fromCallable(() -> cacheStore.get(key).orElse(null))
				.subscribeOn(Schedulers.boundedElastic())
				.onErrorResume(CorruptEntryException.class, ex -> {
					logger.warn("Discarding corrupt cache entry for key: {} - {}", key, ex.getMessage());
					notifyObserver(FetchEventObserver::onCorruptEntry);
					return discard(key).then(Mono.<CacheEntry>empty());
				})
				.onErrorResume(CacheStoreException.class, ex -> {
					logger.warn("Could not read cache entry for key: {}, treating as a miss. Error: {}",
							key, ex.getMessage());
					return Mono.empty();
				});
	}

	private Mono<Void> discard(CacheKey key) {
		return Mono.<Void>fromRunnable(() -> cacheStore.delete(key))
				.onErrorResume(CacheStoreException.class, ex -> {
					logger.warn("Could not delete corrupt cache entry for key: {}. Error: {}", key, ex.getMessage());
					return Mono.empty();
				});
	}

	private <T> Mono<T> withLoaderTimeout(Mono<T> call, FetchOptions options) {
		Duration timeout = options.loaderTimeout() != null ? options.loaderTimeout() : properties.loaderTimeout();
		return timeout != null ? call.timeout(timeout) : call;
	}

	private void notifyObserver(Consumer<FetchEventObserver> event) {
		if (eventObserver != null) {
			event.accept(eventObserver);
		}
	}
}
