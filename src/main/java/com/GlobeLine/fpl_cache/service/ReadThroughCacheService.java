package com.GlobeLine.fpl_cache.service;

import java.util.List;

import jakarta.annotation.PostConstruct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.GlobeLine.fpl_cache.cache.CacheKey;
import com.GlobeLine.fpl_cache.cache.FetchOptions;
import com.GlobeLine.fpl_cache.cache.FetchResult;
import com.GlobeLine.fpl_cache.cache.KeyCodec;
import com.GlobeLine.fpl_cache.cache.KeyParam;
import com.GlobeLine.fpl_cache.exception.UpstreamUnavailableException;
import com.GlobeLine.fpl_cache.loader.UpstreamLoader;
import com.GlobeLine.fpl_cache.metrics.CacheMetrics;

import io.micrometer.core.instrument.Timer;
import reactor.core.publisher.Mono;

/**
 * Decorator service that wraps FetchOrchestrator and adds metrics instrumentation.
 * This is the entry point consumers use instead of calling the upstream directly.
 *
 * Implements Decorator Pattern (wraps the orchestrator with metrics) and Observer Pattern
 * (receives read-through events from the orchestrator for metrics recording).
 */
@Service
public class ReadThroughCacheService implements FetchEventObserver {

	private static final Logger logger = LoggerFactory.getLogger(ReadThroughCacheService.class);

	private final FetchOrchestrator orchestrator;
	private final KeyCodec keyCodec;
	private final CacheMetrics metrics;

	public ReadThroughCacheService(FetchOrchestrator orchestrator, KeyCodec keyCodec, CacheMetrics metrics) {
		this.orchestrator = orchestrator;
		this.keyCodec = keyCodec;
		this.metrics = metrics;
	}

	@PostConstruct
	public void wireObserver() {
		orchestrator.setObserver(this);
	}

	@Override
	public void onCacheHit() {
		metrics.recordCacheHit();
	}

	@Override
	public void onCacheMiss() {
		metrics.recordCacheMiss();
	}

	@Override
	public void onInFlightSharing() {
		metrics.recordInFlightSharing();
	}

	@Override
	public void onRevalidated() {
		metrics.recordRevalidated();
	}

	@Override
	public void onStaleServed() {
		metrics.recordStaleServed();
	}

	@Override
	public void onCorruptEntry() {
		metrics.recordCorruptEntry();
	}

	@Override
	public void onUpstreamFailure() {
		metrics.recordUpstreamFailure();
	}

	/**
	 * Derives the key for {@code namespace}/{@code params} and fetches through the cache.
	 * Invalid key input surfaces as an error signal before any cache or upstream access.
	 */
	public Mono<FetchResult> fetch(String namespace, List<KeyParam> params, UpstreamLoader loader, FetchOptions options) {
		return Mono.defer(() -> fetch(keyCodec.deriveKey(namespace, params), loader, options));
	}

	public Mono<FetchResult> fetch(CacheKey key, UpstreamLoader loader, FetchOptions options) {
		Timer.Sample sample = metrics.startTimer();
		return orchestrator.fetch(key, loader, options)
				.doOnSuccess(result -> {
					if (result != null && result.stale()) {
						logger.debug("Served stale data for key: {} stored at {}", key, result.storedAt());
					}
				})
				.doOnError(UpstreamUnavailableException.class, ex -> metrics.recordUpstreamUnavailable())
				.doFinally(signalType -> {
					metrics.stopTimer(sample);
					logger.debug("Completed fetch for key: {} with signal: {}", key, signalType);
				});
	}
}
