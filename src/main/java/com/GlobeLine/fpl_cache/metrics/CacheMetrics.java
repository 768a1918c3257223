package com.GlobeLine.fpl_cache.metrics;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Centralized metrics for read-through cache operations.
 */
@Component
public class CacheMetrics {

	private final Counter cacheHitCounter;
	private final Counter cacheMissCounter;
	private final Counter inFlightSharingCounter;
	private final Counter revalidatedCounter;
	private final Counter staleServedCounter;
	private final Counter corruptEntryCounter;
	private final Counter upstreamFailureCounter;
	private final Counter upstreamUnavailableCounter;
	private final Timer fetchTimer;

	public CacheMetrics(MeterRegistry meterRegistry) {
		this.cacheHitCounter = Counter.builder("fpl.cache.hits")
				.description("Number of fetches served from a fresh cache entry")
				.register(meterRegistry);

		this.cacheMissCounter = Counter.builder("fpl.cache.misses")
				.description("Number of fetches that found no fresh cache entry")
				.register(meterRegistry);

		this.inFlightSharingCounter = Counter.builder("fpl.cache.inflight.sharing")
				.description("Number of fetches that attached to an in-flight upstream load")
				.register(meterRegistry);

		this.revalidatedCounter = Counter.builder("fpl.cache.revalidated")
				.description("Number of stale entries renewed after the upstream reported them unchanged")
				.register(meterRegistry);

		this.staleServedCounter = Counter.builder("fpl.cache.stale.served")
				.description("Number of expired entries served because the upstream failed")
				.register(meterRegistry);

		this.corruptEntryCounter = Counter.builder("fpl.cache.errors.corrupt_entry")
				.description("Number of unreadable cache entries discarded")
				.tag("error_type", "corrupt_entry")
				.register(meterRegistry);

		this.upstreamFailureCounter = Counter.builder("fpl.cache.errors.upstream_failure")
				.description("Number of failed upstream loads, whether or not a fallback was served")
				.tag("error_type", "upstream_failure")
				.register(meterRegistry);

		this.upstreamUnavailableCounter = Counter.builder("fpl.cache.errors.upstream_unavailable")
				.description("Number of fetches that failed with nothing cached to fall back on")
				.tag("error_type", "upstream_unavailable")
				.register(meterRegistry);

		this.fetchTimer = Timer.builder("fpl.cache.fetch.duration")
				.description("Time taken to resolve a read-through fetch (end-to-end)")
				.register(meterRegistry);
	}

	public void recordCacheHit() {
		cacheHitCounter.increment();
	}

	public void recordCacheMiss() {
		cacheMissCounter.increment();
	}

	public void recordInFlightSharing() {
		inFlightSharingCounter.increment();
	}

	public void recordRevalidated() {
		revalidatedCounter.increment();
	}

	public void recordStaleServed() {
		staleServedCounter.increment();
	}

	public void recordCorruptEntry() {
		corruptEntryCounter.increment();
	}

	public void recordUpstreamFailure() {
		upstreamFailureCounter.increment();
	}

	public void recordUpstreamUnavailable() {
		upstreamUnavailableCounter.increment();
	}

	public Timer.Sample startTimer() {
		return Timer.start();
	}

	public void stopTimer(Timer.Sample sample) {
		sample.stop(fetchTimer);
	}
}
