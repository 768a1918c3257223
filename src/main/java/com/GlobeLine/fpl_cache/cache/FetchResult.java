package com.GlobeLine.fpl_cache.cache;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of a read-through fetch. {@code stale} is set when an expired entry is served
 * because the upstream could not be reached.
 */
public record FetchResult(JsonNode payload, Origin origin, boolean stale, Instant storedAt) {

	public static FetchResult cached(CacheEntry entry) {
		return new FetchResult(entry.payload(), Origin.CACHE, false, entry.storedAt());
	}

	public static FetchResult revalidated(CacheEntry entry) {
		return new FetchResult(entry.payload(), Origin.REVALIDATED, false, entry.storedAt());
	}

	public static FetchResult upstream(CacheEntry entry) {
		return new FetchResult(entry.payload(), Origin.UPSTREAM, false, entry.storedAt());
	}

	public static FetchResult degraded(CacheEntry entry) {
		return new FetchResult(entry.payload(), Origin.CACHE, true, entry.storedAt());
	}
}
