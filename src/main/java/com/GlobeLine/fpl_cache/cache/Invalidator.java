package com.GlobeLine.fpl_cache.cache;

import java.time.Instant;

import org.springframework.stereotype.Component;

/**
 * Decides whether a stored entry can be served as-is, needs a revalidation round-trip,
 * or has to be refetched. Pure and synchronous.
 */
@Component
public class Invalidator {

	public Freshness classify(CacheEntry entry, Instant now, boolean revalidationSupported) {
		if (isWithinTtl(entry, now)) {
			return Freshness.FRESH;
		}
		if (revalidationSupported && entry.hasValidationMetadata()) {
			return Freshness.STALE;
		}
		return Freshness.EXPIRED;
	}

	/**
	 * Fresh at times in [storedAt, storedAt + ttl). A missing or zero TTL is never fresh,
	 * and neither is an entry stamped in the future (the clock moved backwards).
	 */
	private boolean isWithinTtl(CacheEntry entry, Instant now) {
		if (entry.ttlSeconds() == null || entry.ttlSeconds() <= 0) {
			return false;
		}
		return !now.isBefore(entry.storedAt()) && now.isBefore(entry.expiresAt());
	}
}
