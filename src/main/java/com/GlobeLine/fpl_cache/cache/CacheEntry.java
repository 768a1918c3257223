package com.GlobeLine.fpl_cache.cache;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One persisted cache entry. Entries are immutable; a refresh writes a whole new entry.
 *
 * {@code ttlSeconds} may be null when read from a document that does not carry one;
 * such entries are never considered fresh.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEntry(
		@JsonProperty("key") CacheKey key,
		@JsonProperty("payload") JsonNode payload,
		@JsonProperty("storedAt") Instant storedAt,
		@JsonProperty("ttlSeconds") Long ttlSeconds,
		@JsonProperty("validationMetadata") Map<String, String> validationMetadata) {

	public static final long DEFAULT_TTL_SECONDS = 3600;

	public CacheEntry {
		validationMetadata = validationMetadata == null ? Map.of() : Map.copyOf(validationMetadata);
	}

	/**
	 * Instant at which the entry stops being fresh. Entries without a TTL expire at {@code storedAt};
	 * a TTL reaching past {@link Instant#MAX} is capped there.
	 */
	@JsonIgnore
	public Instant expiresAt() {
		long ttl = ttlSeconds == null ? 0 : Math.max(0, ttlSeconds);
		if (ttl > Instant.MAX.getEpochSecond() - storedAt.getEpochSecond()) {
			return Instant.MAX;
		}
		return storedAt.plusSeconds(ttl);
	}

	@JsonIgnore
	public boolean hasValidationMetadata() {
		return !validationMetadata.isEmpty();
	}

	/**
	 * Same payload and metadata, new write time. Used when revalidation renews the TTL.
	 */
	public CacheEntry withStoredAt(Instant newStoredAt) {
		return new CacheEntry(key, payload, newStoredAt, ttlSeconds, validationMetadata);
	}
}
