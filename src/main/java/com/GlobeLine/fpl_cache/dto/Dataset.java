package com.GlobeLine.fpl_cache.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import com.GlobeLine.fpl_cache.cache.FetchResult;
import com.GlobeLine.fpl_cache.cache.Origin;

/**
 * Data handed to consumers together with where it came from, so a UI can flag stale data.
 */
public record Dataset<T>(
		@JsonProperty("data") T data,
		@JsonProperty("origin") Origin origin,
		@JsonProperty("stale") boolean stale,
		@JsonProperty("storedAt") Instant storedAt) {

	public static <T> Dataset<T> from(FetchResult result, T data) {
		return new Dataset<>(data, result.origin(), result.stale(), result.storedAt());
	}

	/**
	 * Data derived from two fetches: stale if either was, dated by the older one.
	 */
	public static <T> Dataset<T> combine(FetchResult primary, FetchResult secondary, T data) {
		Instant storedAt = primary.storedAt().isBefore(secondary.storedAt()) ? primary.storedAt() : secondary.storedAt();
		return new Dataset<>(data, primary.origin(), primary.stale() || secondary.stale(), storedAt);
	}
}
