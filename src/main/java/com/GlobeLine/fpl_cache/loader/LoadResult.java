package com.GlobeLine.fpl_cache.loader;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload returned by a loader plus its validation metadata (entity tag, last-modified, ...).
 */
public record LoadResult(JsonNode payload, Map<String, String> metadata) {

	public LoadResult {
		if (payload == null) {
			throw new IllegalArgumentException("Loader payload must not be null");
		}
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

	public static LoadResult of(JsonNode payload) {
		return new LoadResult(payload, Map.of());
	}
}
