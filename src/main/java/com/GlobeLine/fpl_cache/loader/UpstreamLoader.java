package com.GlobeLine.fpl_cache.loader;

import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * What the fetch orchestrator needs from a data source: a full load, and optionally a cheap
 * check of whether previously loaded data is still current.
 */
public interface UpstreamLoader {

	/**
	 * Loads the data in full, together with whatever freshness hints the source offers.
	 */
	Mono<LoadResult> fetchFull();

	default boolean supportsRevalidation() {
		return false;
	}

	/**
	 * Asks the source whether data described by {@code validationMetadata} is still current.
	 * Only called when {@link #supportsRevalidation()} is true.
	 */
	default Mono<Revalidation> revalidate(Map<String, String> validationMetadata) {
		return Mono.just(Revalidation.changedWithoutPayload());
	}
}
