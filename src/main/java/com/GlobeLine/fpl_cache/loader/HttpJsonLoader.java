package com.GlobeLine.fpl_cache.loader;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import com.GlobeLine.fpl_cache.connectors.FplApiClient;
import com.GlobeLine.fpl_cache.connectors.UpstreamResponse;

import reactor.core.publisher.Mono;

/**
 * Loads one FPL API endpoint as JSON.
 *
 * Validation metadata is taken from the ETag and Last-Modified response headers and from the
 * {@code last_updated} field some FPL documents carry. Revalidation sends a conditional GET:
 * 304 means unchanged; a 200 whose {@code last_updated} matches the stored one is also
 * treated as unchanged, otherwise the new body is handed back as the changed payload.
 */
public class HttpJsonLoader implements UpstreamLoader {

	public static final String ETAG = "etag";
	public static final String LAST_MODIFIED = "lastModified";
	public static final String UPSTREAM_TIMESTAMP = "upstreamTimestamp";

	private static final String LAST_UPDATED_FIELD = "last_updated";

	private final FplApiClient client;
	private final String path;

	public HttpJsonLoader(FplApiClient client, String path) {
		this.client = client;
		this.path = path;
	}

	public String getPath() {
		return path;
	}

	@Override
	public Mono<LoadResult> fetchFull() {
		return client.conditionalGet(path, null, null)
				.flatMap(response -> response.isNotModified()
						? Mono.<LoadResult>error(new IllegalStateException("Unconditional GET of " + path + " answered 304"))
						: Mono.just(toLoadResult(response)));
	}

	@Override
	public boolean supportsRevalidation() {
		return true;
	}

	@Override
	public Mono<Revalidation> revalidate(Map<String, String> validationMetadata) {
		String storedTimestamp = validationMetadata.get(UPSTREAM_TIMESTAMP);
		return client.conditionalGet(path, validationMetadata.get(ETAG), validationMetadata.get(LAST_MODIFIED))
				.map(response -> {
					if (response.isNotModified()) {
						return Revalidation.unchanged();
					}
					LoadResult fresh = toLoadResult(response);
					String freshTimestamp = fresh.metadata().get(UPSTREAM_TIMESTAMP);
					if (storedTimestamp != null && storedTimestamp.equals(freshTimestamp)) {
						return Revalidation.unchanged();
					}
					return Revalidation.changed(fresh);
				});
	}

	private LoadResult toLoadResult(UpstreamResponse response) {
		Map<String, String> metadata = new LinkedHashMap<>();
		if (response.etag() != null) {
			metadata.put(ETAG, response.etag());
		}
		if (response.lastModified() != null) {
			metadata.put(LAST_MODIFIED, response.lastModified());
		}
		JsonNode lastUpdated = response.body().get(LAST_UPDATED_FIELD);
		if (lastUpdated != null && lastUpdated.isValueNode() && !lastUpdated.isNull()) {
			metadata.put(UPSTREAM_TIMESTAMP, lastUpdated.asText());
		}
		return new LoadResult(response.body(), metadata);
	}
}
