package com.GlobeLine.fpl_cache.connectors;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body and validators of an FPL API response. A 304 answer has no body.
 */
public record UpstreamResponse(int status, JsonNode body, String etag, String lastModified) {

	public static UpstreamResponse notModified() {
		return new UpstreamResponse(304, null, null, null);
	}

	public boolean isNotModified() {
		return status == 304;
	}
}
