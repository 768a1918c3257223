package com.GlobeLine.fpl_cache.exception;

import com.GlobeLine.fpl_cache.cache.CacheKey;

/**
 * Exception thrown when the upstream load failed and no cached entry can stand in for it.
 */
public class UpstreamUnavailableException extends RuntimeException {

	private final CacheKey key;

	public UpstreamUnavailableException(CacheKey key, Throwable cause) {
		super("Upstream unavailable and nothing cached for key " + key, cause);
		this.key = key;
	}

	public CacheKey getKey() {
		return key;
	}
}
