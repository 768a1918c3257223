package com.GlobeLine.fpl_cache.cache;

import java.time.Duration;

/**
 * Per-call fetch options. Null fields fall back to the configured defaults.
 *
 * @param ttl           validity window of an entry written by this call
 * @param allowStale    whether an expired entry may be served when the upstream fails
 * @param loaderTimeout deadline applied to the upstream call started by this fetch
 * @param waitTimeout   how long this caller waits for a result; never cancels a shared load
 */
public record FetchOptions(Duration ttl, Boolean allowStale, Duration loaderTimeout, Duration waitTimeout) {

	private static final FetchOptions DEFAULTS = new FetchOptions(null, null, null, null);

	public FetchOptions {
		if (ttl != null && ttl.isNegative()) {
			throw new IllegalArgumentException("TTL must not be negative: " + ttl);
		}
	}

	public static FetchOptions defaults() {
		return DEFAULTS;
	}

	public FetchOptions withTtl(Duration newTtl) {
		return new FetchOptions(newTtl, allowStale, loaderTimeout, waitTimeout);
	}

	public FetchOptions withoutStaleFallback() {
		return new FetchOptions(ttl, false, loaderTimeout, waitTimeout);
	}

	public FetchOptions withLoaderTimeout(Duration timeout) {
		return new FetchOptions(ttl, allowStale, timeout, waitTimeout);
	}

	public FetchOptions withWaitTimeout(Duration timeout) {
		return new FetchOptions(ttl, allowStale, loaderTimeout, timeout);
	}
}
