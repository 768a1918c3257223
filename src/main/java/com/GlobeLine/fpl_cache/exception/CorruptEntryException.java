package com.GlobeLine.fpl_cache.exception;

import com.GlobeLine.fpl_cache.cache.CacheKey;

/**
 * A stored entry exists but cannot be parsed. Readers treat it as a miss.
 */
public class CorruptEntryException extends CacheStoreException {

	private final CacheKey key;

	public CorruptEntryException(CacheKey key, String reason, Throwable cause) {
		super("Corrupt cache entry " + key + ": " + reason, cause);
		this.key = key;
	}

	public CacheKey getKey() {
		return key;
	}
}
