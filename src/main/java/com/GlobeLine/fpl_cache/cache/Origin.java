package com.GlobeLine.fpl_cache.cache;

/**
 * Where a fetch result came from.
 */
public enum Origin {
	CACHE,
	REVALIDATED,
	UPSTREAM
}
