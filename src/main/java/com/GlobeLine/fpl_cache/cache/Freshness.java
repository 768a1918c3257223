package com.GlobeLine.fpl_cache.cache;

public enum Freshness {
	/** Within its TTL; serve without contacting upstream. */
	FRESH,
	/** TTL elapsed but the upstream can confirm it cheaply. */
	STALE,
	/** Must be refetched in full. */
	EXPIRED
}
