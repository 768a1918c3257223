package com.GlobeLine.fpl_cache.service;

/**
 * Observer interface for read-through events.
 * Lets the orchestrator report what happened without knowing about metrics.
 */
public interface FetchEventObserver {

	void onCacheHit();
	void onCacheMiss();
	void onInFlightSharing();
	void onRevalidated();
	void onStaleServed();
	void onCorruptEntry();
	void onUpstreamFailure();
}
