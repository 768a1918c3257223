package com.GlobeLine.fpl_cache.cache;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.GlobeLine.fpl_cache.exception.CacheStoreException;
import com.GlobeLine.fpl_cache.exception.CorruptEntryException;

/**
 * Persistent home of cache entries, one addressable unit per key.
 * All methods block on I/O; reactive callers must move them off the event loop.
 */
public interface CacheStore {

	/**
	 * @return the entry, or empty if nothing is stored for the key
	 * @throws CorruptEntryException if something is stored but cannot be parsed
	 * @throws CacheStoreException on I/O failure
	 */
	Optional<CacheEntry> get(CacheKey key);

	/**
	 * Replaces any prior entry for the same key. Readers observe either the old or the new entry, never a mix.
	 */
	void put(CacheEntry entry);

	/**
	 * Idempotent.
	 */
	void delete(CacheKey key);

	/**
	 * Keys whose TTL has run out at {@code now}, plus keys whose entries are unreadable.
	 */
	List<CacheKey> listExpired(Instant now);

	/**
	 * Removes every entry. This is the only global reset.
	 *
	 * @return number of entries removed
	 */
	int purge();

	CacheStoreStats stats();
}
