package com.GlobeLine.fpl_cache.exception;

/**
 * Exception thrown when the on-disk cache cannot be read or written
 * (permissions, disk full, root is not a directory, etc.)
 */
public class CacheStoreException extends RuntimeException {
	public CacheStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
