package com.GlobeLine.fpl_cache.exception;

/**
 * Thrown when a request descriptor cannot be canonicalized into a cache key.
 * This is a caller bug and is never retried.
 */
public class InvalidKeyInputException extends RuntimeException {
	public InvalidKeyInputException(String message) {
		super(message);
	}

	public InvalidKeyInputException(String message, Throwable cause) {
		super(message, cause);
	}
}
