package com.GlobeLine.fpl_cache.exception;

/**
 * Exception thrown when the outbound rate limiter refuses a call to the FPL API.
 */
public class UpstreamRateLimitedException extends RuntimeException {
	public UpstreamRateLimitedException(String message, Throwable cause) {
		super(message, cause);
	}
}
