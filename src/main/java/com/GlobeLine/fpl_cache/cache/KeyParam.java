package com.GlobeLine.fpl_cache.cache;

/**
 * One named parameter of a logical upstream request.
 */
public record KeyParam(String name, Object value) {

	public static KeyParam of(String name, Object value) {
		return new KeyParam(name, value);
	}
}
