package com.GlobeLine.fpl_cache.cache;

import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Opaque, fixed-length cache key: the lowercase hex SHA-256 of a canonical request descriptor.
 * Instances are produced by {@link KeyCodec}; {@link #of(String)} only re-reads keys already on disk.
 */
public record CacheKey(@JsonValue String value) {

	private static final Pattern FORMAT = Pattern.compile("[0-9a-f]{64}");

	public CacheKey {
		if (value == null || !FORMAT.matcher(value).matches()) {
			throw new IllegalArgumentException("Not a cache key: " + value);
		}
	}

	@JsonCreator
	public static CacheKey of(String value) {
		return new CacheKey(value);
	}

	public static boolean isValid(String value) {
		return value != null && FORMAT.matcher(value).matches();
	}

	@Override
	public String toString() {
		return value;
	}
}
