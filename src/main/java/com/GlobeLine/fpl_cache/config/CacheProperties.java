package com.GlobeLine.fpl_cache.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Binds disk cache settings from application.properties (fpl.cache.*).
 * Every key can be overridden from the environment, e.g. FPL_CACHE_ROOT.
 */
@ConfigurationProperties(prefix = "fpl.cache")
public record CacheProperties(
		@DefaultValue(".cache") String root,
		@DefaultValue("3600s") Duration defaultTtl,
		@DefaultValue("true") boolean serveStaleOnError,
		Duration loaderTimeout,
		@DefaultValue Sweep sweep) {

	/**
	 * Background removal of entries that expired longer than {@code retention} ago.
	 * Recently expired entries are kept as stale fallbacks.
	 */
	public record Sweep(
			@DefaultValue("true") boolean enabled,
			@DefaultValue("PT1H") Duration interval,
			@DefaultValue("7d") Duration retention) {
	}
}
