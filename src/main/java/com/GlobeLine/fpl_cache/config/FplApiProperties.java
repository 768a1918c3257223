package com.GlobeLine.fpl_cache.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Binds FPL API settings from application.properties (fpl.api.*).
 */
@ConfigurationProperties(prefix = "fpl.api")
public record FplApiProperties(
		@DefaultValue("https://fantasy.premierleague.com/api") String baseUrl,
		@DefaultValue("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36") String userAgent,
		@DefaultValue("60") int requestsPerMinute,
		@DefaultValue("2") int maxRetries,
		@DefaultValue("1s") Duration retryBackoff) {
}
