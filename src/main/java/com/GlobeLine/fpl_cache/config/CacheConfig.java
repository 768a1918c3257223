package com.GlobeLine.fpl_cache.config;

import java.nio.file.Path;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.GlobeLine.fpl_cache.cache.CacheStore;
import com.GlobeLine.fpl_cache.cache.FileSystemCacheStore;
import com.GlobeLine.fpl_cache.service.DerivedTableMemo;

/**
 * Cache wiring:
 * - Disk store: one JSON file per entry under fpl.cache.root, TTL per entry (default 1 hour)
 * - Derived tables: in-memory Caffeine memo of tables built from cached payloads,
 *   keyed by the payload's write time so a refreshed payload is re-derived
 */
@Configuration
@EnableConfigurationProperties({ CacheProperties.class, HistoryProperties.class })
public class CacheConfig {

	private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public CacheStore cacheStore(CacheProperties properties, ObjectMapper objectMapper) {
		Path root = Path.of(properties.root());
		logger.info("Disk cache root: {} (default TTL {})", root.toAbsolutePath(), properties.defaultTtl());
		return new FileSystemCacheStore(root, objectMapper);
	}

	/**
	 * Tables derived from cached payloads (players, teams, gameweeks, fixtures).
	 */
	@Bean
	public DerivedTableMemo derivedTableMemo() {
		// a handful of payload versions per table
		return new DerivedTableMemo(25, 24);
	}
}
