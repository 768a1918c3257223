package com.GlobeLine.fpl_cache.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.github.benmanes.caffeine.cache.stats.CacheStats;

import com.GlobeLine.fpl_cache.cache.CacheStore;
import com.GlobeLine.fpl_cache.cache.CacheStoreStats;
import com.GlobeLine.fpl_cache.service.DerivedTableMemo;
import com.GlobeLine.fpl_cache.service.FetchOrchestrator;

/**
 * Health of the disk cache and of the in-memory table memo.
 *
 * The disk cache is up when its root can be listed; a store I/O failure reports DOWN.
 * The memo contributes its hit statistics only.
 */
@Component
public class CacheHealthIndicator implements HealthIndicator {

	private static final Logger logger = LoggerFactory.getLogger(CacheHealthIndicator.class);

	private final CacheStore cacheStore;
	private final FetchOrchestrator orchestrator;
	private final DerivedTableMemo derivedTableMemo;

	public CacheHealthIndicator(CacheStore cacheStore, FetchOrchestrator orchestrator,
			DerivedTableMemo derivedTableMemo) {
		this.cacheStore = cacheStore;
		this.orchestrator = orchestrator;
		this.derivedTableMemo = derivedTableMemo;
	}

	@Override
	public Health health() {
		try {
			CacheStoreStats stats = cacheStore.stats();
			CacheStats memoStats = derivedTableMemo.stats();
			double memoHitRate = memoStats.requestCount() > 0 ? memoStats.hitRate() * 100.0 : 0.0;

			return Health.up()
					.withDetail("root", stats.root())
					.withDetail("entryCount", stats.entryCount())
					.withDetail("totalBytes", stats.totalBytes())
					.withDetail("inFlightFetches", orchestrator.inFlightCount())
					.withDetail("derivedTables", derivedTableMemo.estimatedSize())
					.withDetail("derivedTableHitRate", String.format("%.2f%%", memoHitRate))
					.build();

		} catch (Exception ex) {
			logger.error("Cache health check failed: unable to read cache root", ex);
			return Health.down()
					.withDetail("error", "Unable to read cache root")
					.withDetail("errorMessage", ex.getMessage())
					.withDetail("errorType", ex.getClass().getSimpleName())
					.build();
		}
	}
}
