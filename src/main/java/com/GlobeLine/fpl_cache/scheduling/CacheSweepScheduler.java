package com.GlobeLine.fpl_cache.scheduling;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.GlobeLine.fpl_cache.config.CacheProperties;
import com.GlobeLine.fpl_cache.service.FetchOrchestrator;

/**
 * Periodically deletes entries that expired longer ago than the retention window.
 * Recently expired entries are kept as stale fallbacks.
 */
@Component
@ConditionalOnProperty(name = "fpl.cache.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class CacheSweepScheduler {

	private static final Logger logger = LoggerFactory.getLogger(CacheSweepScheduler.class);

	private final FetchOrchestrator orchestrator;
	private final CacheProperties properties;
	private final Clock clock;

	public CacheSweepScheduler(FetchOrchestrator orchestrator, CacheProperties properties, Clock clock) {
		this.orchestrator = orchestrator;
		this.properties = properties;
		this.clock = clock;
	}

	@Scheduled(fixedDelayString = "${fpl.cache.sweep.interval:PT1H}", initialDelayString = "${fpl.cache.sweep.interval:PT1H}")
	public void sweep() {
		Instant cutoff = clock.instant().minus(properties.sweep().retention());
		try {
			int removed = orchestrator.sweepExpired(cutoff).blockOptional()
					.map(keys -> keys.size())
					.orElse(0);
			if (removed > 0) {
				logger.info("Cache sweep removed {} entries expired before {}", removed, cutoff);
			} else {
				logger.debug("Cache sweep found nothing expired before {}", cutoff);
			}
		} catch (RuntimeException ex) {
			logger.error("Cache sweep failed", ex);
		}
	}
}
