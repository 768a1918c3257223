package com.GlobeLine.fpl_cache.api;

import java.time.Clock;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.GlobeLine.fpl_cache.cache.CacheStore;
import com.GlobeLine.fpl_cache.cache.CacheStoreStats;
import com.GlobeLine.fpl_cache.service.FetchOrchestrator;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/cache")
@Tag(name = "Cache", description = "Operator endpoints for the on-disk cache")
public class CacheAdminController {

	private static final Logger logger = LoggerFactory.getLogger(CacheAdminController.class);

	private final FetchOrchestrator orchestrator;
	private final CacheStore cacheStore;
	private final Clock clock;

	public CacheAdminController(FetchOrchestrator orchestrator, CacheStore cacheStore, Clock clock) {
		this.orchestrator = orchestrator;
		this.cacheStore = cacheStore;
		this.clock = clock;
	}

	@Operation(summary = "Cache statistics", description = "Entry count and bytes on disk.")
	@GetMapping("/stats")
	public Mono<ResponseEntity<CacheStoreStats>> getStats() {
		return ResponseMapping.toResponse(Mono.fromCallable(cacheStore::stats)
				.subscribeOn(Schedulers.boundedElastic()));
	}

	@Operation(summary = "Delete every cache entry")
	@DeleteMapping
	public Mono<ResponseEntity<Map<String, Integer>>> purge() {
		return ResponseMapping.toResponse(orchestrator.purge()
				.doOnNext(count -> logger.info("Cache purged by operator: {} entries removed", count))
				.map(count -> Map.of("removed", count)));
	}

	@Operation(summary = "Delete expired cache entries", description = "Removes every entry whose TTL has elapsed, " +
			"including ones that could still serve as a stale fallback.")
	@DeleteMapping("/expired")
	public Mono<ResponseEntity<Map<String, Integer>>> purgeExpired() {
		return ResponseMapping.toResponse(orchestrator.sweepExpired(clock.instant())
				.doOnNext(removed -> logger.info("Expired cache entries removed by operator: {}", removed.size()))
				.map(removed -> Map.of("removed", removed.size())));
	}
}
