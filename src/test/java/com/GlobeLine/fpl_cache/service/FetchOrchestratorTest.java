package com.GlobeLine.fpl_cache.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.IntStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.GlobeLine.fpl_cache.cache.CacheEntry;
import com.GlobeLine.fpl_cache.cache.CacheKey;
import com.GlobeLine.fpl_cache.cache.CacheStore;
import com.GlobeLine.fpl_cache.cache.FetchOptions;
import com.GlobeLine.fpl_cache.cache.FetchResult;
import com.GlobeLine.fpl_cache.cache.FileSystemCacheStore;
import com.GlobeLine.fpl_cache.cache.Invalidator;
import com.GlobeLine.fpl_cache.cache.KeyCodec;
import com.GlobeLine.fpl_cache.cache.Origin;
import com.GlobeLine.fpl_cache.config.CacheProperties;
import com.GlobeLine.fpl_cache.exception.CacheStoreException;
import com.GlobeLine.fpl_cache.exception.UpstreamUnavailableException;
import com.GlobeLine.fpl_cache.loader.LoadResult;
import com.GlobeLine.fpl_cache.loader.Revalidation;
import com.GlobeLine.fpl_cache.loader.UpstreamLoader;
import com.GlobeLine.fpl_cache.support.MutableClock;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

/**
 * Unit tests for FetchOrchestrator.
 * Uses a real disk store in a temporary directory, a controllable clock and a scripted loader.
 */
class FetchOrchestratorTest {

	private static final Instant T0 = Instant.parse("2024-08-16T10:00:00Z");
	private static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(5);

	@TempDir
	Path tempDir;

	private final ObjectMapper objectMapper = new ObjectMapper();
	private MutableClock clock;
	private FileSystemCacheStore store;
	private FetchEventObserver eventObserver;
	private FetchOrchestrator orchestrator;
	private CacheKey key;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(T0);
		store = new FileSystemCacheStore(tempDir, objectMapper);
		eventObserver = mock(FetchEventObserver.class);
		orchestrator = new FetchOrchestrator(store, new Invalidator(), clock, properties(true));
		orchestrator.setObserver(eventObserver);
		key = new KeyCodec().deriveKey("bootstrap-static", List.of());
	}

	@Test
	void fetch_MissThenHitThenExpiredWithUpstreamDown_ServesStale() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));

		// t=0: miss, upstream called, entry stored
		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> {
					assertThat(result.origin()).isEqualTo(Origin.UPSTREAM);
					assertThat(result.stale()).isFalse();
					assertThat(result.payload()).isEqualTo(payload("v1"));
					assertThat(result.storedAt()).isEqualTo(T0);
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
		assertThat(store.get(key)).isPresent();

		// t=10s: fresh, served from cache without calling upstream
		clock.set(T0.plusSeconds(10));
		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> {
					assertThat(result.origin()).isEqualTo(Origin.CACHE);
					assertThat(result.stale()).isFalse();
					assertThat(result.payload()).isEqualTo(payload("v1"));
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
		assertThat(loader.fullCalls.get()).isEqualTo(1);

		// t=4000s: expired and upstream failing, the old payload is served flagged stale
		clock.set(T0.plusSeconds(4000));
		loader.fullResponse = () -> Mono.error(new IllegalStateException("connection refused"));
		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> {
					assertThat(result.origin()).isEqualTo(Origin.CACHE);
					assertThat(result.stale()).isTrue();
					assertThat(result.payload()).isEqualTo(payload("v1"));
					assertThat(result.storedAt()).isEqualTo(T0);
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);

		assertThat(loader.fullCalls.get()).isEqualTo(2);
		verify(eventObserver).onCacheHit();
		verify(eventObserver).onStaleServed();
		verify(eventObserver).onUpstreamFailure();
		// the failed refresh leaves the old entry untouched
		assertThat(store.get(key).orElseThrow().storedAt()).isEqualTo(T0);
	}

	@Test
	void fetch_Expired_RefetchesAndReplacesEntry() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));
		orchestrator.fetch(key, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);

		clock.set(T0.plusSeconds(4000));
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v2")));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> {
					assertThat(result.origin()).isEqualTo(Origin.UPSTREAM);
					assertThat(result.payload()).isEqualTo(payload("v2"));
					assertThat(result.storedAt()).isEqualTo(T0.plusSeconds(4000));
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
		assertThat(store.get(key).orElseThrow().payload()).isEqualTo(payload("v2"));
	}

	@Test
	void fetch_PerCallTtl_IsStoredWithEntry() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));

		orchestrator.fetch(key, loader, FetchOptions.defaults().withTtl(Duration.ofSeconds(30))).block(VERIFY_TIMEOUT);

		assertThat(store.get(key).orElseThrow().ttlSeconds()).isEqualTo(30L);
		clock.set(T0.plusSeconds(31));
		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> assertThat(result.origin()).isEqualTo(Origin.UPSTREAM))
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
		assertThat(loader.fullCalls.get()).isEqualTo(2);
	}

	@Test
	void fetch_NeverExpiringTtl_ServedFromCache() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));
		FetchOptions forever = FetchOptions.defaults().withTtl(Duration.ofSeconds(Long.MAX_VALUE));

		orchestrator.fetch(key, loader, forever).block(VERIFY_TIMEOUT);
		clock.set(T0.plusSeconds(10));

		StepVerifier.create(orchestrator.fetch(key, loader, forever))
				.assertNext(result -> assertThat(result.origin()).isEqualTo(Origin.CACHE))
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
		StepVerifier.create(orchestrator.sweepExpired(T0.plusSeconds(3600)))
				.assertNext(removed -> assertThat(removed).isEmpty())
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
		assertThat(loader.fullCalls.get()).isEqualTo(1);
	}

	@Test
	void fetch_MissAndUpstreamDown_UpstreamUnavailable() {
		ScriptedLoader loader = new ScriptedLoader();
		IllegalStateException cause = new IllegalStateException("connection refused");
		loader.fullResponse = () -> Mono.error(cause);

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.expectErrorSatisfies(error -> {
					assertThat(error).isInstanceOf(UpstreamUnavailableException.class);
					assertThat(((UpstreamUnavailableException) error).getKey()).isEqualTo(key);
					assertThat(error.getCause()).isSameAs(cause);
				})
				.verify(VERIFY_TIMEOUT);
		assertThat(store.get(key)).isEmpty();
	}

	@Test
	void fetch_StaleFallbackDisabledForCall_UpstreamUnavailable() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));
		orchestrator.fetch(key, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);

		clock.set(T0.plusSeconds(4000));
		loader.fullResponse = () -> Mono.error(new IllegalStateException("connection refused"));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults().withoutStaleFallback()))
				.expectError(UpstreamUnavailableException.class)
				.verify(VERIFY_TIMEOUT);
		verify(eventObserver, never()).onStaleServed();
	}

	@Test
	void fetch_StaleFallbackDisabledByConfiguration_UpstreamUnavailable() {
		orchestrator = new FetchOrchestrator(store, new Invalidator(), clock, properties(false));
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));
		orchestrator.fetch(key, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);

		clock.set(T0.plusSeconds(4000));
		loader.fullResponse = () -> Mono.error(new IllegalStateException("connection refused"));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.expectError(UpstreamUnavailableException.class)
				.verify(VERIFY_TIMEOUT);
	}

	@Test
	void fetch_ConcurrentCallers_ShareOneUpstreamCall() {
		ScriptedLoader loader = new ScriptedLoader();
		Sinks.One<LoadResult> upstream = Sinks.one();
		loader.fullResponse = upstream::asMono;

		List<Mono<FetchResult>> callers = IntStream.range(0, 5)
				.mapToObj(i -> orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.toList();

		StepVerifier.create(Flux.merge(callers).collectList())
				.then(() -> upstream.tryEmitValue(LoadResult.of(payload("v1"))))
				.assertNext(results -> {
					assertThat(results).hasSize(5);
					assertThat(results).allSatisfy(result -> {
						assertThat(result.origin()).isEqualTo(Origin.UPSTREAM);
						assertThat(result.payload()).isEqualTo(payload("v1"));
					});
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);

		assertThat(loader.fullCalls.get()).isEqualTo(1);
		verify(eventObserver, times(4)).onInFlightSharing();
	}

	@Test
	void fetch_ConcurrentCallers_AllObserveTheSameFailure() {
		ScriptedLoader loader = new ScriptedLoader();
		Sinks.One<LoadResult> upstream = Sinks.one();
		loader.fullResponse = upstream::asMono;

		List<Mono<String>> callers = IntStream.range(0, 3)
				.mapToObj(i -> orchestrator.fetch(key, loader, FetchOptions.defaults())
						.map(result -> "ok")
						.onErrorResume(UpstreamUnavailableException.class, ex -> Mono.just("unavailable")))
				.toList();

		StepVerifier.create(Flux.merge(callers).collectList())
				.then(() -> upstream.tryEmitError(new IllegalStateException("503 from upstream")))
				.assertNext(outcomes -> assertThat(outcomes).containsExactly("unavailable", "unavailable", "unavailable"))
				.expectComplete()
				.verify(VERIFY_TIMEOUT);

		assertThat(loader.fullCalls.get()).isEqualTo(1);
	}

	@Test
	void fetch_AfterSharedFlightCompletes_NextCallStartsNewFlight() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.error(new IllegalStateException("down"));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.expectError(UpstreamUnavailableException.class)
				.verify(VERIFY_TIMEOUT);

		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));
		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> assertThat(result.origin()).isEqualTo(Origin.UPSTREAM))
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
		assertThat(loader.fullCalls.get()).isEqualTo(2);
	}

	@Test
	void fetch_WaiterTimesOut_OtherWaitersStillGetResult() throws Exception {
		ScriptedLoader loader = new ScriptedLoader();
		Sinks.One<LoadResult> upstream = Sinks.one();
		loader.fullResponse = upstream::asMono;

		CompletableFuture<FetchResult> patient = orchestrator.fetch(key, loader, FetchOptions.defaults()).toFuture();

		StepVerifier.create(orchestrator.fetch(key, loader,
						FetchOptions.defaults().withWaitTimeout(Duration.ofMillis(100))))
				.expectError(TimeoutException.class)
				.verify(VERIFY_TIMEOUT);

		upstream.tryEmitValue(LoadResult.of(payload("v1")));

		FetchResult result = patient.get(5, TimeUnit.SECONDS);
		assertThat(result.origin()).isEqualTo(Origin.UPSTREAM);
		assertThat(loader.fullCalls.get()).isEqualTo(1);
		assertThat(store.get(key)).isPresent();
	}

	@Test
	void fetch_LoaderTimeout_TreatedAsUpstreamFailure() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = Mono::never;

		StepVerifier.create(orchestrator.fetch(key, loader,
						FetchOptions.defaults().withLoaderTimeout(Duration.ofMillis(100))))
				.expectErrorSatisfies(error -> {
					assertThat(error).isInstanceOf(UpstreamUnavailableException.class);
					assertThat(error.getCause()).isInstanceOf(TimeoutException.class);
				})
				.verify(VERIFY_TIMEOUT);
	}

	@Test
	void fetch_StaleAndUnchanged_RenewsEntryWithoutFullFetch() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.revalidating = true;
		loader.fullResponse = () -> Mono.just(new LoadResult(payload("v1"), Map.of("etag", "\"v1\"")));
		orchestrator.fetch(key, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);

		Instant later = T0.plusSeconds(4000);
		clock.set(later);
		loader.revalidation = () -> Mono.just(Revalidation.unchanged());

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> {
					assertThat(result.origin()).isEqualTo(Origin.REVALIDATED);
					assertThat(result.stale()).isFalse();
					assertThat(result.payload()).isEqualTo(payload("v1"));
					assertThat(result.storedAt()).isEqualTo(later);
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);

		assertThat(loader.fullCalls.get()).isEqualTo(1);
		assertThat(loader.lastValidators).containsEntry("etag", "\"v1\"");
		CacheEntry renewed = store.get(key).orElseThrow();
		assertThat(renewed.storedAt()).isEqualTo(later);
		assertThat(renewed.validationMetadata()).containsEntry("etag", "\"v1\"");
		verify(eventObserver).onRevalidated();
	}

	@Test
	void fetch_StaleAndChanged_StoresNewPayload() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.revalidating = true;
		loader.fullResponse = () -> Mono.just(new LoadResult(payload("v1"), Map.of("etag", "\"v1\"")));
		orchestrator.fetch(key, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);

		clock.set(T0.plusSeconds(4000));
		loader.revalidation = () -> Mono.just(Revalidation.changed(
				new LoadResult(payload("v2"), Map.of("etag", "\"v2\""))));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> {
					assertThat(result.origin()).isEqualTo(Origin.UPSTREAM);
					assertThat(result.payload()).isEqualTo(payload("v2"));
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);

		assertThat(loader.fullCalls.get()).isEqualTo(1);
		assertThat(store.get(key).orElseThrow().validationMetadata()).containsEntry("etag", "\"v2\"");
	}

	@Test
	void fetch_StaleAndChangedWithoutPayload_FallsBackToFullFetch() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.revalidating = true;
		loader.fullResponse = () -> Mono.just(new LoadResult(payload("v1"), Map.of("etag", "\"v1\"")));
		orchestrator.fetch(key, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);

		clock.set(T0.plusSeconds(4000));
		loader.revalidation = () -> Mono.just(Revalidation.changedWithoutPayload());
		loader.fullResponse = () -> Mono.just(new LoadResult(payload("v2"), Map.of("etag", "\"v2\"")));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> assertThat(result.payload()).isEqualTo(payload("v2")))
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
		assertThat(loader.fullCalls.get()).isEqualTo(2);
	}

	@Test
	void fetch_RevalidationFails_FallsBackToFullFetch() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.revalidating = true;
		loader.fullResponse = () -> Mono.just(new LoadResult(payload("v1"), Map.of("etag", "\"v1\"")));
		orchestrator.fetch(key, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);

		clock.set(T0.plusSeconds(4000));
		loader.revalidation = () -> Mono.error(new IllegalStateException("conditional GET failed"));
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v2")));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> {
					assertThat(result.origin()).isEqualTo(Origin.UPSTREAM);
					assertThat(result.payload()).isEqualTo(payload("v2"));
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
		assertThat(loader.fullCalls.get()).isEqualTo(2);
	}

	@Test
	void fetch_RevalidationAndFullFetchFail_ServesStale() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.revalidating = true;
		loader.fullResponse = () -> Mono.just(new LoadResult(payload("v1"), Map.of("etag", "\"v1\"")));
		orchestrator.fetch(key, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);

		clock.set(T0.plusSeconds(4000));
		loader.revalidation = () -> Mono.error(new IllegalStateException("down"));
		loader.fullResponse = () -> Mono.error(new IllegalStateException("down"));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> {
					assertThat(result.stale()).isTrue();
					assertThat(result.payload()).isEqualTo(payload("v1"));
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
	}

	@Test
	void fetch_CorruptEntry_DiscardedAndRepopulated() throws IOException {
		Files.writeString(tempDir.resolve(key.value() + ".json"), "{\"key\":", StandardCharsets.UTF_8);
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> {
					assertThat(result.origin()).isEqualTo(Origin.UPSTREAM);
					assertThat(result.payload()).isEqualTo(payload("v1"));
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);

		verify(eventObserver).onCorruptEntry();
		assertThat(store.get(key).orElseThrow().payload()).isEqualTo(payload("v1"));
	}

	@Test
	void fetch_CorruptEntryAndUpstreamDown_UpstreamUnavailable() throws IOException {
		Files.writeString(tempDir.resolve(key.value() + ".json"), "garbage", StandardCharsets.UTF_8);
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.error(new IllegalStateException("down"));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.expectError(UpstreamUnavailableException.class)
				.verify(VERIFY_TIMEOUT);
		assertThat(Files.exists(tempDir.resolve(key.value() + ".json"))).isFalse();
	}

	@Test
	void fetch_StoreWriteFails_StillReturnsLoadedData() {
		CacheStore failingStore = mock(CacheStore.class);
		when(failingStore.get(any())).thenReturn(Optional.empty());
		doThrow(new CacheStoreException("disk full", new IOException("No space left on device")))
				.when(failingStore).put(any());
		orchestrator = new FetchOrchestrator(failingStore, new Invalidator(), clock, properties(true));
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> {
					assertThat(result.origin()).isEqualTo(Origin.UPSTREAM);
					assertThat(result.payload()).isEqualTo(payload("v1"));
				})
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
	}

	@Test
	void fetch_StoreReadFails_TreatedAsMiss() {
		CacheStore failingStore = mock(CacheStore.class);
		when(failingStore.get(any())).thenThrow(new CacheStoreException("permission denied", new IOException()));
		orchestrator = new FetchOrchestrator(failingStore, new Invalidator(), clock, properties(true));
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));

		StepVerifier.create(orchestrator.fetch(key, loader, FetchOptions.defaults()))
				.assertNext(result -> assertThat(result.origin()).isEqualTo(Origin.UPSTREAM))
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
		verify(failingStore).put(any());
	}

	@Test
	void sweepExpired_RemovesOnlyEntriesExpiredBeforeCutoff() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));
		CacheKey shortLived = new KeyCodec().deriveKey("fixtures", List.of());
		orchestrator.fetch(shortLived, loader, FetchOptions.defaults().withTtl(Duration.ofSeconds(10))).block(VERIFY_TIMEOUT);
		orchestrator.fetch(key, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);

		StepVerifier.create(orchestrator.sweepExpired(T0.plusSeconds(60)))
				.assertNext(removed -> assertThat(removed).containsExactly(shortLived))
				.expectComplete()
				.verify(VERIFY_TIMEOUT);

		assertThat(store.get(shortLived)).isEmpty();
		assertThat(store.get(key)).isPresent();
	}

	@Test
	void sweepExpired_EntryRefreshedAfterListing_Kept() {
		FileSystemCacheStore racingStore = new FileSystemCacheStore(tempDir, objectMapper) {
			@Override
			public List<CacheKey> listExpired(Instant now) {
				List<CacheKey> listed = super.listExpired(now);
				// a fetch stores a fresh entry between listing and deletion
				put(new CacheEntry(key, payload("fresh"), T0.plusSeconds(60), 3600L, Map.of()));
				return listed;
			}
		};
		racingStore.put(new CacheEntry(key, payload("old"), T0, 10L, Map.of()));
		FetchOrchestrator sweeping = new FetchOrchestrator(racingStore, new Invalidator(), clock, properties(true));

		StepVerifier.create(sweeping.sweepExpired(T0.plusSeconds(60)))
				.assertNext(removed -> assertThat(removed).isEmpty())
				.expectComplete()
				.verify(VERIFY_TIMEOUT);

		assertThat(racingStore.get(key)).get()
				.extracting(entry -> entry.payload().get("version").asText())
				.isEqualTo("fresh");
	}

	@Test
	void sweepExpired_FetchArrivingDuringDeletion_WaitsThenLoads() throws Exception {
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v2")));
		AtomicReference<FetchOrchestrator> sweeping = new AtomicReference<>();
		AtomicReference<CompletableFuture<FetchResult>> concurrentFetch = new AtomicReference<>();
		AtomicInteger loadsBeforeDelete = new AtomicInteger(-1);
		FileSystemCacheStore racingStore = new FileSystemCacheStore(tempDir, objectMapper) {
			@Override
			public void delete(CacheKey target) {
				if (concurrentFetch.get() == null) {
					concurrentFetch.set(sweeping.get().fetch(target, loader, FetchOptions.defaults()).toFuture());
					loadsBeforeDelete.set(loader.fullCalls.get());
				}
				super.delete(target);
			}
		};
		racingStore.put(new CacheEntry(key, payload("v1"), T0, 10L, Map.of()));
		sweeping.set(new FetchOrchestrator(racingStore, new Invalidator(), clock, properties(true)));
		clock.set(T0.plusSeconds(60));

		StepVerifier.create(sweeping.get().sweepExpired(T0.plusSeconds(60)))
				.assertNext(removed -> assertThat(removed).containsExactly(key))
				.expectComplete()
				.verify(VERIFY_TIMEOUT);

		FetchResult result = concurrentFetch.get().get(5, TimeUnit.SECONDS);
		assertThat(loadsBeforeDelete.get()).isZero();
		assertThat(result.origin()).isEqualTo(Origin.UPSTREAM);
		assertThat(result.payload().get("version").asText()).isEqualTo("v2");
		assertThat(racingStore.get(key)).isPresent();
		assertThat(sweeping.get().inFlightCount()).isZero();
	}

	@Test
	void evictAndPurge_RemoveEntries() {
		ScriptedLoader loader = new ScriptedLoader();
		loader.fullResponse = () -> Mono.just(LoadResult.of(payload("v1")));
		CacheKey other = new KeyCodec().deriveKey("fixtures", List.of());
		orchestrator.fetch(key, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);
		orchestrator.fetch(other, loader, FetchOptions.defaults()).block(VERIFY_TIMEOUT);

		orchestrator.evict(key).block(VERIFY_TIMEOUT);
		assertThat(store.get(key)).isEmpty();

		StepVerifier.create(orchestrator.purge())
				.expectNext(1)
				.expectComplete()
				.verify(VERIFY_TIMEOUT);
	}

	private JsonNode payload(String version) {
		return objectMapper.createObjectNode().put("version", version);
	}

	private static CacheProperties properties(boolean serveStaleOnError) {
		return new CacheProperties(".cache", Duration.ofSeconds(3600), serveStaleOnError, null,
				new CacheProperties.Sweep(true, Duration.ofHours(1), Duration.ofDays(7)));
	}

	/**
	 * Loader whose responses each test scripts, counting the calls it receives.
	 */
	private static class ScriptedLoader implements UpstreamLoader {

		final AtomicInteger fullCalls = new AtomicInteger();
		volatile Supplier<Mono<LoadResult>> fullResponse = () -> Mono.error(new IllegalStateException("not scripted"));
		volatile Supplier<Mono<Revalidation>> revalidation = () -> Mono.just(Revalidation.changedWithoutPayload());
		volatile boolean revalidating;
		volatile Map<String, String> lastValidators;

		@Override
		public Mono<LoadResult> fetchFull() {
			fullCalls.incrementAndGet();
			return fullResponse.get();
		}

		@Override
		public boolean supportsRevalidation() {
			return revalidating;
		}

		@Override
		public Mono<Revalidation> revalidate(Map<String, String> validationMetadata) {
			lastValidators = validationMetadata;
			return revalidation.get();
		}
	}
}
