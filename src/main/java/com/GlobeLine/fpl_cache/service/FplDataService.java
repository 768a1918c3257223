package com.GlobeLine.fpl_cache.service;

import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;

import com.GlobeLine.fpl_cache.cache.FetchOptions;
import com.GlobeLine.fpl_cache.cache.FetchResult;
import com.GlobeLine.fpl_cache.cache.KeyParam;
import com.GlobeLine.fpl_cache.connectors.FplApiClient;
import com.GlobeLine.fpl_cache.dto.Dataset;
import com.GlobeLine.fpl_cache.dto.FixtureDifficultyDto;
import com.GlobeLine.fpl_cache.dto.FixtureDto;
import com.GlobeLine.fpl_cache.dto.GameweekDto;
import com.GlobeLine.fpl_cache.dto.PlayerDto;
import com.GlobeLine.fpl_cache.dto.TeamDto;
import com.GlobeLine.fpl_cache.loader.HttpJsonLoader;
import com.GlobeLine.fpl_cache.mapper.BootstrapMapper;

import reactor.core.publisher.Mono;

/**
 * Builds the FPL tables the analytics UI consumes. Every upstream document is obtained through
 * the read-through cache; derived tables are memoized per cached payload version.
 */
@Service
public class FplDataService {

	private static final Logger logger = LoggerFactory.getLogger(FplDataService.class);

	static final String BOOTSTRAP_NAMESPACE = "bootstrap-static";
	static final String FIXTURES_NAMESPACE = "fixtures";
	static final String ELEMENT_SUMMARY_NAMESPACE = "element-summary";

	private final ReadThroughCacheService cacheService;
	private final FplApiClient fplApiClient;
	private final BootstrapMapper mapper;
	private final DerivedTableMemo memo;

	public FplDataService(
			ReadThroughCacheService cacheService,
			FplApiClient fplApiClient,
			BootstrapMapper mapper,
			DerivedTableMemo memo) {
		this.cacheService = cacheService;
		this.fplApiClient = fplApiClient;
		this.mapper = mapper;
		this.memo = memo;
	}

	public Mono<Dataset<JsonNode>> getBootstrapStatic() {
		return fetchBootstrap().map(result -> Dataset.from(result, result.payload()));
	}

	public Mono<Dataset<List<PlayerDto>>> getPlayers() {
		return fetchBootstrap().map(result ->
				Dataset.from(result, derive("players", memo.players(), result, mapper::mapPlayers)));
	}

	public Mono<Dataset<List<TeamDto>>> getTeams() {
		return fetchBootstrap().map(result ->
				Dataset.from(result, derive("teams", memo.teams(), result, mapper::mapTeams)));
	}

	public Mono<Dataset<List<GameweekDto>>> getGameweeks() {
		return fetchBootstrap().map(result ->
				Dataset.from(result, derive("gameweeks", memo.gameweeks(), result, mapper::mapGameweeks)));
	}

	/**
	 * All fixtures, optionally narrowed to one team and/or one gameweek.
	 */
	public Mono<Dataset<List<FixtureDto>>> getFixtures(Integer teamId, Integer gameweek) {
		return fetchFixtures().map(result -> {
			List<FixtureDto> fixtures = derive("fixtures", memo.fixtures(), result, mapper::mapFixtures).stream()
					.filter(fixture -> teamId == null || fixture.involves(teamId))
					.filter(fixture -> gameweek == null || gameweek.equals(fixture.gameweek()))
					.toList();
			return Dataset.from(result, fixtures);
		});
	}

	public Mono<Dataset<List<FixtureDifficultyDto>>> getFixturesWithDifficulty(int teamId, int gameweeks) {
		return Mono.zip(fetchFixtures(), fetchBootstrap())
				.map(tuple -> {
					FetchResult fixtures = tuple.getT1();
					FetchResult bootstrap = tuple.getT2();
					List<FixtureDifficultyDto> rows = mapper.mapFixtureDifficulty(teamId, gameweeks,
							derive("fixtures", memo.fixtures(), fixtures, mapper::mapFixtures),
							derive("teams", memo.teams(), bootstrap, mapper::mapTeams));
					return Dataset.combine(fixtures, bootstrap, rows);
				});
	}

	public Mono<Dataset<JsonNode>> getPlayerSummary(int playerId) {
		return cacheService.fetch(
						ELEMENT_SUMMARY_NAMESPACE,
						List.of(KeyParam.of("playerId", playerId)),
						new HttpJsonLoader(fplApiClient, FplApiClient.elementSummaryPath(playerId)),
						FetchOptions.defaults())
				.map(result -> Dataset.from(result, result.payload()));
	}

	private Mono<FetchResult> fetchBootstrap() {
		return cacheService.fetch(BOOTSTRAP_NAMESPACE, List.of(),
				new HttpJsonLoader(fplApiClient, FplApiClient.BOOTSTRAP_STATIC), FetchOptions.defaults());
	}

	private Mono<FetchResult> fetchFixtures() {
		return cacheService.fetch(FIXTURES_NAMESPACE, List.of(),
				new HttpJsonLoader(fplApiClient, FplApiClient.FIXTURES), FetchOptions.defaults());
	}

	private <T> List<T> derive(String table, Cache<String, List<T>> tableMemo, FetchResult source,
			Function<JsonNode, List<T>> builder) {
		return tableMemo.get(source.storedAt().toString(), key -> {
			logger.debug("Deriving {} table from payload stored at {}", table, source.storedAt());
			return List.copyOf(builder.apply(source.payload()));
		});
	}
}
