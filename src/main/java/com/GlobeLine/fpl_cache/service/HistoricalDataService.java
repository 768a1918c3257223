package com.GlobeLine.fpl_cache.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.function.Predicate;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import com.GlobeLine.fpl_cache.cache.FetchOptions;
import com.GlobeLine.fpl_cache.cache.KeyParam;
import com.GlobeLine.fpl_cache.config.HistoryProperties;
import com.GlobeLine.fpl_cache.dto.Dataset;
import com.GlobeLine.fpl_cache.exception.CacheStoreException;
import com.GlobeLine.fpl_cache.exception.NotFoundException;
import com.GlobeLine.fpl_cache.history.HistoricalDataset;
import com.GlobeLine.fpl_cache.loader.CsvFileLoader;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Serves the optional historical CSV data set laid out as {@code <data-dir>/<season>/<file>.csv},
 * where season directories start with "20" (e.g. {@code 2023-24}).
 * Parsed files go through the read-through cache and are re-read only when they change on disk.
 */
@Service
public class HistoricalDataService {

	private static final Logger logger = LoggerFactory.getLogger(HistoricalDataService.class);

	static final String NAMESPACE = "history";
	private static final String SEASON_PREFIX = "20";
	private static final String GAMEWEEK_COLUMN = "gameweek";
	private static final String PLAYER_ID_COLUMN = "player_id";

	private final ReadThroughCacheService cacheService;
	private final Path dataDir;

	public HistoricalDataService(ReadThroughCacheService cacheService, HistoryProperties properties) {
		this.cacheService = cacheService;
		this.dataDir = Path.of(properties.dataDir());
	}

	/**
	 * Season directory names, oldest first. Empty when the data directory does not exist.
	 */
	public Mono<List<String>> availableSeasons() {
		return Mono.fromCallable(this::listSeasons)
				.subscribeOn(Schedulers.boundedElastic());
	}

	public Mono<String> latestSeason() {
		return availableSeasons()
				.flatMap(seasons -> seasons.isEmpty()
						? Mono.<String>error(new NotFoundException("No historical seasons under " + dataDir))
						: Mono.just(seasons.get(seasons.size() - 1)));
	}

	/**
	 * Rows of {@code dataset} for {@code season} (latest season when null).
	 */
	public Mono<Dataset<JsonNode>> load(String season, HistoricalDataset dataset) {
		return resolveSeason(season).flatMap(resolved -> {
			Path file = dataDir.resolve(resolved).resolve(dataset.fileName());
			if (!Files.isRegularFile(file)) {
				return Mono.error(new NotFoundException(dataset.fileName() + " not found for season " + resolved));
			}
			return cacheService.fetch(
							NAMESPACE,
							List.of(KeyParam.of("season", resolved), KeyParam.of("dataset", dataset.id())),
							new CsvFileLoader(file),
							FetchOptions.defaults())
					.map(result -> Dataset.from(result, result.payload()));
		});
	}

	/**
	 * Per-gameweek player rows, optionally only those of one gameweek.
	 */
	public Mono<Dataset<JsonNode>> loadGameweekStats(String season, Integer gameweek) {
		return load(season, HistoricalDataset.PLAYER_GAMEWEEK_STATS)
				.map(rows -> gameweek == null
						? rows
						: withData(rows, filter(rows.data(), row -> row.path(GAMEWEEK_COLUMN).asInt(-1) == gameweek)));
	}

	/**
	 * The last {@code gameweeks} rows of one player, most recent gameweek first.
	 */
	public Mono<Dataset<JsonNode>> playerFormTrend(int playerId, int gameweeks, String season) {
		return loadGameweekStats(season, null).map(rows -> {
			List<JsonNode> playerRows = new ArrayList<>();
			rows.data().forEach(row -> {
				if (row.path(PLAYER_ID_COLUMN).asInt(-1) == playerId) {
					playerRows.add(row);
				}
			});
			playerRows.sort(Comparator.comparingInt((JsonNode row) -> row.path(GAMEWEEK_COLUMN).asInt()).reversed());
			ArrayNode trend = JsonNodeFactory.instance.arrayNode();
			playerRows.stream().limit(Math.max(gameweeks, 0)).forEach(trend::add);
			return withData(rows, trend);
		});
	}

	private Mono<String> resolveSeason(String season) {
		if (season == null || season.isBlank()) {
			return latestSeason();
		}
		return availableSeasons().flatMap(seasons -> seasons.contains(season)
				? Mono.just(season)
				: Mono.<String>error(new NotFoundException("Unknown season: " + season)));
	}

	private List<String> listSeasons() {
		if (!Files.isDirectory(dataDir)) {
			logger.debug("Historical data directory {} does not exist", dataDir.toAbsolutePath());
			return List.of();
		}
		try (Stream<Path> entries = Files.list(dataDir)) {
			return entries.filter(Files::isDirectory)
					.map(path -> path.getFileName().toString())
					.filter(name -> name.startsWith(SEASON_PREFIX))
					.sorted()
					.toList();
		} catch (IOException ex) {
			throw new CacheStoreException("Failed to list seasons under " + dataDir, ex);
		}
	}

	private static ArrayNode filter(JsonNode rows, Predicate<JsonNode> predicate) {
		ArrayNode filtered = JsonNodeFactory.instance.arrayNode();
		rows.forEach(row -> {
			if (predicate.test(row)) {
				filtered.add(row);
			}
		});
		return filtered;
	}

	private static Dataset<JsonNode> withData(Dataset<JsonNode> source, JsonNode data) {
		return new Dataset<>(data, source.origin(), source.stale(), source.storedAt());
	}
}
