package com.GlobeLine.fpl_cache.api;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;

import com.GlobeLine.fpl_cache.dto.Dataset;
import com.GlobeLine.fpl_cache.exception.NotFoundException;
import com.GlobeLine.fpl_cache.history.HistoricalDataset;
import com.GlobeLine.fpl_cache.service.HistoricalDataService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/history")
@Tag(name = "History", description = "Historical season data read from local CSV files")
public class HistoryController {

	private final HistoricalDataService historicalDataService;

	public HistoryController(HistoricalDataService historicalDataService) {
		this.historicalDataService = historicalDataService;
	}

	@Operation(summary = "List available seasons")
	@GetMapping("/seasons")
	public Mono<ResponseEntity<List<String>>> getSeasons() {
		return ResponseMapping.toResponse(historicalDataService.availableSeasons());
	}

	@Operation(
			summary = "Load a historical dataset",
			description = "One of player_stats, team_stats, team_elo, fixture_difficulty, player_gameweek_stats. " +
					"The gameweek filter applies to player_gameweek_stats only.")
	@ApiResponses(value = {
			@ApiResponse(responseCode = "200", description = "Rows of the dataset"),
			@ApiResponse(responseCode = "404", description = "Unknown season or dataset, or file missing", content = @Content)
	})
	@GetMapping("/{dataset}")
	public Mono<ResponseEntity<Dataset<JsonNode>>> getDataset(
			@Parameter(description = "Dataset name", required = true, example = "player_stats") @PathVariable String dataset,
			@Parameter(description = "Season directory, latest when omitted", example = "2023-24")
			@RequestParam(required = false) String season,
			@RequestParam(required = false) Integer gameweek) {
		Mono<Dataset<JsonNode>> rows = Mono.defer(() -> {
			HistoricalDataset resolved = HistoricalDataset.fromId(dataset)
					.orElseThrow(() -> new NotFoundException("Unknown dataset: " + dataset));
			return resolved == HistoricalDataset.PLAYER_GAMEWEEK_STATS
					? historicalDataService.loadGameweekStats(season, gameweek)
					: historicalDataService.load(season, resolved);
		});
		return ResponseMapping.toResponse(rows);
	}

	@Operation(summary = "Player form trend", description = "The player's most recent gameweek rows, newest first.")
	@GetMapping("/players/{playerId}/form")
	public Mono<ResponseEntity<Dataset<JsonNode>>> getFormTrend(
			@PathVariable int playerId,
			@RequestParam(defaultValue = "5") int gameweeks,
			@RequestParam(required = false) String season) {
		return ResponseMapping.toResponse(historicalDataService.playerFormTrend(playerId, gameweeks, season));
	}
}
