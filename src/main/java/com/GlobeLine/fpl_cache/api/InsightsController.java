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
import com.GlobeLine.fpl_cache.dto.FixtureDifficultyDto;
import com.GlobeLine.fpl_cache.dto.FixtureDto;
import com.GlobeLine.fpl_cache.dto.GameweekDto;
import com.GlobeLine.fpl_cache.dto.PlayerDto;
import com.GlobeLine.fpl_cache.dto.TeamDto;
import com.GlobeLine.fpl_cache.service.FplDataService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/fpl")
@Tag(name = "FPL", description = "Fantasy Premier League tables served through the disk cache")
public class InsightsController {

	private final FplDataService fplDataService;

	public InsightsController(FplDataService fplDataService) {
		this.fplDataService = fplDataService;
	}

	@Operation(
			summary = "List players",
			description = "Every player of the current season with price, form and underlying stats. " +
					"Built from bootstrap-static, which is cached on disk for one hour.")
	@ApiResponses(value = {
			@ApiResponse(responseCode = "200", description = "Players (\"stale\": true when served from an expired cache entry)"),
			@ApiResponse(responseCode = "503", description = "FPL API unavailable and nothing cached", content = @Content),
			@ApiResponse(responseCode = "500", description = "Internal server error", content = @Content)
	})
	@GetMapping("/players")
	public Mono<ResponseEntity<Dataset<List<PlayerDto>>>> getPlayers() {
		return ResponseMapping.toResponse(fplDataService.getPlayers());
	}

	@Operation(summary = "List teams")
	@GetMapping("/teams")
	public Mono<ResponseEntity<Dataset<List<TeamDto>>>> getTeams() {
		return ResponseMapping.toResponse(fplDataService.getTeams());
	}

	@Operation(summary = "List gameweeks", description = "Gameweeks with deadlines and current/next flags.")
	@GetMapping("/gameweeks")
	public Mono<ResponseEntity<Dataset<List<GameweekDto>>>> getGameweeks() {
		return ResponseMapping.toResponse(fplDataService.getGameweeks());
	}

	@Operation(summary = "List fixtures", description = "All fixtures, optionally filtered by team and/or gameweek.")
	@GetMapping("/fixtures")
	public Mono<ResponseEntity<Dataset<List<FixtureDto>>>> getFixtures(
			@Parameter(description = "FPL team id", example = "1") @RequestParam(required = false) Integer team,
			@Parameter(description = "Gameweek number", example = "12") @RequestParam(required = false) Integer gameweek) {
		return ResponseMapping.toResponse(fplDataService.getFixtures(team, gameweek));
	}

	@Operation(
			summary = "Upcoming fixture difficulty of a team",
			description = "Next unplayed fixtures of the team with the FDR rating (1 Easy to 5 Extreme) from its own side.")
	@ApiResponses(value = {
			@ApiResponse(responseCode = "200", description = "Upcoming fixtures"),
			@ApiResponse(responseCode = "503", description = "FPL API unavailable and nothing cached", content = @Content)
	})
	@GetMapping("/teams/{teamId}/fixture-difficulty")
	public Mono<ResponseEntity<Dataset<List<FixtureDifficultyDto>>>> getFixtureDifficulty(
			@Parameter(description = "FPL team id", required = true, example = "1") @PathVariable int teamId,
			@Parameter(description = "Number of upcoming fixtures", example = "5")
			@RequestParam(defaultValue = "5") int gameweeks) {
		return ResponseMapping.toResponse(fplDataService.getFixturesWithDifficulty(teamId, gameweeks));
	}

	@Operation(summary = "Player summary", description = "Raw element-summary document: fixtures, history and past seasons.")
	@ApiResponses(value = {
			@ApiResponse(responseCode = "200", description = "Player summary"),
			@ApiResponse(responseCode = "404", description = "Unknown player", content = @Content),
			@ApiResponse(responseCode = "503", description = "FPL API unavailable and nothing cached", content = @Content)
	})
	@GetMapping("/players/{playerId}/summary")
	public Mono<ResponseEntity<Dataset<JsonNode>>> getPlayerSummary(
			@Parameter(description = "FPL player (element) id", required = true, example = "328") @PathVariable int playerId) {
		return ResponseMapping.toResponse(fplDataService.getPlayerSummary(playerId));
	}
}
