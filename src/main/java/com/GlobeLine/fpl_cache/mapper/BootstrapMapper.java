package com.GlobeLine.fpl_cache.mapper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;

import com.GlobeLine.fpl_cache.dto.FixtureDifficultyDto;
import com.GlobeLine.fpl_cache.dto.FixtureDto;
import com.GlobeLine.fpl_cache.dto.GameweekDto;
import com.GlobeLine.fpl_cache.dto.PlayerDto;
import com.GlobeLine.fpl_cache.dto.TeamDto;

/**
 * Maps raw FPL API documents (as cached) to the tables consumers work with.
 * Many FPL numbers arrive as strings ("5.5"); anything unparseable falls back to a default.
 */
@Component
public class BootstrapMapper {

	private static final BigDecimal TENTHS = BigDecimal.TEN;
	private static final int DEFAULT_CHANCE_OF_PLAYING = 100;
	private static final int DEFAULT_DIFFICULTY = 3;

	public List<PlayerDto> mapPlayers(JsonNode bootstrap) {
		Map<Integer, String> teamNames = new HashMap<>();
		for (JsonNode team : bootstrap.path("teams")) {
			teamNames.put(team.path("id").asInt(), team.path("name").asText("").strip());
		}
		Map<Integer, String> positions = new HashMap<>();
		for (JsonNode type : bootstrap.path("element_types")) {
			positions.put(type.path("id").asInt(), type.path("singular_name").asText(null));
		}

		List<PlayerDto> players = new ArrayList<>();
		for (JsonNode element : bootstrap.path("elements")) {
			int teamId = element.path("team").asInt();
			// now_cost is in tenths of a million
			BigDecimal price = decimal(element, "now_cost", BigDecimal.ZERO)
					.divide(TENTHS, 1, RoundingMode.HALF_UP);
			int totalPoints = integer(element, "total_points", 0);

			players.add(new PlayerDto(
					element.path("id").asInt(),
					element.path("web_name").asText(null),
					element.path("first_name").asText(null),
					element.path("second_name").asText(null),
					teamId,
					teamNames.get(teamId),
					positions.get(element.path("element_type").asInt()),
					price,
					decimal(element, "form", BigDecimal.ZERO),
					totalPoints,
					integer(element, "minutes", 0),
					integer(element, "goals_scored", 0),
					integer(element, "assists", 0),
					integer(element, "clean_sheets", 0),
					integer(element, "bonus", 0),
					decimal(element, "expected_goals", BigDecimal.ZERO),
					decimal(element, "expected_assists", BigDecimal.ZERO),
					decimal(element, "threat", BigDecimal.ZERO),
					decimal(element, "creativity", BigDecimal.ZERO),
					decimal(element, "influence", BigDecimal.ZERO),
					decimal(element, "selected_by_percent", BigDecimal.ZERO),
					decimal(element, "transfers_in", BigDecimal.ZERO).longValue(),
					decimal(element, "transfers_out", BigDecimal.ZERO).longValue(),
					integer(element, "chance_of_playing_next_round", DEFAULT_CHANCE_OF_PLAYING),
					pointsPerMillion(totalPoints, price)));
		}
		return players;
	}

	public List<TeamDto> mapTeams(JsonNode bootstrap) {
		List<TeamDto> teams = new ArrayList<>();
		for (JsonNode team : bootstrap.path("teams")) {
			JsonNode strength = team.get("strength");
			teams.add(new TeamDto(
					team.path("id").asInt(),
					team.path("name").asText("").strip(),
					team.path("short_name").asText("").strip(),
					strength != null && strength.canConvertToInt() ? strength.asInt() : null));
		}
		return teams;
	}

	public List<GameweekDto> mapGameweeks(JsonNode bootstrap) {
		List<GameweekDto> gameweeks = new ArrayList<>();
		for (JsonNode event : bootstrap.path("events")) {
			gameweeks.add(new GameweekDto(
					event.path("id").asInt(),
					event.path("name").asText(null),
					instant(event, "deadline_time"),
					event.path("finished").asBoolean(false),
					event.path("is_current").asBoolean(false),
					event.path("is_next").asBoolean(false),
					event.path("is_previous").asBoolean(false)));
		}
		return gameweeks;
	}

	public List<FixtureDto> mapFixtures(JsonNode fixtures) {
		List<FixtureDto> result = new ArrayList<>();
		for (JsonNode fixture : fixtures) {
			JsonNode event = fixture.get("event");
			result.add(new FixtureDto(
					fixture.path("id").asInt(),
					event != null && event.canConvertToInt() ? event.asInt() : null,
					fixture.path("team_h").asInt(),
					fixture.path("team_a").asInt(),
					integer(fixture, "team_h_difficulty", DEFAULT_DIFFICULTY),
					integer(fixture, "team_a_difficulty", DEFAULT_DIFFICULTY),
					instant(fixture, "kickoff_time"),
					fixture.path("finished").asBoolean(false)));
		}
		return result;
	}

	/**
	 * Next {@code gameweeks} unplayed fixtures of {@code teamId}, seen from that team's side.
	 * Finished fixtures, fixtures without a gameweek, or against a team that is not in {@code teams}, are skipped.
	 */
	public List<FixtureDifficultyDto> mapFixtureDifficulty(int teamId, int gameweeks, List<FixtureDto> fixtures,
			List<TeamDto> teams) {
		Map<Integer, String> shortNames = new HashMap<>();
		teams.forEach(team -> shortNames.put(team.id(), team.shortName()));

		List<FixtureDifficultyDto> rows = new ArrayList<>();
		for (FixtureDto fixture : fixtures) {
			if (rows.size() >= gameweeks) {
				break;
			}
			if (!fixture.involves(teamId) || fixture.gameweek() == null || fixture.finished()) {
				continue;
			}
			boolean home = fixture.homeTeamId() == teamId;
			String opponent = shortNames.get(home ? fixture.awayTeamId() : fixture.homeTeamId());
			if (opponent == null) {
				continue;
			}
			int difficulty = home ? fixture.homeTeamDifficulty() : fixture.awayTeamDifficulty();
			rows.add(new FixtureDifficultyDto(
					fixture.gameweek(),
					opponent,
					home ? "Home" : "Away",
					difficulty,
					difficultyLabel(difficulty)));
		}
		return rows;
	}

	public static String difficultyLabel(int difficulty) {
		return switch (difficulty) {
			case 1 -> "Easy";
			case 2 -> "Medium";
			case 3 -> "Hard";
			case 4 -> "Very Hard";
			case 5 -> "Extreme";
			default -> "Unknown";
		};
	}

	private static BigDecimal pointsPerMillion(int totalPoints, BigDecimal price) {
		BigDecimal divisor = price.signum() == 0 ? BigDecimal.ONE : price;
		return BigDecimal.valueOf(totalPoints).divide(divisor, 2, RoundingMode.HALF_UP);
	}

	private static BigDecimal decimal(JsonNode node, String field, BigDecimal defaultValue) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return defaultValue;
		}
		if (value.isNumber()) {
			return value.decimalValue();
		}
		try {
			return new BigDecimal(value.asText().trim());
		} catch (NumberFormatException ex) {
			return defaultValue;
		}
	}

	private static int integer(JsonNode node, String field, int defaultValue) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return defaultValue;
		}
		return decimal(node, field, BigDecimal.valueOf(defaultValue)).intValue();
	}

	private static Instant instant(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || !value.isTextual()) {
			return null;
		}
		try {
			return Instant.parse(value.asText());
		} catch (DateTimeParseException ex) {
			return null;
		}
	}
}
