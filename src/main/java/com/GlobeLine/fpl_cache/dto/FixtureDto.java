package com.GlobeLine.fpl_cache.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A fixture as published by the FPL API. {@code gameweek} is null for unscheduled fixtures.
 */
public record FixtureDto(
		@JsonProperty("id") int id,
		@JsonProperty("gameweek") Integer gameweek,
		@JsonProperty("homeTeamId") int homeTeamId,
		@JsonProperty("awayTeamId") int awayTeamId,
		@JsonProperty("homeTeamDifficulty") int homeTeamDifficulty,
		@JsonProperty("awayTeamDifficulty") int awayTeamDifficulty,
		@JsonProperty("kickoffTime") Instant kickoffTime,
		@JsonProperty("finished") boolean finished) {

	public boolean involves(int teamId) {
		return homeTeamId == teamId || awayTeamId == teamId;
	}
}
