package com.GlobeLine.fpl_cache.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the player table derived from bootstrap-static.
 */
public record PlayerDto(
		@JsonProperty("id") int id,
		@JsonProperty("webName") String webName,
		@JsonProperty("firstName") String firstName,
		@JsonProperty("secondName") String secondName,
		@JsonProperty("teamId") int teamId,
		@JsonProperty("teamName") String teamName,
		@JsonProperty("position") String position,
		@JsonProperty("price") BigDecimal price,

		// Season totals
		@JsonProperty("form") BigDecimal form,
		@JsonProperty("totalPoints") int totalPoints,
		@JsonProperty("minutes") int minutes,
		@JsonProperty("goalsScored") int goalsScored,
		@JsonProperty("assists") int assists,
		@JsonProperty("cleanSheets") int cleanSheets,
		@JsonProperty("bonus") int bonus,

		// Underlying stats
		@JsonProperty("xG") BigDecimal expectedGoals,
		@JsonProperty("xA") BigDecimal expectedAssists,
		@JsonProperty("threat") BigDecimal threat,
		@JsonProperty("creativity") BigDecimal creativity,
		@JsonProperty("influence") BigDecimal influence,

		// Market
		@JsonProperty("selectedByPercent") BigDecimal selectedByPercent,
		@JsonProperty("transfersIn") long transfersIn,
		@JsonProperty("transfersOut") long transfersOut,
		@JsonProperty("chanceOfPlayingNextRound") int chanceOfPlayingNextRound,
		@JsonProperty("pointsPerMillion") BigDecimal pointsPerMillion) {
}
