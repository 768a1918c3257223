package com.GlobeLine.fpl_cache.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Upcoming fixture of one team with its fixture difficulty rating (FDR).
 */
public record FixtureDifficultyDto(
		@JsonProperty("gameweek") int gameweek,
		@JsonProperty("opponent") String opponent,
		@JsonProperty("homeAway") String homeAway,
		@JsonProperty("difficulty") int difficulty,
		@JsonProperty("fdr") String fdr) {
}
