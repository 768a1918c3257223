package com.GlobeLine.fpl_cache.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TeamDto(
		@JsonProperty("id") int id,
		@JsonProperty("name") String name,
		@JsonProperty("shortName") String shortName,
		@JsonProperty("strength") Integer strength) {
}
