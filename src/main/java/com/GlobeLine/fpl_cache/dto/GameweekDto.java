package com.GlobeLine.fpl_cache.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GameweekDto(
		@JsonProperty("id") int id,
		@JsonProperty("name") String name,
		@JsonProperty("deadlineTime") Instant deadlineTime,
		@JsonProperty("finished") boolean finished,
		@JsonProperty("isCurrent") boolean current,
		@JsonProperty("isNext") boolean next,
		@JsonProperty("isPrevious") boolean previous) {
}
