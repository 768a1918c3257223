package com.GlobeLine.fpl_cache.history;

import java.util.Arrays;
import java.util.Optional;

/**
 * CSV files expected in each season directory of the historical data set.
 */
public enum HistoricalDataset {

	PLAYER_STATS("player_stats", "player_stats.csv"),
	TEAM_STATS("team_stats", "team_stats.csv"),
	TEAM_ELO("team_elo", "team_elo.csv"),
	FIXTURE_DIFFICULTY("fixture_difficulty", "fixture_difficulty.csv"),
	PLAYER_GAMEWEEK_STATS("player_gameweek_stats", "player_gameweek_stats.csv");

	private final String id;
	private final String fileName;

	HistoricalDataset(String id, String fileName) {
		this.id = id;
		this.fileName = fileName;
	}

	public String id() {
		return id;
	}

	public String fileName() {
		return fileName;
	}

	public static Optional<HistoricalDataset> fromId(String id) {
		return Arrays.stream(values())
				.filter(dataset -> dataset.id.equalsIgnoreCase(id))
				.findFirst();
	}
}
