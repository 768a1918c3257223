package com.GlobeLine.fpl_cache.service;

import java.util.List;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import com.GlobeLine.fpl_cache.dto.FixtureDto;
import com.GlobeLine.fpl_cache.dto.GameweekDto;
import com.GlobeLine.fpl_cache.dto.PlayerDto;
import com.GlobeLine.fpl_cache.dto.TeamDto;

/**
 * In-memory memo of the tables derived from cached FPL payloads, one Caffeine cache per table.
 * Keys are the payload's write time, so a refreshed payload is derived again.
 */
public class DerivedTableMemo {

	private final Cache<String, List<PlayerDto>> players;
	private final Cache<String, List<TeamDto>> teams;
	private final Cache<String, List<GameweekDto>> gameweeks;
	private final Cache<String, List<FixtureDto>> fixtures;

	public DerivedTableMemo(long maximumSizePerTable, long expireAfterWriteHours) {
		this.players = newCache(maximumSizePerTable, expireAfterWriteHours);
		this.teams = newCache(maximumSizePerTable, expireAfterWriteHours);
		this.gameweeks = newCache(maximumSizePerTable, expireAfterWriteHours);
		this.fixtures = newCache(maximumSizePerTable, expireAfterWriteHours);
	}

	private static <V> Cache<String, V> newCache(long maximumSize, long expireAfterWriteHours) {
		return Caffeine.newBuilder()
				.maximumSize(maximumSize)
				.expireAfterWrite(expireAfterWriteHours, TimeUnit.HOURS)
				.recordStats() // Enable metrics
				.build();
	}

	public Cache<String, List<PlayerDto>> players() {
		return players;
	}

	public Cache<String, List<TeamDto>> teams() {
		return teams;
	}

	public Cache<String, List<GameweekDto>> gameweeks() {
		return gameweeks;
	}

	public Cache<String, List<FixtureDto>> fixtures() {
		return fixtures;
	}

	public long estimatedSize() {
		return players.estimatedSize() + teams.estimatedSize()
				+ gameweeks.estimatedSize() + fixtures.estimatedSize();
	}

	/**
	 * Hit statistics summed over all tables.
	 */
	public CacheStats stats() {
		return players.stats().plus(teams.stats()).plus(gameweeks.stats()).plus(fixtures.stats());
	}
}
