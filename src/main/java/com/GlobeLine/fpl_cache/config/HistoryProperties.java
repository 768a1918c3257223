package com.GlobeLine.fpl_cache.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Location of the optional historical CSV datasets (fpl.history.*), one directory per season.
 */
@ConfigurationProperties(prefix = "fpl.history")
public record HistoryProperties(@DefaultValue("data") String dataDir) {
}
