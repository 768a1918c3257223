package com.GlobeLine.fpl_cache.cache;

public record CacheStoreStats(String root, long entryCount, long totalBytes) {
}
