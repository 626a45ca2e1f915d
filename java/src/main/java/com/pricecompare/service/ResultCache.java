package com.pricecompare.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.pricecompare.model.dto.CacheStatsResponse;
import com.pricecompare.model.dto.ScrapeResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory cache of merged search results, keyed by normalized query and
 * vendor selection.
 *
 * Entries expire a fixed time after they are written; an expired entry is
 * treated as a miss on lookup. Safe for concurrent use, last write wins.
 */
@Slf4j
public class ResultCache {

    private static final String ALL_VENDORS = "all";

    private final Cache<String, List<ScrapeResult>> cache;

    public ResultCache(Duration ttl, long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(ticker)
                .recordStats()
                .build();
    }

    public Optional<List<ScrapeResult>> get(String query, Collection<String> vendors) {
        return Optional.ofNullable(cache.getIfPresent(key(query, vendors)));
    }

    /**
     * Store a merged result list. Empty lists are not stored so that a
     * transiently failing vendor is retried on the next request.
     */
    public void put(String query, List<ScrapeResult> results, Collection<String> vendors) {
        if (results == null || results.isEmpty()) {
            return;
        }
        String key = key(query, vendors);
        cache.put(key, List.copyOf(results));
        log.debug("Cached {} results under '{}'", results.size(), key);
    }

    /**
     * @return Number of entries removed
     */
    public long invalidateAll() {
        cache.cleanUp();
        long size = cache.estimatedSize();
        cache.invalidateAll();
        cache.cleanUp();
        return size;
    }

    public CacheStatsResponse stats() {
        cache.cleanUp();
        CacheStats stats = cache.stats();
        return CacheStatsResponse.builder()
                .size(cache.estimatedSize())
                .keys(cache.asMap().keySet().stream().sorted().toList())
                .hitCount(stats.hitCount())
                .missCount(stats.missCount())
                .build();
    }

    /**
     * Cache key: lower-cased trimmed query plus the sorted, de-duplicated
     * vendor tokens, or {@code all} when no vendor was requested.
     */
    static String key(String query, Collection<String> vendors) {
        String normalizedQuery = query.trim().toLowerCase(Locale.ROOT);
        String vendorKey = vendors == null ? "" : vendors.stream()
                .filter(token -> token != null && !token.isBlank())
                .map(token -> token.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .sorted()
                .collect(Collectors.joining(","));
        return normalizedQuery + ":" + (vendorKey.isEmpty() ? ALL_VENDORS : vendorKey);
    }
}
