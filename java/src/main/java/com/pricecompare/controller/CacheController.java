package com.pricecompare.controller;

import com.pricecompare.model.dto.CacheStatsResponse;
import com.pricecompare.service.ResultCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Inspection and invalidation of the search result cache.
 */
@Slf4j
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

    private final ResultCache resultCache;

    @GetMapping("/stats")
    public Mono<CacheStatsResponse> stats() {
        return Mono.fromSupplier(resultCache::stats);
    }

    @DeleteMapping
    public Mono<Map<String, Long>> clear() {
        return Mono.fromSupplier(() -> {
            long cleared = resultCache.invalidateAll();
            log.info("Cleared {} cached searches", cleared);
            return Map.of("cleared", cleared);
        });
    }
}
