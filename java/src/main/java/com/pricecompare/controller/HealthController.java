package com.pricecompare.controller;

import com.pricecompare.model.Vendor;
import com.pricecompare.scraper.ScraperRegistry;
import com.pricecompare.service.ResultCache;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service info and a liveness view of the search pipeline.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private static final String VERSION = "1.0.0";

    private final ScraperRegistry scraperRegistry;
    private final ResultCache resultCache;

    @GetMapping("/")
    public Mono<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "PriceCompare");
        body.put("version", VERSION);
        body.put("endpoints", List.of("/api/search", "/api/compare", "/api/vendors", "/api/cache/stats"));
        return Mono.just(body);
    }

    /**
     * Degraded when no scraper is registered, since every search would then
     * come back empty.
     */
    @GetMapping("/api/health")
    public Mono<Map<String, Object>> health() {
        List<String> vendors = scraperRegistry.registeredVendors().stream()
                .map(Vendor::getId)
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", vendors.isEmpty() ? "degraded" : "healthy");
        body.put("version", VERSION);
        body.put("vendors", vendors);
        body.put("cachedQueries", resultCache.stats().getSize());
        return Mono.just(body);
    }
}
