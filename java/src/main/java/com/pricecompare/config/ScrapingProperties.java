package com.pricecompare.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP and parsing settings shared by all vendor scrapers.
 */
@Data
@ConfigurationProperties(prefix = "pricecompare.scraping")
public class ScrapingProperties {

    /** Per-vendor HTTP response timeout. */
    private Duration timeout = Duration.ofSeconds(15);

    private int maxResultsPerVendor = 20;

    /** Upper bound on scraping scheduler threads. */
    private int concurrency = 16;

    /** Search result pages can be large. */
    private int maxInMemorySizeBytes = 5 * 1024 * 1024;

    private Map<String, String> defaultHeaders = new LinkedHashMap<>(Map.of(
            "User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.9"
    ));
}
