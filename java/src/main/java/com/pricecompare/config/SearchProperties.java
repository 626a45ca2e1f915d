package com.pricecompare.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Search orchestration settings.
 */
@Data
@ConfigurationProperties(prefix = "pricecompare.search")
public class SearchProperties {

    /**
     * Wall-clock budget for one fan-out across all vendors.
     * Kept below the hosting platform's 60s request limit.
     */
    private Duration deadline = Duration.ofSeconds(55);
}
