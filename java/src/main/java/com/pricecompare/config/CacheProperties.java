package com.pricecompare.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Result cache settings.
 */
@Data
@ConfigurationProperties(prefix = "pricecompare.cache")
public class CacheProperties {

    private Duration ttl = Duration.ofSeconds(60);

    private long maximumSize = 500;
}
