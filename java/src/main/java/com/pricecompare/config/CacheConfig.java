package com.pricecompare.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.pricecompare.service.ResultCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-scoped result cache, created once and injected where needed.
 */
@Configuration
public class CacheConfig {

    @Bean
    public ResultCache resultCache(CacheProperties cacheProperties) {
        return new ResultCache(cacheProperties.getTtl(), cacheProperties.getMaximumSize(), Ticker.systemTicker());
    }
}
