package com.pricecompare.config;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

/**
 * Infrastructure beans for the vendor fan-out: the shared HTTP client
 * and the scheduler every vendor invocation runs on.
 */
@Configuration
@RequiredArgsConstructor
public class ScrapingConfig {

    private final ScrapingProperties scrapingProperties;

    /**
     * WebClient used by all vendor scrapers. Follows redirects since most
     * storefronts bounce search URLs through a locale or tracking hop.
     */
    @Bean
    public WebClient scraperWebClient(WebClient.Builder webClientBuilder) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(scrapingProperties.getTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) Math.min(Integer.MAX_VALUE, scrapingProperties.getTimeout().toMillis()));

        return webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeaders(headers -> scrapingProperties.getDefaultHeaders().forEach(headers::set))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(scrapingProperties.getMaxInMemorySizeBytes()))
                .build();
    }

    /**
     * Scheduler for vendor invocations. Bounded elastic so a scraper that
     * blocks cannot starve its siblings or the Netty event loop.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler scrapingScheduler() {
        return Schedulers.newBoundedElastic(
                scrapingProperties.getConcurrency(),
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                "Scraping");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
