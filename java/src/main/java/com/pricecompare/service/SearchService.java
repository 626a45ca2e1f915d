package com.pricecompare.service;

import com.pricecompare.config.SearchProperties;
import com.pricecompare.exception.SearchTimeoutException;
import com.pricecompare.model.dto.ScrapeResult;
import com.pricecompare.model.dto.SearchResponse;
import com.pricecompare.scraper.ScraperRegistry;
import com.pricecompare.scraper.VendorScraper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Multi-vendor product search with a cache-aside result cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchService {

    private final ScraperRegistry scraperRegistry;
    private final ResultCache resultCache;
    private final SearchOrchestrator searchOrchestrator;
    private final SearchResponseAssembler responseAssembler;
    private final SearchProperties searchProperties;
    private final Clock clock;

    /**
     * Search the selected vendors, serving repeated requests from cache.
     *
     * @param query Trimmed, non-empty query
     * @param vendors Requested vendor identifiers, or null for the default set
     * @return Search response; fails with {@link SearchTimeoutException} past the deadline
     */
    public Mono<SearchResponse> search(String query, List<String> vendors) {
        return Mono.defer(() -> {
            long start = clock.millis();
            List<VendorScraper> scrapers = scraperRegistry.resolve(vendors);

            Optional<List<ScrapeResult>> cached = resultCache.get(query, vendors);
            if (cached.isPresent()) {
                log.info("Cache hit for '{}' ({} results)", query, cached.get().size());
                return Mono.just(responseAssembler.fromCache(query, cached.get(), clock.millis() - start));
            }

            log.info("Searching '{}' across {} vendors: {}", query, scrapers.size(),
                    scrapers.stream().map(VendorScraper::vendor).toList());

            Duration deadline = searchProperties.getDeadline();
            return searchOrchestrator.search(query, scrapers)
                    .timeout(deadline)
                    .onErrorMap(TimeoutException.class, e -> new SearchTimeoutException(query, deadline, e))
                    .doOnNext(outcome -> resultCache.put(query, outcome.getResults(), vendors))
                    .map(outcome -> {
                        SearchResponse response = responseAssembler.fromOutcome(query, outcome, clock.millis() - start);
                        log.info("Search '{}' finished: {} results, {} vendor errors in {} ms",
                                query, response.getTotalResults(), response.getErrors().size(),
                                response.getTiming().getTotalMs());
                        return response;
                    });
        });
    }
}
