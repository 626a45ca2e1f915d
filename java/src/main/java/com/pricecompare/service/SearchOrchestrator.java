package com.pricecompare.service;

import com.pricecompare.model.SearchOutcome;
import com.pricecompare.model.Vendor;
import com.pricecompare.model.VendorOutcome;
import com.pricecompare.model.dto.ScrapeResult;
import com.pricecompare.model.dto.VendorError;
import com.pricecompare.model.dto.VendorTiming;
import com.pricecompare.scraper.VendorScraper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fans a query out to vendor scrapers concurrently and merges what comes back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchOrchestrator {

    private static final Comparator<ScrapeResult> BY_PRICE =
            Comparator.comparing(ScrapeResult::getPrice, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Scheduler scrapingScheduler;
    private final Clock clock;

    /**
     * Invoke every scraper concurrently and wait for all of them.
     *
     * A failing scraper contributes a {@link VendorError} and no results; it
     * never cancels the others. Results are concatenated in scraper order,
     * regardless of completion order, then stably sorted by price.
     *
     * @param query Search query
     * @param scrapers Scrapers to invoke, in canonical vendor order
     * @return Merged outcome; errors from individual scrapers are never signalled
     */
    public Mono<SearchOutcome> search(String query, List<VendorScraper> scrapers) {
        return Flux.fromIterable(scrapers)
                .flatMapSequential(scraper -> invoke(scraper, query), Math.max(1, scrapers.size()))
                .collectList()
                .map(outcomes -> merge(outcomes, scrapers.size()));
    }

    private Mono<VendorOutcome> invoke(VendorScraper scraper, String query) {
        Vendor vendor = scraper.vendor();
        return Mono.defer(() -> {
            long start = clock.millis();
            return Mono.defer(() -> scraper.scrape(query))
                    .defaultIfEmpty(List.of())
                    .map(results -> VendorOutcome.success(vendor, results, clock.millis() - start))
                    .onErrorResume(error -> {
                        log.warn("[{}] Scrape failed: {}", vendor, error.getMessage());
                        return Mono.just(VendorOutcome.failure(vendor, error, clock.millis() - start));
                    });
        }).subscribeOn(scrapingScheduler);
    }

    private SearchOutcome merge(List<VendorOutcome> outcomes, int invoked) {
        List<ScrapeResult> combined = new ArrayList<>();
        List<VendorError> errors = new ArrayList<>();
        List<VendorTiming> timings = new ArrayList<>(outcomes.size());

        for (VendorOutcome outcome : outcomes) {
            timings.add(outcome.getTiming());
            if (outcome.isSuccess()) {
                combined.addAll(outcome.getResults());
            } else {
                errors.add(outcome.getError());
            }
        }

        // List.sort is stable: equal prices keep vendor order
        combined.sort(BY_PRICE);

        boolean success = !combined.isEmpty() || errors.size() < invoked;
        return new SearchOutcome(List.copyOf(combined), List.copyOf(errors), List.copyOf(timings), success);
    }
}
