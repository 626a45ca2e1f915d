package com.pricecompare.service;

import com.pricecompare.model.SearchOutcome;
import com.pricecompare.model.dto.ScrapeResult;
import com.pricecompare.model.dto.SearchResponse;
import com.pricecompare.model.dto.SearchTiming;
import com.pricecompare.model.dto.VendorError;
import com.pricecompare.model.dto.VendorTiming;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Builds the externally visible {@link SearchResponse}.
 */
@Component
@RequiredArgsConstructor
public class SearchResponseAssembler {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public SearchResponse fromOutcome(String query, SearchOutcome outcome, long totalMs) {
        return build(outcome.isSuccess(), query, outcome.getResults(), outcome.getErrors(),
                outcome.getTimings(), totalMs, false);
    }

    /**
     * A cache hit invoked no vendor, so it carries no errors and no per-vendor timings.
     */
    public SearchResponse fromCache(String query, List<ScrapeResult> results, long totalMs) {
        return build(true, query, results, List.of(), List.of(), totalMs, true);
    }

    private SearchResponse build(boolean success, String query, List<ScrapeResult> results,
                                 List<VendorError> errors, List<VendorTiming> timings,
                                 long totalMs, boolean cached) {
        return SearchResponse.builder()
                .success(success)
                .query(query)
                .totalResults(results.size())
                .results(results)
                .errors(errors)
                .timing(SearchTiming.builder()
                        .totalMs(totalMs)
                        .perVendor(timings)
                        .build())
                .cached(cached)
                .timestamp(TIMESTAMP.format(clock.instant()))
                .build();
    }
}
