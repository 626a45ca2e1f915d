package com.pricecompare.scraper;

import com.pricecompare.model.Vendor;
import com.pricecompare.model.dto.ScrapeResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A product search against one vendor.
 *
 * Implementations are independent of each other and hold no per-request state.
 * A failed search is signalled as an error on the returned {@link Mono}.
 */
public interface VendorScraper {

    Vendor vendor();

    /**
     * Search the vendor for products matching the query.
     *
     * @param query Trimmed, non-empty search query
     * @return Products found, in the vendor's own order
     */
    Mono<List<ScrapeResult>> scrape(String query);
}
