package com.pricecompare.service;

import com.pricecompare.model.SearchOutcome;
import com.pricecompare.model.Vendor;
import com.pricecompare.model.dto.ScrapeResult;
import com.pricecompare.model.dto.SearchResponse;
import com.pricecompare.model.dto.VendorError;
import com.pricecompare.model.dto.VendorTiming;
import com.pricecompare.scraper.StubScraper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SearchResponseAssemblerTest {

    private final SearchResponseAssembler assembler = new SearchResponseAssembler(
            Clock.fixed(Instant.parse("2026-10-19T08:30:00Z"), ZoneOffset.UTC));

    @Test
    void fromOutcome_CopiesOutcome() {
        List<ScrapeResult> results = List.of(StubScraper.product(Vendor.AMAZON, "Mouse", 10));
        SearchOutcome outcome = new SearchOutcome(
                results,
                List.of(new VendorError(Vendor.EBAY, "HTTP 503", "503")),
                List.of(new VendorTiming(Vendor.AMAZON, 120, 1), new VendorTiming(Vendor.EBAY, 80, 0)),
                true);

        SearchResponse response = assembler.fromOutcome("mouse", outcome, 130);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.isCached()).isFalse();
        assertThat(response.getQuery()).isEqualTo("mouse");
        assertThat(response.getTotalResults()).isEqualTo(1);
        assertThat(response.getErrors()).hasSize(1);
        assertThat(response.getTiming().getTotalMs()).isEqualTo(130);
        assertThat(response.getTiming().getPerVendor()).hasSize(2);
        assertThat(response.getTimestamp()).isEqualTo("2026-10-19T08:30:00.000Z");
    }

    @Test
    void fromCache_HasNoVendorTimings() {
        List<ScrapeResult> results = List.of(StubScraper.product(Vendor.AMAZON, "Mouse", 10));

        SearchResponse response = assembler.fromCache("mouse", results, 2);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.isCached()).isTrue();
        assertThat(response.getErrors()).isEmpty();
        assertThat(response.getTiming().getPerVendor()).isEmpty();
        assertThat(response.getTiming().getTotalMs()).isEqualTo(2);
    }
}
