package com.pricecompare.scraper;

import com.pricecompare.model.Vendor;
import com.pricecompare.model.dto.ScrapeResult;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scripted scraper for tests. Counts invocations.
 */
public class StubScraper implements VendorScraper {

    private final Vendor vendor;
    private final Supplier<Mono<List<ScrapeResult>>> behaviour;
    private final AtomicInteger invocations = new AtomicInteger();

    private StubScraper(Vendor vendor, Supplier<Mono<List<ScrapeResult>>> behaviour) {
        this.vendor = vendor;
        this.behaviour = behaviour;
    }

    public static StubScraper returning(Vendor vendor, double... prices) {
        List<ScrapeResult> results = Arrays.stream(prices)
                .mapToObj(price -> product(vendor, vendor.getDisplayName() + " item " + price, price))
                .toList();
        return new StubScraper(vendor, () -> Mono.just(results));
    }

    public static StubScraper delayed(Vendor vendor, Duration delay, double... prices) {
        StubScraper immediate = returning(vendor, prices);
        return new StubScraper(vendor, () -> immediate.behaviour.get().delayElement(delay));
    }

    public static StubScraper failing(Vendor vendor, String message) {
        return new StubScraper(vendor, () -> Mono.error(new IllegalStateException(message)));
    }

    public static StubScraper of(Vendor vendor, Supplier<Mono<List<ScrapeResult>>> behaviour) {
        return new StubScraper(vendor, behaviour);
    }

    public static ScrapeResult product(Vendor vendor, String title, double price) {
        return ScrapeResult.builder()
                .id(UUID.randomUUID().toString())
                .title(title)
                .price(BigDecimal.valueOf(price))
                .currency("INR")
                .vendor(vendor)
                .url("https://example.com/" + vendor.getId() + "/" + price)
                .build();
    }

    public int invocations() {
        return invocations.get();
    }

    @Override
    public Vendor vendor() {
        return vendor;
    }

    @Override
    public Mono<List<ScrapeResult>> scrape(String query) {
        invocations.incrementAndGet();
        return behaviour.get();
    }
}
