package com.pricecompare.scraper;

import com.pricecompare.model.Vendor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ScraperRegistry.
 */
class ScraperRegistryTest {

    private ScraperRegistry registry;

    @BeforeEach
    void setUp() {
        // Registered out of order on purpose
        List<VendorScraper> scrapers = Arrays.stream(Vendor.values())
                .sorted((a, b) -> b.compareTo(a))
                .map(vendor -> (VendorScraper) StubScraper.returning(vendor, 1.0))
                .toList();
        registry = new ScraperRegistry(scrapers);
    }

    @Test
    void resolve_NoSelection_ReturnsDefaultVendors() {
        assertThat(vendors(registry.resolve(null)))
                .containsExactly(Vendor.AMAZON, Vendor.FLIPKART, Vendor.EBAY, Vendor.MYNTRA,
                        Vendor.CROMA, Vendor.AJIO, Vendor.SNAPDEAL);
    }

    @Test
    void resolve_BlankSelection_ReturnsDefaultVendors() {
        assertThat(vendors(registry.resolve(List.of(" ", ""))))
                .isEqualTo(Vendor.defaults());
    }

    @Test
    void resolve_Selection_UsesCanonicalOrder() {
        assertThat(vendors(registry.resolve(List.of("nykaa", "ebay", "amazon"))))
                .containsExactly(Vendor.AMAZON, Vendor.EBAY, Vendor.NYKAA);
    }

    @Test
    void resolve_IgnoresUnknownAndDuplicateVendors() {
        assertThat(vendors(registry.resolve(List.of("Flipkart", "walmart", " flipkart ", "croma"))))
                .containsExactly(Vendor.FLIPKART, Vendor.CROMA);
    }

    @Test
    void resolve_OnlyUnknownVendors_ReturnsEmpty() {
        assertThat(registry.resolve(List.of("walmart", "target"))).isEmpty();
    }

    @Test
    void resolve_SkipsVendorsWithoutScraper() {
        ScraperRegistry partial = new ScraperRegistry(List.of(StubScraper.returning(Vendor.EBAY, 1.0)));

        assertThat(vendors(partial.resolve(null))).containsExactly(Vendor.EBAY);
        assertThat(partial.resolve(List.of("amazon"))).isEmpty();
    }

    @Test
    void constructor_DuplicateVendor_Fails() {
        List<VendorScraper> scrapers = List.of(
                StubScraper.returning(Vendor.AMAZON, 1.0),
                StubScraper.returning(Vendor.AMAZON, 2.0));

        assertThatThrownBy(() -> new ScraperRegistry(scrapers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("amazon");
    }

    private static List<Vendor> vendors(List<VendorScraper> scrapers) {
        return scrapers.stream().map(VendorScraper::vendor).toList();
    }
}
