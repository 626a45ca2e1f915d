package com.pricecompare.scraper;

import com.pricecompare.model.Vendor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves a requested vendor selection to the scrapers to invoke.
 *
 * Scrapers are registered once at startup. Resolution always returns them in
 * canonical {@link Vendor} order so that timing output and cache keys do not
 * depend on the order the caller listed vendors in.
 */
@Slf4j
@Component
public class ScraperRegistry {

    private final Map<Vendor, VendorScraper> scrapers = new EnumMap<>(Vendor.class);

    public ScraperRegistry(List<VendorScraper> registered) {
        for (VendorScraper scraper : registered) {
            VendorScraper previous = scrapers.putIfAbsent(scraper.vendor(), scraper);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate scraper for vendor %s: %s and %s",
                        scraper.vendor(), previous.getClass().getSimpleName(), scraper.getClass().getSimpleName()));
            }
        }
        log.info("Registered scrapers for vendors {}", scrapers.keySet());
    }

    /**
     * Scrapers for the requested vendors.
     *
     * @param selection Vendor identifiers as supplied, or null / empty for the default set.
     *                  Unknown identifiers are ignored.
     * @return Scrapers in canonical vendor order, each at most once
     */
    public List<VendorScraper> resolve(Collection<String> selection) {
        Set<Vendor> wanted;
        if (selection == null || selection.stream().allMatch(token -> token == null || token.isBlank())) {
            wanted = Set.copyOf(Vendor.defaults());
        } else {
            wanted = selection.stream()
                    .map(token -> Vendor.fromId(token).or(() -> {
                        log.debug("Ignoring unknown vendor '{}'", token);
                        return Optional.empty();
                    }))
                    .flatMap(Optional::stream)
                    .collect(Collectors.toSet());
        }

        return scrapers.entrySet().stream()
                .filter(entry -> wanted.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .toList();
    }

    public Set<Vendor> registeredVendors() {
        return scrapers.keySet();
    }
}
