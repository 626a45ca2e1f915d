package com.pricecompare.service;

import com.pricecompare.model.dto.ComparisonResponse;
import com.pricecompare.model.dto.ProductGroup;
import com.pricecompare.model.dto.ScrapeResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Groups similar products from different vendors so their prices can be
 * compared side by side.
 */
@Service
@RequiredArgsConstructor
public class ProductComparisonService {

    private static final int MAX_GROUP_NAME_LENGTH = 80;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with",
            "new", "latest", "best", "top", "pack", "set", "combo", "buy", "get",
            "free", "shipping", "offer", "deal", "sale", "discount", "price",
            "men", "women", "mens", "womens", "unisex", "kids", "boys", "girls",
            "size", "color", "colour", "style", "type", "model", "version",
            "original", "genuine", "authentic", "official", "branded");

    private static final Comparator<ProductGroup> MOST_COMPARABLE_FIRST =
            Comparator.comparingInt(ProductGroup::getVendorCount).reversed()
                    .thenComparing(ProductGroup::getSavings, Comparator.reverseOrder());

    private final SearchService searchService;

    public Mono<ComparisonResponse> compare(String query, List<String> vendors) {
        return searchService.search(query, vendors)
                .map(response -> ComparisonResponse.builder()
                        .query(response.getQuery())
                        .totalProducts(response.getTotalResults())
                        .groups(groupSimilarProducts(response.getResults()))
                        .cached(response.isCached())
                        .build());
    }

    /**
     * Group products whose titles share enough keywords.
     *
     * Shorter (more generic) titles seed groups first. Groups spanning more
     * vendors come first, then those with the larger price spread.
     */
    public List<ProductGroup> groupSimilarProducts(List<ScrapeResult> products) {
        if (products.isEmpty()) {
            return List.of();
        }

        Set<ScrapeResult> used = Collections.newSetFromMap(new IdentityHashMap<>());
        List<ScrapeResult> seeds = new ArrayList<>(products);
        seeds.sort(Comparator.comparingInt(product -> product.getTitle().length()));

        List<ProductGroup> groups = new ArrayList<>();
        for (ScrapeResult seed : seeds) {
            if (used.contains(seed)) {
                continue;
            }

            List<ScrapeResult> similar = new ArrayList<>();
            for (ScrapeResult candidate : products) {
                if (!used.contains(candidate)
                        && (candidate == seed || isSimilar(seed.getTitle(), candidate.getTitle()))) {
                    similar.add(candidate);
                }
            }

            similar.sort(Comparator.comparing(ScrapeResult::getPrice));
            used.addAll(similar);
            groups.add(toGroup(similar));
        }

        groups.sort(MOST_COMPARABLE_FIRST);
        return groups;
    }

    private ProductGroup toGroup(List<ScrapeResult> similar) {
        BigDecimal lowest = similar.get(0).getPrice();
        BigDecimal highest = similar.get(similar.size() - 1).getPrice();
        int vendorCount = (int) similar.stream().map(ScrapeResult::getVendor).distinct().count();

        return ProductGroup.builder()
                .name(groupName(similar))
                .products(List.copyOf(similar))
                .lowestPrice(lowest)
                .highestPrice(highest)
                .vendorCount(vendorCount)
                .savings(similar.size() > 1 ? highest.subtract(lowest) : BigDecimal.ZERO)
                .build();
    }

    static boolean isSimilar(String title1, String title2) {
        List<String> words1 = extractKeywords(title1);
        List<String> words2 = extractKeywords(title2);

        if (words1.isEmpty() || words2.isEmpty()) {
            return false;
        }

        long matches = words1.stream().filter(words2::contains).count();
        int shorter = Math.min(words1.size(), words2.size());
        int minMatch = Math.min(3, shorter);
        double matchRatio = (double) matches / shorter;

        return matches >= minMatch || matchRatio >= 0.5;
    }

    static List<String> extractKeywords(String title) {
        return Arrays.stream(title.toLowerCase(Locale.ROOT)
                        .replaceAll("[^a-z0-9\\s]", " ")
                        .trim()
                        .split("\\s+"))
                .filter(word -> word.length() > 2 && !STOP_WORDS.contains(word))
                .toList();
    }

    /**
     * Shortest title in the group, truncated for display.
     */
    static String groupName(List<ScrapeResult> products) {
        ScrapeResult shortest = products.get(0);
        for (ScrapeResult product : products) {
            if (product.getTitle().length() < shortest.getTitle().length()) {
                shortest = product;
            }
        }

        String name = shortest.getTitle().replaceAll("\\s+", " ").trim();
        if (name.length() > MAX_GROUP_NAME_LENGTH) {
            name = name.substring(0, MAX_GROUP_NAME_LENGTH - 3) + "...";
        }
        return name;
    }
}
