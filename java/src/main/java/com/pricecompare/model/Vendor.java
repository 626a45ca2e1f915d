package com.pricecompare.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported vendors. Declaration order is the canonical vendor order used
 * for fan-out, result concatenation and timing output.
 */
@Getter
@RequiredArgsConstructor
public enum Vendor {

    AMAZON("amazon", "Amazon", "#FF9900", true),
    FLIPKART("flipkart", "Flipkart", "#2874F0", true),
    EBAY("ebay", "eBay", "#E53238", true),
    MYNTRA("myntra", "Myntra", "#FF3F6C", true),
    CROMA("croma", "Croma", "#00B140", true),
    AJIO("ajio", "Ajio", "#41494F", true),
    SNAPDEAL("snapdeal", "Snapdeal", "#E40046", true),
    TATACLIQ("tatacliq", "Tata CLiQ", "#8B008B", false),
    NYKAA("nykaa", "Nykaa", "#FC2779", false);

    @JsonValue
    private final String id;
    private final String displayName;
    private final String color;
    private final boolean defaultEnabled;

    /**
     * Look up a vendor by identifier, ignoring case and surrounding whitespace.
     */
    public static Optional<Vendor> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(vendor -> vendor.id.equals(normalized))
                .findFirst();
    }

    public static List<Vendor> defaults() {
        return Arrays.stream(values())
                .filter(Vendor::isDefaultEnabled)
                .toList();
    }

    @Override
    public String toString() {
        return id;
    }
}
