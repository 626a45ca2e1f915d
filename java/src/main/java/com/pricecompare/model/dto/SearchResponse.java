package com.pricecompare.model.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Response DTO for a multi-vendor search.
 */
@Value
@Builder
public class SearchResponse {
    boolean success;
    String query;
    int totalResults;
    List<ScrapeResult> results;
    List<VendorError> errors;
    SearchTiming timing;
    boolean cached;
    String timestamp;
}
