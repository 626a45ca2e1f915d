package com.pricecompare.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * Query parameters of a search: {@code ?q=...&vendors=amazon,flipkart}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    @NotBlank(message = "Please provide a search query")
    @Size(max = 200, message = "Query cannot exceed 200 characters")
    private String q;

    /** Comma-separated vendor identifiers; absent means the default vendor set. */
    private String vendors;

    /**
     * Surrounding whitespace is dropped on binding, so the length limit
     * applies to the query that is actually searched.
     */
    public void setQ(String q) {
        this.q = q == null ? null : q.trim();
    }

    public String trimmedQuery() {
        return q == null ? null : q.trim();
    }

    /**
     * Vendor tokens as supplied, blanks dropped. Null when no selection was made.
     */
    public List<String> vendorSelection() {
        if (vendors == null) {
            return null;
        }
        List<String> tokens = Arrays.stream(vendors.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .toList();
        return tokens.isEmpty() ? null : tokens;
    }
}
