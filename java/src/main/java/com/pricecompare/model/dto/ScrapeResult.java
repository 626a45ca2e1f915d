package com.pricecompare.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pricecompare.model.Vendor;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One product offer found by one vendor.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScrapeResult {
    String id;
    String title;
    BigDecimal price;
    BigDecimal originalPrice;
    String currency;
    Vendor vendor;
    String url;
    String image;
    Double rating;
    Integer reviews;
    String description;
    String discount;
    Boolean inStock;
}
