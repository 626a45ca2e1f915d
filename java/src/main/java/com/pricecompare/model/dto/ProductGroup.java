package com.pricecompare.model.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Similar products from one or more vendors, cheapest first.
 */
@Value
@Builder
public class ProductGroup {
    String name;
    List<ScrapeResult> products;
    BigDecimal lowestPrice;
    BigDecimal highestPrice;
    int vendorCount;
    BigDecimal savings;
}
