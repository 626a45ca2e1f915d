package com.pricecompare.model.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ComparisonResponse {
    String query;
    int totalProducts;
    List<ProductGroup> groups;
    boolean cached;
}
