package com.pricecompare.model.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SearchTiming {
    long totalMs;
    List<VendorTiming> perVendor;
}
