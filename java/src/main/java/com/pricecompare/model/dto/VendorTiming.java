package com.pricecompare.model.dto;

import com.pricecompare.model.Vendor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Wall-clock duration and result count of one vendor invocation.
 */
@Value
@Builder
@AllArgsConstructor
public class VendorTiming {
    Vendor vendor;
    long durationMs;
    int resultCount;
}
