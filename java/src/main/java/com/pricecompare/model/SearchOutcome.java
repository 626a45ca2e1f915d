package com.pricecompare.model;

import com.pricecompare.model.dto.ScrapeResult;
import com.pricecompare.model.dto.VendorError;
import com.pricecompare.model.dto.VendorTiming;
import lombok.Value;

import java.util.List;

/**
 * Merged result of one fan-out across vendors.
 */
@Value
public class SearchOutcome {
    /** Price-ascending, stable with respect to vendor order. */
    List<ScrapeResult> results;
    List<VendorError> errors;
    /** One entry per invoked vendor, in vendor order. */
    List<VendorTiming> timings;
    boolean success;
}
