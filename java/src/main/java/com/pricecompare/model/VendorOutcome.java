package com.pricecompare.model;

import com.pricecompare.exception.ScrapeException;
import com.pricecompare.model.dto.ScrapeResult;
import com.pricecompare.model.dto.VendorError;
import com.pricecompare.model.dto.VendorTiming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Terminal state of one vendor invocation: either a result batch or an
 * error, always with a timing.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VendorOutcome {

    public static final String UNKNOWN_ERROR = "Unknown error";

    Vendor vendor;
    List<ScrapeResult> results;
    VendorError error;
    VendorTiming timing;

    public static VendorOutcome success(Vendor vendor, List<ScrapeResult> results, long durationMs) {
        List<ScrapeResult> batch = List.copyOf(results);
        return new VendorOutcome(vendor, batch, null, new VendorTiming(vendor, durationMs, batch.size()));
    }

    public static VendorOutcome failure(Vendor vendor, Throwable cause, long durationMs) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = UNKNOWN_ERROR;
        }
        String code = cause instanceof ScrapeException ? ((ScrapeException) cause).getCode() : null;
        return new VendorOutcome(vendor, List.of(), new VendorError(vendor, message, code),
                new VendorTiming(vendor, durationMs, 0));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
