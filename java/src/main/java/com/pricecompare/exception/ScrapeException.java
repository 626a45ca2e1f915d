package com.pricecompare.exception;

import com.pricecompare.model.Vendor;
import lombok.Getter;

/**
 * Exception raised by a vendor scraper when a search page cannot be fetched or parsed.
 */
@Getter
public class ScrapeException extends RuntimeException {

    private final Vendor vendor;
    private final String code;

    public ScrapeException(Vendor vendor, String message) {
        this(vendor, message, null, null);
    }

    public ScrapeException(Vendor vendor, String message, String code) {
        this(vendor, message, code, null);
    }

    public ScrapeException(Vendor vendor, String message, String code, Throwable cause) {
        super(message, cause);
        this.vendor = vendor;
        this.code = code;
    }
}
