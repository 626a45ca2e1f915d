package com.pricecompare.exception;

import java.time.Duration;

/**
 * Exception thrown when a search does not finish within the global deadline.
 */
public class SearchTimeoutException extends RuntimeException {

    public SearchTimeoutException(String query, Duration deadline, Throwable cause) {
        super(String.format("Search for '%s' did not complete within %d ms", query, deadline.toMillis()), cause);
    }
}
