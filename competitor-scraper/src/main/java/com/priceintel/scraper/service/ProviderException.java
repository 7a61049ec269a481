package com.priceintel.scraper.service;

/**
 * A provider call that did not produce a billable page: non-2xx status, timeout,
 * I/O failure or an open circuit breaker. {@code statusCode} is 0 when no response arrived.
 */
public class ProviderException extends RuntimeException {

    private final int statusCode;

    public ProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
