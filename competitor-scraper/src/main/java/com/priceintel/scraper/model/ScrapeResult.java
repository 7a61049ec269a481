package com.priceintel.scraper.model;

/**
 * Outcome of one budgeted provider call.
 *
 * <ul>
 *   <li>{@code success} - the provider served the page; {@code body} holds the HTML and {@code cost} was charged</li>
 *   <li>{@code deferred} - refused before any network call because the budget is exhausted</li>
 *   <li>{@code configurationError} - provider credentials missing, nothing was attempted</li>
 *   <li>otherwise a transient failure (non-2xx, timeout, I/O), never charged</li>
 * </ul>
 */
public record ScrapeResult(boolean success,
                           String body,
                           String error,
                           boolean deferred,
                           boolean budgetExceeded,
                           boolean configurationError,
                           int cost) {

    public static ScrapeResult success(String body, int cost) {
        return new ScrapeResult(true, body, null, false, false, false, cost);
    }

    public static ScrapeResult failure(String error) {
        return new ScrapeResult(false, null, error, false, false, false, 0);
    }

    public static ScrapeResult deferred(String error) {
        return new ScrapeResult(false, null, error, true, true, false, 0);
    }

    public static ScrapeResult configurationError(String error) {
        return new ScrapeResult(false, null, error, false, false, true, 0);
    }
}
