package com.priceintel.scraper.model;

import java.math.BigDecimal;

/** {@code price} is null when no selector produced a parseable, non-negative number. */
public record ExtractedPrice(BigDecimal price, String currency, boolean available) {

    public boolean hasPrice() {
        return price != null;
    }
}
