package com.priceintel.scraper.model;

import java.math.BigDecimal;

/** Per-link outcome of a tracking pass. */
public record TrackingResult(String linkId,
                             String url,
                             boolean success,
                             boolean priceChanged,
                             BigDecimal oldPrice,
                             BigDecimal newPrice,
                             boolean deferred,
                             String error) {

    public static TrackingResult deferred(CompetitorProductLink link, String reason) {
        return new TrackingResult(link.getId(), link.getUrl(), false, false,
                link.getLastPrice(), null, true, reason);
    }

    public static TrackingResult failed(CompetitorProductLink link, String error) {
        return new TrackingResult(link.getId(), link.getUrl(), false, false,
                link.getLastPrice(), null, false, error);
    }
}
