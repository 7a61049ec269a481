package com.priceintel.scraper.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Monthly discovery allowance for one store. One row per store per month,
 * keyed by the first day of the month.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryQuota {

    private String storeId;
    private LocalDate periodStart;
    private int used;
    private int limitAmount;

    public int remaining() {
        return Math.max(0, limitAmount - used);
    }
}
