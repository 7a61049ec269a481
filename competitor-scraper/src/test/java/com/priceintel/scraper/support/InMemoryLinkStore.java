package com.priceintel.scraper.support;

import com.priceintel.scraper.model.CompetitorProductLink;
import com.priceintel.scraper.model.TrackingTarget;
import com.priceintel.scraper.store.LinkStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/** Mirrors the SQL semantics of PostgresLinkStore, including ordering and upsert-on-conflict. */
public class InMemoryLinkStore implements LinkStore {

    private final Map<String, CompetitorProductLink> rows = new LinkedHashMap<>();
    private int sequence;

    public CompetitorProductLink add(CompetitorProductLink link) {
        CompetitorProductLink row = link.toBuilder()
                .id(link.getId() != null ? link.getId() : "link-" + (++sequence))
                .build();
        rows.put(row.getId(), row);
        return row.toBuilder().build();
    }

    public CompetitorProductLink get(String id) {
        CompetitorProductLink row = rows.get(id);
        return row == null ? null : row.toBuilder().build();
    }

    public List<CompetitorProductLink> all() {
        return rows.values().stream().map(l -> l.toBuilder().build()).toList();
    }

    @Override
    public List<CompetitorProductLink> findDue(String userId, String storeId, Instant now,
                                               Instant passStartedAt, int limit) {
        return rows.values().stream()
                .filter(l -> userId.equals(l.getUserId()) && storeId.equals(l.getStoreId()))
                .filter(CompetitorProductLink::isActive)
                .filter(l -> l.getUrl() != null)
                .filter(l -> l.getNextAllowedCheckAt() == null || !l.getNextAllowedCheckAt().isAfter(now))
                .filter(l -> l.getLastCheckedAt() == null || l.getLastCheckedAt().isBefore(passStartedAt))
                .sorted(Comparator.comparing(CompetitorProductLink::getLastCheckedAt,
                                Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(CompetitorProductLink::getPriority, Comparator.reverseOrder())
                        .thenComparing(CompetitorProductLink::getId))
                .limit(limit)
                .map(l -> l.toBuilder().build())
                .toList();
    }

    @Override
    public int countTrackable(String userId, String storeId) {
        return (int) rows.values().stream()
                .filter(l -> userId.equals(l.getUserId()) && storeId.equals(l.getStoreId()))
                .filter(l -> l.isActive() && l.getUrl() != null)
                .count();
    }

    @Override
    public List<TrackingTarget> findTrackingTargets() {
        return rows.values().stream()
                .filter(l -> l.isActive() && l.getUrl() != null)
                .map(l -> new TrackingTarget(l.getUserId(), l.getStoreId()))
                .distinct()
                .toList();
    }

    @Override
    public void saveTrackingState(CompetitorProductLink link) {
        CompetitorProductLink row = rows.get(link.getId());
        if (row == null) return;
        row.setLastPrice(link.getLastPrice());
        row.setLastCurrency(link.getLastCurrency());
        row.setLastAvailability(link.getLastAvailability());
        row.setLastCheckedAt(link.getLastCheckedAt());
        row.setLastChangedAt(link.getLastChangedAt());
        row.setLastErrorAt(link.getLastErrorAt());
        row.setLastErrorMessage(link.getLastErrorMessage());
        row.setNoChangeStreak(link.getNoChangeStreak());
        row.setErrorStreak(link.getErrorStreak());
        row.setNextAllowedCheckAt(link.getNextAllowedCheckAt());
        row.setNeedsAttention(link.isNeedsAttention());
    }

    @Override
    public int upsert(List<CompetitorProductLink> links) {
        for (CompetitorProductLink link : links) {
            CompetitorProductLink existing = rows.values().stream()
                    .filter(r -> r.getProductId().equals(link.getProductId())
                            && r.getCompetitorId().equals(link.getCompetitorId()))
                    .findFirst()
                    .orElse(null);
            if (existing != null) {
                existing.setUrl(link.getUrl());
                existing.setCompetitorProductId(link.getCompetitorProductId());
                existing.setPriority(link.getPriority());
                existing.setActive(true);
            } else {
                add(link.toBuilder().active(true).build());
            }
        }
        return links.size();
    }

    @Override
    public Set<String> findLinkedProductIds(String competitorId, Collection<String> productIds) {
        return rows.values().stream()
                .filter(l -> competitorId.equals(l.getCompetitorId()))
                .map(CompetitorProductLink::getProductId)
                .filter(productIds::contains)
                .collect(Collectors.toSet());
    }

    @Override
    public boolean hasActiveLink(String productId, String competitorId) {
        return rows.values().stream()
                .anyMatch(l -> Objects.equals(productId, l.getProductId())
                        && Objects.equals(competitorId, l.getCompetitorId())
                        && l.isActive());
    }

    @Override
    public int countActiveForProduct(String productId) {
        return (int) rows.values().stream()
                .filter(l -> Objects.equals(productId, l.getProductId()) && l.isActive())
                .count();
    }

    public List<CompetitorProductLink> forCompetitor(String competitorId) {
        List<CompetitorProductLink> out = new ArrayList<>();
        rows.values().stream()
                .filter(l -> competitorId.equals(l.getCompetitorId()))
                .forEach(l -> out.add(l.toBuilder().build()));
        return out;
    }
}
