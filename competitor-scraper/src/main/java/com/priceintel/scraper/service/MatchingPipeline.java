package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.CandidateProduct;
import com.priceintel.scraper.model.CompetitorProductLink;
import com.priceintel.scraper.model.LocalProduct;
import com.priceintel.scraper.model.MatchCandidate;
import com.priceintel.scraper.store.LinkStore;
import com.priceintel.scraper.store.ProductCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Steps shared by quick-start and batch matching: take a slice of the catalog,
 * score it against the scraped candidates and upsert the winners as links.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MatchingPipeline {

    private final ProductCatalog productCatalog;
    private final LinkStore linkStore;
    private final ProductMatcher productMatcher;
    private final ScraperProperties properties;

    /**
     * Active products at [offset, offset + limit) of the catalog ordering, minus
     * those already linked to the competitor.
     */
    public List<LocalProduct> unmatchedSlice(String storeId, String competitorId, int limit, int offset) {
        List<LocalProduct> page = productCatalog.findActiveProducts(storeId, limit, offset);
        if (page.isEmpty()) return page;

        Set<String> linked = linkStore.findLinkedProductIds(competitorId,
                page.stream().map(LocalProduct::id).toList());
        return page.stream()
                .filter(p -> !linked.contains(p.id()))
                .toList();
    }

    /** Matches the slice and upserts one active link per matched product. Returns links written. */
    public int linkMatches(String userId, String storeId, String competitorId,
                           List<LocalProduct> slice, List<CandidateProduct> candidates) {
        if (slice.isEmpty() || candidates.isEmpty()) return 0;

        ScraperProperties.Matching cfg = properties.getMatching();
        List<MatchCandidate> matches = productMatcher.findBestMatches(slice, candidates, cfg.getMinScore());
        if (matches.isEmpty()) return 0;

        Map<String, CandidateProduct> byId = candidates.stream()
                .collect(Collectors.toMap(CandidateProduct::id, Function.identity(), (a, b) -> a));

        List<CompetitorProductLink> links = matches.stream()
                .map(m -> {
                    CandidateProduct candidate = byId.get(m.competitorProductId());
                    return CompetitorProductLink.builder()
                            .userId(userId)
                            .storeId(storeId)
                            .productId(m.productId())
                            .competitorId(competitorId)
                            .competitorProductId(candidate.id())
                            .url(candidate.url())
                            .priority(m.similarity() >= cfg.getHighConfidenceScore() ? 1 : 0)
                            .build();
                })
                .toList();

        int written = linkStore.upsert(links);
        log.info("Linked {} of {} products to competitor {}", written, slice.size(), competitorId);
        return written;
    }
}
