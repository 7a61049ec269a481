package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.CandidateProduct;
import com.priceintel.scraper.model.LocalProduct;
import com.priceintel.scraper.model.MatchCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProductMatcherTest {

    private final ProductMatcher matcher = new ProductMatcher(new ScraperProperties());

    @Test
    void normalize_stripsAccentsCaseAndPunctuation() {
        assertThat(ProductMatcher.normalize("  Café-Crème  (500ml)! ")).isEqualTo("cafe creme 500ml");
        assertThat(ProductMatcher.normalize(null)).isEmpty();
    }

    @Test
    void identicalTitlesScoreFull() {
        LocalProduct local = new LocalProduct("p1", "Organic Green Tea 100g", null);
        CandidateProduct candidate = candidate("c1", "organic green tea 100G", null);

        assertThat(matcher.similarity(local, candidate)).isEqualTo(100);
    }

    @Test
    void partialOverlapUsesDiceCoefficient() {
        // {organic, green, tea} vs {green, tea, bags}: 2*2/6
        LocalProduct local = new LocalProduct("p1", "Organic Green Tea", null);
        CandidateProduct candidate = candidate("c1", "Green Tea Bags", null);

        assertThat(matcher.similarity(local, candidate)).isEqualTo(67);
    }

    @Test
    void skuMatchLiftsScoreToHighConfidence() {
        LocalProduct local = new LocalProduct("p1", "Widget", "SKU-42");
        CandidateProduct candidate = candidate("c1", "Completely different name", " sku-42 ");

        assertThat(matcher.similarity(local, candidate)).isEqualTo(90);
    }

    @Test
    void keepsOnlyBestCandidateAboveThreshold() {
        List<LocalProduct> locals = List.of(
                new LocalProduct("p1", "Organic Green Tea", null),
                new LocalProduct("p2", "Stainless Steel Kettle", null));
        List<CandidateProduct> candidates = List.of(
                candidate("c1", "Green Tea Bags", null),
                candidate("c2", "Organic Green Tea", null),
                candidate("c3", "Ceramic Mug", null));

        List<MatchCandidate> matches = matcher.findBestMatches(locals, candidates, 60);

        assertThat(matches).containsExactly(new MatchCandidate("p1", "c2", 100));
    }

    @Test
    void tiesGoToSmallerCandidateId() {
        List<LocalProduct> locals = List.of(new LocalProduct("p1", "Blue Shirt", null));
        List<CandidateProduct> candidates = List.of(
                candidate("https://rival.example/b", "Blue Shirt", null),
                candidate("https://rival.example/a", "Blue Shirt", null));

        assertThat(matcher.findBestMatches(locals, candidates, 60))
                .extracting(MatchCandidate::competitorProductId)
                .containsExactly("https://rival.example/a");
    }

    @Test
    void noCandidatesGivesNoMatches() {
        assertThat(matcher.findBestMatches(List.of(new LocalProduct("p1", "Anything", null)), List.of(), 0))
                .isEmpty();
    }

    private static CandidateProduct candidate(String id, String name, String sku) {
        return new CandidateProduct(id, name, sku, id, null);
    }
}
