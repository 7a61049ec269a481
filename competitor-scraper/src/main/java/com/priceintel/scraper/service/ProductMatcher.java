package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.CandidateProduct;
import com.priceintel.scraper.model.LocalProduct;
import com.priceintel.scraper.model.MatchCandidate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores local products against competitor candidates.
 *
 * Title similarity is the Sørensen–Dice coefficient over normalised word sets,
 * scaled to 0-100. An exact SKU match lifts the score to the high-confidence level.
 * Each local product keeps at most its single best candidate; ties go to the
 * lexicographically smaller candidate id.
 */
@Component
@RequiredArgsConstructor
public class ProductMatcher {

    private final ScraperProperties properties;

    public List<MatchCandidate> findBestMatches(List<LocalProduct> localItems,
                                                List<CandidateProduct> candidates,
                                                int minScore) {
        List<MatchCandidate> matches = new ArrayList<>();
        for (LocalProduct local : localItems) {
            Set<String> localTokens = tokens(local.name());
            CandidateProduct best = null;
            int bestScore = -1;

            for (CandidateProduct candidate : candidates) {
                if (candidate.id() == null) continue;
                int score = score(localTokens, local.sku(), candidate);
                if (score > bestScore || (score == bestScore && candidate.id().compareTo(best.id()) < 0)) {
                    best = candidate;
                    bestScore = score;
                }
            }

            if (best != null && bestScore >= minScore) {
                matches.add(new MatchCandidate(local.id(), best.id(), bestScore));
            }
        }
        return matches;
    }

    public int similarity(LocalProduct local, CandidateProduct candidate) {
        return score(tokens(local.name()), local.sku(), candidate);
    }

    static String normalize(String text) {
        if (text == null) return "";
        String stripped = Normalizer.normalize(text, Normalizer.Form.NFD).replaceAll("\\p{M}+", "");
        return stripped.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", " ")
                .trim();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private int score(Set<String> localTokens, String localSku, CandidateProduct candidate) {
        int score = dice(localTokens, tokens(candidate.name()));
        if (skuMatches(localSku, candidate.sku())) {
            score = Math.max(score, properties.getMatching().getHighConfidenceScore());
        }
        return score;
    }

    private static int dice(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0;
        Set<String> common = new HashSet<>(a);
        common.retainAll(b);
        return (int) Math.round(200.0 * common.size() / (a.size() + b.size()));
    }

    private static Set<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return Set.of();
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }

    private static boolean skuMatches(String a, String b) {
        return a != null && b != null && !a.isBlank() && a.trim().equalsIgnoreCase(b.trim());
    }
}
