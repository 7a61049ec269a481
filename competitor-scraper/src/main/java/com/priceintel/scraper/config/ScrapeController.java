package com.priceintel.scraper.config;

import com.priceintel.scraper.model.Admission;
import com.priceintel.scraper.model.BudgetStatus;
import com.priceintel.scraper.model.DiscoveryQuota;
import com.priceintel.scraper.model.MatchingJobResult;
import com.priceintel.scraper.model.QuotaConsumption;
import com.priceintel.scraper.service.BudgetLedger;
import com.priceintel.scraper.service.CompetitorUrlService;
import com.priceintel.scraper.service.DiscoveryQuotaService;
import com.priceintel.scraper.service.MatchingRateLimiter;
import com.priceintel.scraper.service.PriceTrackingService;
import com.priceintel.scraper.service.QuickStartMatchingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/scraping")
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final BudgetLedger budgetLedger;
    private final PriceTrackingService trackingService;
    private final QuickStartMatchingService quickStartService;
    private final MatchingRateLimiter rateLimiter;
    private final CompetitorUrlService competitorUrlService;
    private final DiscoveryQuotaService discoveryQuotaService;

    public record AddCompetitorRequest(String userId, String storeId, String competitorId, String storefrontUrl) {}

    public record AddUrlRequest(String userId, String storeId, String productId, String competitorId, String url) {}

    // ── Budget and limits ─────────────────────────────────────────────────────

    @GetMapping("/budget/{userId}")
    public ResponseEntity<?> budget(@PathVariable String userId) {
        return handle("Budget lookup", () -> {
            BudgetStatus s = budgetLedger.getOrCreate(userId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("dailyUsed", s.dailyUsed());
            body.put("dailyLimit", s.dailyLimit());
            body.put("dailyRemaining", s.dailyRemaining());
            body.put("monthlyUsed", s.monthlyUsed());
            body.put("monthlyLimit", s.monthlyLimit());
            body.put("monthlyRemaining", s.monthlyRemaining());
            body.put("canScrape", s.canScrape());
            return ResponseEntity.ok(body);
        });
    }

    @GetMapping("/rate-limit/{userId}")
    public ResponseEntity<?> rateLimit(@PathVariable String userId) {
        return handle("Rate limit lookup", () -> ResponseEntity.ok(rateLimiter.getStatus(userId)));
    }

    // ── Triggers ──────────────────────────────────────────────────────────────

    @PostMapping("/tracking/{userId}/{storeId}")
    public ResponseEntity<Map<String, String>> triggerTracking(@PathVariable String userId,
                                                               @PathVariable String storeId) {
        new Thread(() -> {
            try {
                trackingService.runForStore(userId, storeId);
            } catch (Exception e) {
                log.error("Manual tracking failed for user {} store {}: {}", userId, storeId, e.getMessage(), e);
            }
        }, "manual-tracking-" + storeId).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "storeId", storeId));
    }

    @PostMapping("/competitors")
    public ResponseEntity<?> addCompetitor(@RequestBody AddCompetitorRequest request) {
        return handle("Quick-start matching", () -> {
            MatchingJobResult result = quickStartService.startMatching(
                    request.userId(), request.storeId(), request.competitorId(), request.storefrontUrl());
            return result.isRefused()
                    ? ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(result)
                    : ResponseEntity.ok(result);
        });
    }

    @PostMapping("/links")
    public ResponseEntity<?> addLink(@RequestBody AddUrlRequest request) {
        return handle("Competitor URL add", () -> {
            Admission admission = competitorUrlService.addCompetitorUrl(request.userId(), request.storeId(),
                    request.productId(), request.competitorId(), request.url());
            return admission.allowed()
                    ? ResponseEntity.status(HttpStatus.CREATED).body(admission)
                    : ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(admission);
        });
    }

    // ── Discovery quota ───────────────────────────────────────────────────────

    @GetMapping("/discovery/{storeId}")
    public ResponseEntity<?> discovery(@PathVariable String storeId) {
        return handle("Discovery quota lookup", () -> {
            DiscoveryQuota q = discoveryQuotaService.getOrCreate(storeId);
            return ResponseEntity.ok(Map.of(
                    "used", q.getUsed(),
                    "limit", q.getLimitAmount(),
                    "remaining", q.remaining(),
                    "periodStart", q.getPeriodStart().toString()));
        });
    }

    @PostMapping("/discovery/{storeId}/consume")
    public ResponseEntity<?> consumeDiscovery(@PathVariable String storeId, @RequestParam int amount) {
        return handle("Discovery quota consume", () -> {
            QuotaConsumption c = discoveryQuotaService.consume(storeId, amount);
            return c.allowed()
                    ? ResponseEntity.ok(c)
                    : ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(c);
        });
    }

    // ── Internal ──────────────────────────────────────────────────────────────

    private ResponseEntity<?> handle(String action, Supplier<ResponseEntity<?>> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("{} failed: {}", action, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
