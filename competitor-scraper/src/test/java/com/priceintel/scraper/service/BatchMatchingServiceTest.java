package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.CandidateProduct;
import com.priceintel.scraper.model.CompetitorProductLink;
import com.priceintel.scraper.model.DiscoveryQuota;
import com.priceintel.scraper.model.ListingScrapeResult;
import com.priceintel.scraper.model.LocalProduct;
import com.priceintel.scraper.model.MatchingJobResult;
import com.priceintel.scraper.model.ScrapeBudget;
import com.priceintel.scraper.model.ScrapeJob;
import com.priceintel.scraper.support.FixedPlanDirectory;
import com.priceintel.scraper.support.InMemoryBudgetStore;
import com.priceintel.scraper.support.InMemoryDiscoveryQuotaStore;
import com.priceintel.scraper.support.InMemoryJobStore;
import com.priceintel.scraper.support.InMemoryLinkStore;
import com.priceintel.scraper.support.InMemoryProductCatalog;
import com.priceintel.scraper.support.InMemoryRateLimitStore;
import com.priceintel.scraper.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchMatchingServiceTest {

    private static final String USER = "user-1";
    private static final String STORE = "store-1";
    private static final String RIVAL = "rival";
    private static final String STOREFRONT = "https://rival.example";

    @Mock
    CompetitorListingScraper listingScraper;

    private final MutableClock clock = MutableClock.at("2024-05-10T09:00:00Z");
    private final InMemoryProductCatalog catalog = new InMemoryProductCatalog();
    private final InMemoryLinkStore linkStore = new InMemoryLinkStore();
    private final InMemoryJobStore jobStore = new InMemoryJobStore();
    private final InMemoryBudgetStore budgetStore = new InMemoryBudgetStore();
    private final InMemoryDiscoveryQuotaStore quotaStore = new InMemoryDiscoveryQuotaStore();

    private MatchingRateLimiter rateLimiter;
    private DiscoveryQuotaService discoveryQuota;
    private BatchMatchingService service;

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        rateLimiter = new MatchingRateLimiter(new InMemoryRateLimitStore(), properties, clock);
        MatchingPipeline pipeline = new MatchingPipeline(catalog, linkStore, new ProductMatcher(properties), properties);
        FixedPlanDirectory plans = new FixedPlanDirectory().user(USER, "pro").store(STORE, USER, "pro");
        discoveryQuota = new DiscoveryQuotaService(quotaStore, new PlanEntitlements(properties, plans, clock), clock);
        service = new BatchMatchingService(rateLimiter, new BudgetLedger(budgetStore, properties, clock),
                discoveryQuota, listingScraper, pipeline, jobStore, properties, clock);

        IntStream.rangeClosed(1, 100).forEach(i ->
                catalog.add(STORE, new LocalProduct("p" + i, "Gadget" + i, null)));
    }

    @Test
    void offsetSkipsQuickStartHead() {
        assertThat(service.offsetOf(batch(2))).isEqualTo(30);
        assertThat(service.offsetOf(batch(3))).isEqualTo(55);
        assertThat(service.offsetOf(batch(4))).isEqualTo(80);
    }

    @Test
    void matchesItsSliceAndRecordsHeavyRun() {
        when(listingScraper.scrapeListing(USER, STOREFRONT)).thenReturn(listing(31, 40));
        ScrapeJob job = claimed(batch(2));

        MatchingJobResult result = service.processJob(job);

        assertThat(result.getProductsMatched()).isEqualTo(10);
        assertThat(linkStore.forCompetitor(RIVAL)).extracting(CompetitorProductLink::getProductId)
                .allMatch(id -> Integer.parseInt(id.substring(1)) > 30);
        assertThat(rateLimiter.canRunHeavyMatching(USER)).isFalse();

        ScrapeJob done = jobStore.get(job.getId());
        assertThat(done.getStatus()).isEqualTo(ScrapeJob.JobStatus.COMPLETED);
        assertThat(done.getItemsProcessed()).isEqualTo(25);
        assertThat(discoveryQuota.getOrCreate(STORE).getUsed()).isEqualTo(10);
    }

    @Test
    void exhaustedDiscoveryQuotaFailsBatchWithoutScraping() {
        quotaStore.put(DiscoveryQuota.builder()
                .storeId(STORE).periodStart(LocalDate.of(2024, 5, 1)).limitAmount(6000).used(6000)
                .build());
        ScrapeJob job = claimed(batch(2));

        MatchingJobResult result = service.processJob(job);

        assertThat(result.getRefusal()).isEqualTo(QuickStartMatchingService.DISCOVERY_QUOTA_EXHAUSTED);
        verify(listingScraper, never()).scrapeListing(anyString(), anyString());
        assertThat(jobStore.get(job.getId()).getStatus()).isEqualTo(ScrapeJob.JobStatus.FAILED);
        assertThat(jobStore.withStatus(ScrapeJob.JobStatus.PENDING)).isEmpty();
    }

    @Test
    void candidatesBeyondRemainingQuotaAreNotLinked() {
        quotaStore.put(DiscoveryQuota.builder()
                .storeId(STORE).periodStart(LocalDate.of(2024, 5, 1)).limitAmount(6000).used(5995)
                .build());
        when(listingScraper.scrapeListing(USER, STOREFRONT)).thenReturn(listing(31, 40));
        ScrapeJob job = claimed(batch(2));

        service.processJob(job);

        assertThat(linkStore.forCompetitor(RIVAL)).isEmpty();
        assertThat(jobStore.get(job.getId()).getStatus()).isEqualTo(ScrapeJob.JobStatus.FAILED);
        assertThat(rateLimiter.canRunHeavyMatching(USER)).isTrue();
        assertThat(discoveryQuota.getOrCreate(STORE).getUsed()).isEqualTo(5995);
    }

    @Test
    void secondBatchSameDayIsDeferredToNextDay() {
        rateLimiter.recordHeavyMatching(USER);
        ScrapeJob job = claimed(batch(3));

        MatchingJobResult result = service.processJob(job);

        assertThat(result.isRefused()).isTrue();
        verify(listingScraper, never()).scrapeListing(anyString(), anyString());
        assertThat(jobStore.get(job.getId()).getStatus()).isEqualTo(ScrapeJob.JobStatus.DEFERRED);

        List<ScrapeJob> requeued = jobStore.withStatus(ScrapeJob.JobStatus.PENDING);
        assertThat(requeued).singleElement().satisfies(copy -> {
            assertThat(copy.getBatchNumber()).isEqualTo(3);
            assertThat(copy.getScheduledFor()).isEqualTo(Instant.parse("2024-05-11T00:00:00Z"));
            assertThat(copy.getId()).isNotEqualTo(job.getId());
        });
    }

    @Test
    void exhaustedBudgetDefersWithoutScraping() {
        budgetStore.put(new ScrapeBudget(USER, 666, LocalDate.of(2024, 5, 10), 666, LocalDate.of(2024, 5, 1)));
        ScrapeJob job = claimed(batch(2));

        MatchingJobResult result = service.processJob(job);

        assertThat(result.isBudgetExhausted()).isTrue();
        verify(listingScraper, never()).scrapeListing(anyString(), anyString());
        assertThat(jobStore.withStatus(ScrapeJob.JobStatus.PENDING)).hasSize(1);
        assertThat(rateLimiter.canRunHeavyMatching(USER)).isTrue();
    }

    @Test
    void sliceBeyondCatalogCompletesWithoutScraping() {
        ScrapeJob job = claimed(batch(6));

        service.processJob(job);

        assertThat(jobStore.get(job.getId()).getStatus()).isEqualTo(ScrapeJob.JobStatus.COMPLETED);
        verify(listingScraper, never()).scrapeListing(anyString(), anyString());
    }

    @Test
    void configurationErrorFailsTheJob() {
        when(listingScraper.scrapeListing(USER, STOREFRONT))
                .thenReturn(new ListingScrapeResult(List.of(), false, true, "Scraping provider not configured"));
        ScrapeJob job = claimed(batch(2));

        service.processJob(job);

        ScrapeJob failed = jobStore.get(job.getId());
        assertThat(failed.getStatus()).isEqualTo(ScrapeJob.JobStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("Scraping provider not configured");
        assertThat(jobStore.withStatus(ScrapeJob.JobStatus.PENDING)).isEmpty();
    }

    private ScrapeJob batch(int number) {
        return ScrapeJob.builder()
                .userId(USER)
                .storeId(STORE)
                .competitorId(RIVAL)
                .targetUrl(STOREFRONT)
                .jobType(ScrapeJob.JobType.MATCHING)
                .batchNumber(number)
                .totalBatches(4)
                .scheduledFor(clock.instant())
                .build();
    }

    private ScrapeJob claimed(ScrapeJob job) {
        String id = jobStore.insert(job);
        jobStore.claim(id, clock.instant());
        return jobStore.get(id);
    }

    private static ListingScrapeResult listing(int from, int to) {
        List<CandidateProduct> candidates = IntStream.rangeClosed(from, to)
                .mapToObj(i -> CandidateProduct.fromListing("Gadget" + i,
                        STOREFRONT + "/products/gadget-" + i, null))
                .toList();
        return new ListingScrapeResult(candidates, false, false, null);
    }
}
