package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.BudgetStatus;
import com.priceintel.scraper.model.ScrapeBudget;
import com.priceintel.scraper.support.InMemoryBudgetStore;
import com.priceintel.scraper.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BudgetLedgerTest {

    private static final String USER = "user-1";

    private final InMemoryBudgetStore store = new InMemoryBudgetStore();
    private final MutableClock clock = MutableClock.at("2024-05-10T12:00:00Z");
    private ScraperProperties properties;
    private BudgetLedger ledger;

    @BeforeEach
    void setUp() {
        properties = new ScraperProperties();
        ledger = new BudgetLedger(store, properties, clock);
    }

    @Test
    void limitsDerivedFromCostModel() {
        BudgetStatus status = ledger.getOrCreate(USER);

        assertThat(status.monthlyLimit()).isEqualTo(20000);
        assertThat(status.dailyLimit()).isEqualTo(666);
        assertThat(status.dailyUsed()).isZero();
        assertThat(status.canScrape()).isTrue();
        assertThat(store.row(USER).getMonthPeriodStart()).isEqualTo(LocalDate.of(2024, 5, 1));
    }

    @Test
    void staleDay_resetsDailyButKeepsMonthly() {
        store.put(new ScrapeBudget(USER, 40, LocalDate.of(2024, 5, 9), 300, LocalDate.of(2024, 5, 1)));

        BudgetStatus status = ledger.getOrCreate(USER);

        assertThat(status.dailyUsed()).isZero();
        assertThat(status.monthlyUsed()).isEqualTo(300);
        assertThat(store.row(USER).getDailyDate()).isEqualTo(LocalDate.of(2024, 5, 10));
        assertThat(store.row(USER).getDailyUsed()).isZero();
    }

    @Test
    void staleMonth_resetsBothCounters() {
        store.put(new ScrapeBudget(USER, 40, LocalDate.of(2024, 4, 30), 9000, LocalDate.of(2024, 4, 1)));

        BudgetStatus status = ledger.getOrCreate(USER);

        assertThat(status.dailyUsed()).isZero();
        assertThat(status.monthlyUsed()).isZero();
        assertThat(store.row(USER).getMonthPeriodStart()).isEqualTo(LocalDate.of(2024, 5, 1));
    }

    @Test
    void incrementIsAdditive() {
        int before = ledger.getOrCreate(USER).dailyUsed();

        ledger.increment(USER, 3);
        BudgetStatus after = ledger.increment(USER, 2);

        assertThat(after.dailyUsed()).isEqualTo(before + 5);
        assertThat(after.monthlyUsed()).isEqualTo(5);
    }

    @Test
    void canScrape_checksCostAgainstBothLimits() {
        store.put(new ScrapeBudget(USER, 665, LocalDate.of(2024, 5, 10), 665, LocalDate.of(2024, 5, 1)));

        assertThat(ledger.canScrape(USER, 1)).isTrue();
        assertThat(ledger.canScrape(USER, 2)).isFalse();

        store.put(new ScrapeBudget(USER, 0, LocalDate.of(2024, 5, 10), 20000, LocalDate.of(2024, 5, 1)));
        assertThat(ledger.canScrape(USER, 1)).isFalse();
    }

    @Test
    void storeFailure_failOpenByDefault() {
        store.setFailing(true);

        BudgetStatus status = ledger.getOrCreate(USER);

        assertThat(status.storeAvailable()).isFalse();
        assertThat(status.canScrape()).isTrue();
        assertThat(ledger.canScrape(USER, 1)).isTrue();
    }

    @Test
    void storeFailure_failClosedWhenConfigured() {
        properties.getBudget().setFailOpen(false);
        store.setFailing(true);

        assertThat(ledger.canScrape(USER, 1)).isFalse();
        assertThat(ledger.increment(USER, 1).canScrape()).isFalse();
    }

    @Test
    void negativeCostRejected() {
        assertThatThrownBy(() -> ledger.increment(USER, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
