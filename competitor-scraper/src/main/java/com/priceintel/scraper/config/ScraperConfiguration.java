package com.priceintel.scraper.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class ScraperConfiguration {

    /** Every period boundary (today, first of month, next day start) is computed in UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient scraperHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Breaker around the paid provider, configured under
     * resilience4j.circuitbreaker.instances.scrapingProvider.
     * An open breaker fails calls fast; they are recorded as fetch failures and never charged.
     */
    @Bean
    public CircuitBreaker scrapingProviderCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("scrapingProvider");
    }
}
