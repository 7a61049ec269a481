package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Thin client over the paid scraping provider:
 * GET {baseUrl}?api_key=...&url=...&render_js=true|false
 *
 * Only a 2xx response returns a body. Everything else surfaces as a
 * {@link ProviderException}; the caller decides what that costs (nothing).
 * The request timeout cancels the exchange on expiry.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProviderClient {

    private final ScraperProperties properties;
    private final HttpClient scraperHttpClient;
    private final CircuitBreaker scrapingProviderCircuitBreaker;

    public String fetch(String targetUrl, boolean renderJs, Duration timeout) {
        URI uri = buildUri(targetUrl, renderJs);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();

        log.debug("Provider fetch: {} (renderJs={})", targetUrl, renderJs);
        try {
            return scrapingProviderCircuitBreaker.executeCallable(() -> send(request));
        } catch (ProviderException e) {
            throw e;
        } catch (CallNotPermittedException e) {
            throw new ProviderException("Provider circuit breaker is open", e);
        } catch (HttpTimeoutException e) {
            throw new ProviderException("Provider timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Provider call interrupted", e);
        } catch (Exception e) {
            throw new ProviderException("Provider call failed: " + e.getMessage(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    URI buildUri(String targetUrl, boolean renderJs) {
        ScraperProperties.Provider provider = properties.getProvider();
        return UriComponentsBuilder.fromHttpUrl(provider.getBaseUrl())
                .queryParam("api_key", "{apiKey}")
                .queryParam("url", "{url}")
                .queryParam("render_js", renderJs)
                .encode()
                .buildAndExpand(provider.getApiKey(), targetUrl)
                .toUri();
    }

    private String send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = scraperHttpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ProviderException("Provider returned HTTP " + status, status);
        }
        return response.body();
    }
}
