package com.priceintel.scraper.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.CandidateProduct;
import com.priceintel.scraper.model.ListingScrapeResult;
import com.priceintel.scraper.model.ScrapeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads candidate products from a competitor storefront.
 *
 * Shopify stores expose /products.json for free, so that is tried first without
 * touching the budget. Everything else goes through the budgeted provider and is
 * parsed as an HTML listing, page by page.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CompetitorListingScraper {

    static final int MIN_CARDS = 3;

    private static final List<String> CARD_SELECTORS = List.of(
            "[data-product-id]",
            "[data-product]",
            ".product-item",
            ".product-card",
            ".product",
            ".product-tile",
            ".product-grid-item"
    );

    private static final List<String> NAME_SELECTORS = List.of(
            ".product-title",
            ".product-name",
            ".card-title",
            "h2 a",
            "h3 a",
            "h2",
            "h3",
            "a[title]"
    );

    private static final List<String> CARD_PRICE_SELECTORS = List.of(
            ".price",
            ".product-price",
            "[data-price]",
            "[data-product-price]",
            ".price__current"
    );

    private final BudgetedScrapeService scrapeService;
    private final HttpClient scraperHttpClient;
    private final ObjectMapper objectMapper;
    private final ScraperProperties properties;

    public ListingScrapeResult scrapeListing(String userId, String storefrontUrl) {
        if (isShopify(storefrontUrl)) {
            List<CandidateProduct> shopify = fetchShopifyProducts(storefrontUrl);
            if (!shopify.isEmpty()) {
                log.info("Read {} products from Shopify feed of {}", shopify.size(), storefrontUrl);
                return new ListingScrapeResult(shopify, false, false, null);
            }
        }

        Map<String, CandidateProduct> byUrl = new LinkedHashMap<>();
        int maxPages = Math.max(1, properties.getMatching().getListingMaxPages());

        for (int page = 1; page <= maxPages; page++) {
            String pageUrl = page == 1 ? storefrontUrl : pageUrl(storefrontUrl, page);
            ScrapeResult fetch = scrapeService.scrape(userId, pageUrl);

            if (fetch.configurationError()) {
                return new ListingScrapeResult(new ArrayList<>(byUrl.values()), false, true, fetch.error());
            }
            if (fetch.deferred()) {
                return new ListingScrapeResult(new ArrayList<>(byUrl.values()), true, false, fetch.error());
            }
            if (!fetch.success()) {
                log.warn("Listing page {} of {} could not be fetched: {}", page, storefrontUrl, fetch.error());
                String error = byUrl.isEmpty() ? fetch.error() : null;
                return new ListingScrapeResult(new ArrayList<>(byUrl.values()), false, false, error);
            }

            List<CandidateProduct> found = parseListing(fetch.body(), pageUrl);
            found.forEach(c -> byUrl.putIfAbsent(c.url(), c));
            log.debug("Listing page {} of {} yielded {} products", page, storefrontUrl, found.size());
            if (found.size() < MIN_CARDS) break;
        }

        return new ListingScrapeResult(new ArrayList<>(byUrl.values()), false, false, null);
    }

    /** Parses product cards out of a listing page; URLs are made absolute against {@code baseUrl}. */
    public List<CandidateProduct> parseListing(String html, String baseUrl) {
        Document doc = Jsoup.parse(html, baseUrl);

        Elements cards = new Elements();
        for (String selector : CARD_SELECTORS) {
            Elements hits = doc.select(selector);
            if (hits.size() > MIN_CARDS) {
                cards = hits;
                break;
            }
        }

        Map<String, CandidateProduct> byUrl = new LinkedHashMap<>();
        for (Element card : cards) {
            Element link = card.is("a[href]") ? card : card.selectFirst("a[href]");
            if (link == null) continue;
            String url = link.absUrl("href");
            String name = cardName(card);
            if (url.isBlank() || name.isBlank()) continue;
            byUrl.putIfAbsent(url, CandidateProduct.fromListing(name, url, cardPrice(card)));
        }
        return new ArrayList<>(byUrl.values());
    }

    static boolean isShopify(String storefrontUrl) {
        try {
            URI uri = URI.create(storefrontUrl);
            String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            String path = uri.getPath() == null ? "" : uri.getPath();
            return host.endsWith("myshopify.com") || path.contains("/collections") || path.contains("/products");
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    // ── Shopify ──────────────────────────────────────────────────────────────

    List<CandidateProduct> fetchShopifyProducts(String storefrontUrl) {
        String base = baseOf(storefrontUrl);
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(base + "/products.json?limit=250"))
                    .timeout(properties.getProvider().getTimeout())
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> response = scraperHttpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("Shopify feed of {} returned HTTP {}", base, response.statusCode());
                return List.of();
            }

            List<CandidateProduct> products = new ArrayList<>();
            for (JsonNode p : objectMapper.readTree(response.body()).path("products")) {
                String title = p.path("title").asText("");
                String handle = p.path("handle").asText("");
                if (title.isBlank() || handle.isBlank()) continue;
                JsonNode variant = p.path("variants").path(0);
                String url = base + "/products/" + handle;
                products.add(new CandidateProduct(url, title, emptyToNull(variant.path("sku").asText("")), url,
                        PriceExtractor.parsePrice(variant.path("price").asText(null))));
            }
            return products;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (Exception e) {
            log.debug("Shopify feed unavailable for {}: {}", base, e.getMessage());
            return List.of();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String cardName(Element card) {
        for (String selector : NAME_SELECTORS) {
            Element el = card.selectFirst(selector);
            if (el == null) continue;
            String text = el.text().trim();
            if (text.isEmpty() && el.hasAttr("title")) text = el.attr("title").trim();
            if (!text.isEmpty()) return text;
        }
        return "";
    }

    private BigDecimal cardPrice(Element card) {
        for (String selector : CARD_PRICE_SELECTORS) {
            Element el = card.selectFirst(selector);
            if (el == null) continue;
            String raw = el.hasAttr("data-price") ? el.attr("data-price") : el.text();
            BigDecimal price = PriceExtractor.parsePrice(raw);
            if (price != null) return price;
        }
        return null;
    }

    private static String pageUrl(String storefrontUrl, int page) {
        return UriComponentsBuilder.fromHttpUrl(storefrontUrl)
                .replaceQueryParam("page", page)
                .toUriString();
    }

    private static String baseOf(String storefrontUrl) {
        URI uri = URI.create(storefrontUrl);
        String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
        return uri.getScheme() + "://" + uri.getHost() + port;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
