package com.priceintel.scraper.service;

import com.priceintel.scraper.model.ExtractedPrice;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Pulls price, currency and availability out of a product page.
 *
 * Selectors run from most structured (microdata, Open Graph) to plain class-name
 * guesses; the first one that yields a parseable number wins.
 */
@Component
@Slf4j
public class PriceExtractor {

    static final String DEFAULT_CURRENCY = "USD";

    private static final List<String> PRICE_SELECTORS = List.of(
            "[itemprop=price]",
            "meta[property=product:price:amount]",
            "meta[property=og:price:amount]",
            "[data-price]",
            "[data-product-price]",
            ".price__current",
            ".product-price",
            ".price",
            "[class*=price]",
            "[class*=Price]"
    );

    private static final List<String> CURRENCY_SELECTORS = List.of(
            "[itemprop=priceCurrency]",
            "meta[property=product:price:currency]",
            "meta[property=og:price:currency]"
    );

    private static final List<String> OUT_OF_STOCK_PHRASES = List.of(
            "out of stock",
            "sold out",
            "unavailable",
            "not available",
            "vyprodáno",
            "nedostupné"
    );

    public ExtractedPrice extract(String html) {
        if (html == null || html.isBlank()) {
            return new ExtractedPrice(null, DEFAULT_CURRENCY, true);
        }
        Document doc = Jsoup.parse(html);
        return new ExtractedPrice(findPrice(doc), findCurrency(doc), isAvailable(doc));
    }

    /**
     * Parses a display price in either {@code 1,234.56} or {@code 1.234,56} style.
     * With both separators present the later one is the decimal point; a lone comma
     * is a decimal comma. Returns null for negative or non-numeric input.
     */
    public static BigDecimal parsePrice(String text) {
        if (text == null) return null;

        String cleaned = text.replaceAll("[^0-9.,\\-]", "");
        if (cleaned.isEmpty()) return null;

        int lastComma = cleaned.lastIndexOf(',');
        int lastDot = cleaned.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            cleaned = lastComma > lastDot
                    ? cleaned.replace(".", "").replace(',', '.')
                    : cleaned.replace(",", "");
        } else if (lastComma >= 0) {
            cleaned = cleaned.replace(',', '.');
        } else {
            cleaned = cleaned.replace(",", "");
        }

        try {
            BigDecimal value = new BigDecimal(cleaned);
            return value.signum() < 0 ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private BigDecimal findPrice(Document doc) {
        for (String selector : PRICE_SELECTORS) {
            for (Element el : doc.select(selector)) {
                BigDecimal price = parsePrice(rawValue(el));
                if (price != null) {
                    log.debug("Price {} found via selector {}", price, selector);
                    return price;
                }
            }
        }
        return null;
    }

    private String findCurrency(Document doc) {
        for (String selector : CURRENCY_SELECTORS) {
            Element el = doc.selectFirst(selector);
            if (el == null) continue;
            String value = rawValue(el).trim();
            if (!value.isEmpty()) {
                return value.toUpperCase(Locale.ROOT);
            }
        }
        return DEFAULT_CURRENCY;
    }

    private boolean isAvailable(Document doc) {
        String text = doc.text().toLowerCase(Locale.ROOT);
        return OUT_OF_STOCK_PHRASES.stream().noneMatch(text::contains);
    }

    private String rawValue(Element el) {
        if (el.hasAttr("content")) return el.attr("content");
        if (el.hasAttr("data-price")) return el.attr("data-price");
        return el.text();
    }
}
