package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.exception.ScrapeException;
import com.pricecompare.model.dto.ScrapeResult;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for scrapers that fetch a server-rendered search page and read
 * product cards from it with CSS selectors.
 */
@Slf4j
public abstract class HtmlVendorScraper implements VendorScraper {

    private static final int MAX_TITLE_LENGTH = 200;
    private static final Pattern AMOUNT = Pattern.compile("(\\d[\\d,]*(?:\\.\\d+)?)");
    private static final String QUERY_PLACEHOLDER = "{query}";

    private final WebClient webClient;
    private final ScrapingProperties scrapingProperties;

    protected HtmlVendorScraper(WebClient webClient, ScrapingProperties scrapingProperties) {
        this.webClient = webClient;
        this.scrapingProperties = scrapingProperties;
    }

    protected abstract String baseUrl();

    /**
     * Search path relative to {@link #baseUrl()}, containing {@code {query}}
     * where the URL-encoded query goes.
     */
    protected abstract String searchPath();

    protected abstract ProductSelectors selectors();

    protected String currency() {
        return "INR";
    }

    public String buildSearchUrl(String query) {
        String encoded = UriUtils.encode(query, StandardCharsets.UTF_8);
        return baseUrl() + searchPath().replace(QUERY_PLACEHOLDER, encoded);
    }

    @Override
    public Mono<List<ScrapeResult>> scrape(String query) {
        String searchUrl = buildSearchUrl(query);
        log.debug("[{}] Fetching {}", vendor(), searchUrl);

        return webClient.get()
                .uri(URI.create(searchUrl))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> Mono.error(new ScrapeException(
                        vendor(),
                        "Search page returned HTTP " + response.statusCode().value(),
                        String.valueOf(response.statusCode().value()))))
                .bodyToMono(String.class)
                .switchIfEmpty(Mono.error(new ScrapeException(vendor(), "Search page returned an empty body", "EMPTY_BODY")))
                .onErrorMap(WebClientRequestException.class, e -> new ScrapeException(
                        vendor(), "Could not reach " + baseUrl() + ": " + e.getMostSpecificCause().getMessage(), "UNREACHABLE", e))
                .map(html -> parseProducts(Jsoup.parse(html, searchUrl)));
    }

    /**
     * Extract products from a parsed search page, skipping cards without a
     * title, a positive price or a link.
     */
    public List<ScrapeResult> parseProducts(Document document) {
        ProductSelectors selectors = selectors();
        Elements cards = document.select(selectors.getCard());
        int limit = Math.max(1, scrapingProperties.getMaxResultsPerVendor());

        List<ScrapeResult> results = new ArrayList<>();
        for (Element card : cards) {
            if (results.size() >= limit) {
                break;
            }
            toResult(card, selectors).ifPresent(results::add);
        }

        log.debug("[{}] Parsed {} products from {} cards", vendor(), results.size(), cards.size());
        return results;
    }

    private Optional<ScrapeResult> toResult(Element card, ProductSelectors selectors) {
        String title = text(card, selectors.getTitle());
        String brand = text(card, selectors.getBrand());
        if (brand != null && title != null && !title.toLowerCase(Locale.ROOT).startsWith(brand.toLowerCase(Locale.ROOT))) {
            title = brand + " " + title;
        }
        BigDecimal price = parsePrice(text(card, selectors.getPrice()));
        String url = link(card, selectors.getLink());

        if (title == null || price == null || price.signum() <= 0 || url == null) {
            return Optional.empty();
        }

        return Optional.of(ScrapeResult.builder()
                .id(UUID.randomUUID().toString())
                .title(cleanTitle(title))
                .price(price)
                .originalPrice(parsePrice(text(card, selectors.getOriginalPrice())))
                .currency(currency())
                .vendor(vendor())
                .url(url)
                .image(image(card, selectors.getImage()))
                .rating(parseRating(text(card, selectors.getRating())))
                .reviews(parseCount(text(card, selectors.getReviews())))
                .discount(text(card, selectors.getDiscount()))
                .inStock(true)
                .build());
    }

    /**
     * First amount in a price label. For ranges such as "$12.99 to $15.00"
     * this is the lower bound.
     */
    static BigDecimal parsePrice(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = AMOUNT.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return new BigDecimal(matcher.group(1).replace(",", ""));
    }

    static Double parseRating(String text) {
        BigDecimal value = parsePrice(text);
        if (value == null) {
            return null;
        }
        double rating = value.doubleValue();
        return rating >= 0 && rating <= 5 ? rating : null;
    }

    static Integer parseCount(String text) {
        if (text == null) {
            return null;
        }
        String digits = text.replaceAll("[^0-9]", "");
        if (digits.isEmpty() || digits.length() > 9) {
            return null;
        }
        return Integer.valueOf(digits);
    }

    static String cleanTitle(String title) {
        String collapsed = title.replaceAll("\\s+", " ").trim();
        return collapsed.length() > MAX_TITLE_LENGTH ? collapsed.substring(0, MAX_TITLE_LENGTH) : collapsed;
    }

    private static String text(Element card, String selector) {
        if (selector == null) {
            return null;
        }
        Element element = card.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    private static String link(Element card, String selector) {
        Element anchor = selector == null ? card : card.selectFirst(selector);
        if (anchor == null) {
            return null;
        }
        String href = anchor.absUrl("href");
        return href.isEmpty() ? null : href;
    }

    private static String image(Element card, String selector) {
        if (selector == null) {
            return null;
        }
        Element img = card.selectFirst(selector);
        if (img == null) {
            return null;
        }
        for (String attribute : List.of("src", "data-src")) {
            String src = img.absUrl(attribute);
            if (!src.isEmpty() && !src.startsWith("data:")) {
                return src;
            }
        }
        return null;
    }
}
