package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.exception.ScrapeException;
import com.pricecompare.model.Vendor;
import com.pricecompare.model.dto.ScrapeResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for HtmlVendorScraper parsing and HTTP handling.
 */
class HtmlVendorScraperTest {

    private ScrapingProperties properties;
    private WebClient unusedClient;

    @BeforeEach
    void setUp() {
        properties = new ScrapingProperties();
        unusedClient = WebClient.builder().build();
    }

    @Test
    void parseProducts_Amazon_ExtractsValidCards() throws IOException {
        AmazonScraper scraper = new AmazonScraper(unusedClient, properties);
        Document document = Jsoup.parse(fixture("amazon-search.html"), "https://www.amazon.in/s?k=wireless%20mouse");

        List<ScrapeResult> results = scraper.parseProducts(document);

        assertThat(results).hasSize(2);
        ScrapeResult first = results.get(0);
        assertThat(first.getTitle()).isEqualTo("Logitech M185 Wireless Mouse");
        assertThat(first.getPrice()).isEqualByComparingTo("1299.00");
        assertThat(first.getOriginalPrice()).isEqualByComparingTo("1795.00");
        assertThat(first.getUrl()).isEqualTo("https://www.amazon.in/Logitech-M185-Wireless-Mouse/dp/B004IO5BMQ");
        assertThat(first.getImage()).isEqualTo("https://m.media-amazon.com/images/I/m185.jpg");
        assertThat(first.getRating()).isEqualTo(4.4);
        assertThat(first.getReviews()).isEqualTo(61234);
        assertThat(first.getVendor()).isEqualTo(Vendor.AMAZON);
        assertThat(first.getCurrency()).isEqualTo("INR");
        assertThat(first.getId()).isNotBlank();

        assertThat(results.get(1).getPrice()).isEqualByComparingTo("549");
        assertThat(results.get(1).getOriginalPrice()).isNull();
    }

    @Test
    void parseProducts_Ebay_UsesLowerBoundOfPriceRange() throws IOException {
        EbayScraper scraper = new EbayScraper(unusedClient, properties);
        Document document = Jsoup.parse(fixture("ebay-search.html"), "https://www.ebay.com/sch/i.html");

        List<ScrapeResult> results = scraper.parseProducts(document);

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.getPrice()).isEqualByComparingTo("34.50");
            assertThat(result.getCurrency()).isEqualTo("USD");
            assertThat(result.getVendor()).isEqualTo(Vendor.EBAY);
        });
    }

    @Test
    void parseProducts_StopsAtMaxResultsPerVendor() throws IOException {
        properties.setMaxResultsPerVendor(1);
        AmazonScraper scraper = new AmazonScraper(unusedClient, properties);

        List<ScrapeResult> results = scraper.parseProducts(
                Jsoup.parse(fixture("amazon-search.html"), "https://www.amazon.in/"));

        assertThat(results).hasSize(1);
    }

    @Test
    void parseProducts_BrandPrefixCheckIgnoresDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            MyntraScraper scraper = new MyntraScraper(unusedClient, properties);
            Document document = Jsoup.parse("""
                    <ul>
                      <li class="product-base">
                        <a href="/shirts/indigo/123"><img src="https://img.myntra.com/123.jpg"></a>
                        <h3 class="product-brand">INDIGO</h3>
                        <h4 class="product-product">Indigo Slim Fit Shirt</h4>
                        <span class="product-discountedPrice">Rs. 899</span>
                      </li>
                    </ul>
                    """, "https://www.myntra.com/shirt");

            List<ScrapeResult> results = scraper.parseProducts(document);

            assertThat(results).singleElement().satisfies(result -> {
                assertThat(result.getTitle()).isEqualTo("Indigo Slim Fit Shirt");
                assertThat(result.getPrice()).isEqualByComparingTo("899");
                assertThat(result.getUrl()).isEqualTo("https://www.myntra.com/shirts/indigo/123");
            });
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void parsePrice_HandlesCurrencyLabels() {
        assertThat(HtmlVendorScraper.parsePrice("Rs. 499")).isEqualByComparingTo("499");
        assertThat(HtmlVendorScraper.parsePrice("₹12,999")).isEqualByComparingTo("12999");
        assertThat(HtmlVendorScraper.parsePrice("$12.99 to $15.00")).isEqualByComparingTo("12.99");
        assertThat(HtmlVendorScraper.parsePrice("Out of stock")).isNull();
        assertThat(HtmlVendorScraper.parsePrice(null)).isNull();
    }

    @Test
    void cleanTitle_CollapsesWhitespaceAndTruncates() {
        assertThat(HtmlVendorScraper.cleanTitle("  a \n b  ")).isEqualTo("a b");
        assertThat(HtmlVendorScraper.cleanTitle("x".repeat(250))).hasSize(200);
    }

    @Test
    void buildSearchUrl_EncodesQuery() {
        MyntraScraper myntra = new MyntraScraper(unusedClient, properties);
        CromaScraper croma = new CromaScraper(unusedClient, properties);

        assertThat(myntra.buildSearchUrl("running shoes")).isEqualTo("https://www.myntra.com/running%20shoes");
        assertThat(croma.buildSearchUrl("tv & audio"))
                .isEqualTo("https://www.croma.com/searchB?q=tv%20%26%20audio%3Arelevance");
    }

    @Test
    void scrape_FetchesAndParsesSearchPage() throws IOException {
        String html = fixture("ebay-search.html");
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient client = WebClient.builder()
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, "text/html; charset=utf-8")
                            .body(html)
                            .build());
                })
                .build();

        StepVerifier.create(new EbayScraper(client, properties).scrape("wireless mouse"))
                .assertNext(results -> assertThat(results).extracting(ScrapeResult::getPrice)
                        .containsExactly(new BigDecimal("34.50")))
                .verifyComplete();

        assertThat(captured.get().url().toString())
                .isEqualTo("https://www.ebay.com/sch/i.html?_nkw=wireless%20mouse");
    }

    @Test
    void scrape_ErrorStatus_FailsWithStatusCode() {
        WebClient client = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()))
                .build();

        StepVerifier.create(new FlipkartScraper(client, properties).scrape("mouse"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ScrapeException.class);
                    ScrapeException scrapeException = (ScrapeException) error;
                    assertThat(scrapeException.getVendor()).isEqualTo(Vendor.FLIPKART);
                    assertThat(scrapeException.getCode()).isEqualTo("503");
                    assertThat(scrapeException.getMessage()).contains("503");
                })
                .verify();
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = HtmlVendorScraperTest.class.getResourceAsStream("/html/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
