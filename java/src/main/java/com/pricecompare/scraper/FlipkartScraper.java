package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.model.Vendor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Flipkart search results. Class names are obfuscated and rotate between
 * deployments, so each field lists the known variants.
 */
@Component
public class FlipkartScraper extends HtmlVendorScraper {

    private static final ProductSelectors SELECTORS = ProductSelectors.builder()
            .card("div[data-id]")
            .title("._4rR01T, .s1Q9rs, .KzDlHZ, .wjcEIp, a[title]")
            .price("._30jeq3, .Nx9bqj, .hZ3P6w")
            .originalPrice("._3I9_wc, .yRaY8j")
            .link("a[href*=/p/]")
            .image("img")
            .rating("._3LWZlK, .XQDdHH")
            .discount("._3Ay6Sb, .UkUFwK")
            .build();

    public FlipkartScraper(WebClient scraperWebClient, ScrapingProperties scrapingProperties) {
        super(scraperWebClient, scrapingProperties);
    }

    @Override
    public Vendor vendor() {
        return Vendor.FLIPKART;
    }

    @Override
    protected String baseUrl() {
        return "https://www.flipkart.com";
    }

    @Override
    protected String searchPath() {
        return "/search?q={query}";
    }

    @Override
    protected ProductSelectors selectors() {
        return SELECTORS;
    }
}
