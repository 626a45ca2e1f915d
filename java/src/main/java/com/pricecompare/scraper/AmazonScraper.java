package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.model.Vendor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Amazon India search results.
 */
@Component
public class AmazonScraper extends HtmlVendorScraper {

    private static final ProductSelectors SELECTORS = ProductSelectors.builder()
            .card("[data-component-type=s-search-result]")
            .title("h2 .a-text-normal, h2 a span, h2 span")
            .price(".a-price:not(.a-text-price) .a-offscreen, .a-price-whole")
            .originalPrice(".a-price.a-text-price .a-offscreen")
            .link("a.a-link-normal.s-no-outline, h2 a")
            .image("img.s-image")
            .rating(".a-icon-alt")
            .reviews("[aria-label$=ratings], .a-size-base.s-underline-text")
            .build();

    public AmazonScraper(WebClient scraperWebClient, ScrapingProperties scrapingProperties) {
        super(scraperWebClient, scrapingProperties);
    }

    @Override
    public Vendor vendor() {
        return Vendor.AMAZON;
    }

    @Override
    protected String baseUrl() {
        return "https://www.amazon.in";
    }

    @Override
    protected String searchPath() {
        return "/s?k={query}";
    }

    @Override
    protected ProductSelectors selectors() {
        return SELECTORS;
    }
}
