package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.model.Vendor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * eBay search results, card layout with the older list layout as fallback.
 */
@Component
public class EbayScraper extends HtmlVendorScraper {

    private static final ProductSelectors SELECTORS = ProductSelectors.builder()
            .card("li.s-card, li.s-item")
            .title(".s-card__title, .s-item__title")
            .price(".s-card__price, .s-item__price")
            .link("a.s-card__link, a.s-item__link")
            .image("img")
            .build();

    public EbayScraper(WebClient scraperWebClient, ScrapingProperties scrapingProperties) {
        super(scraperWebClient, scrapingProperties);
    }

    @Override
    public Vendor vendor() {
        return Vendor.EBAY;
    }

    @Override
    protected String baseUrl() {
        return "https://www.ebay.com";
    }

    @Override
    protected String searchPath() {
        return "/sch/i.html?_nkw={query}";
    }

    @Override
    protected ProductSelectors selectors() {
        return SELECTORS;
    }

    @Override
    protected String currency() {
        return "USD";
    }
}
