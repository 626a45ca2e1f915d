package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.model.Vendor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class CromaScraper extends HtmlVendorScraper {

    private static final ProductSelectors SELECTORS = ProductSelectors.builder()
            .card("li.product-item, .product-item")
            .title(".product-title")
            .price(".new-price .amount, .amount")
            .originalPrice(".old-price .amount")
            .link(".product-title a, a")
            .image("img")
            .build();

    public CromaScraper(WebClient scraperWebClient, ScrapingProperties scrapingProperties) {
        super(scraperWebClient, scrapingProperties);
    }

    @Override
    public Vendor vendor() {
        return Vendor.CROMA;
    }

    @Override
    protected String baseUrl() {
        return "https://www.croma.com";
    }

    @Override
    protected String searchPath() {
        return "/searchB?q={query}%3Arelevance";
    }

    @Override
    protected ProductSelectors selectors() {
        return SELECTORS;
    }
}
