package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.model.Vendor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class NykaaScraper extends HtmlVendorScraper {

    private static final ProductSelectors SELECTORS = ProductSelectors.builder()
            .card(".productWrapper")
            .title("[class*=product-name], .css-xrzmfa")
            .price("[class*=product-price], .css-111z9ua")
            .originalPrice("[class*=strike], .css-17x46n5")
            .link("a")
            .image("img")
            .rating("[class*=rating]")
            .discount("[class*=discount]")
            .build();

    public NykaaScraper(WebClient scraperWebClient, ScrapingProperties scrapingProperties) {
        super(scraperWebClient, scrapingProperties);
    }

    @Override
    public Vendor vendor() {
        return Vendor.NYKAA;
    }

    @Override
    protected String baseUrl() {
        return "https://www.nykaa.com";
    }

    @Override
    protected String searchPath() {
        return "/search/result/?q={query}";
    }

    @Override
    protected ProductSelectors selectors() {
        return SELECTORS;
    }
}
