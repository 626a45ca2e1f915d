package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.model.Vendor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class SnapdealScraper extends HtmlVendorScraper {

    private static final ProductSelectors SELECTORS = ProductSelectors.builder()
            .card(".product-tuple-listing")
            .title(".product-title")
            .price(".lfloat.product-price")
            .originalPrice(".lfloat.product-desc-price")
            .link("a.dp-widget-link")
            .image(".product-image img, img")
            .discount(".product-discount")
            .build();

    public SnapdealScraper(WebClient scraperWebClient, ScrapingProperties scrapingProperties) {
        super(scraperWebClient, scrapingProperties);
    }

    @Override
    public Vendor vendor() {
        return Vendor.SNAPDEAL;
    }

    @Override
    protected String baseUrl() {
        return "https://www.snapdeal.com";
    }

    @Override
    protected String searchPath() {
        return "/search?keyword={query}";
    }

    @Override
    protected ProductSelectors selectors() {
        return SELECTORS;
    }
}
