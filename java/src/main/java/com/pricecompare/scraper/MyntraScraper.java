package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.model.Vendor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class MyntraScraper extends HtmlVendorScraper {

    private static final ProductSelectors SELECTORS = ProductSelectors.builder()
            .card("li.product-base")
            .brand(".product-brand")
            .title(".product-product")
            .price(".product-discountedPrice, .product-price")
            .originalPrice(".product-strike")
            .link("a")
            .image("img.img-responsive, img")
            .rating(".product-ratingsContainer span")
            .discount(".product-discountPercentage")
            .build();

    public MyntraScraper(WebClient scraperWebClient, ScrapingProperties scrapingProperties) {
        super(scraperWebClient, scrapingProperties);
    }

    @Override
    public Vendor vendor() {
        return Vendor.MYNTRA;
    }

    @Override
    protected String baseUrl() {
        return "https://www.myntra.com";
    }

    @Override
    protected String searchPath() {
        return "/{query}";
    }

    @Override
    protected ProductSelectors selectors() {
        return SELECTORS;
    }
}
