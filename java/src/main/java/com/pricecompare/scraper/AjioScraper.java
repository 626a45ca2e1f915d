package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.model.Vendor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class AjioScraper extends HtmlVendorScraper {

    private static final ProductSelectors SELECTORS = ProductSelectors.builder()
            .card(".item.rilrtl-products-list__item")
            .brand(".brand")
            .title(".name")
            .price(".price strong, .price")
            .originalPrice(".orginal-price")
            .link("a")
            .image("img.rilrtl-lazy-img, img")
            .discount(".discount")
            .build();

    public AjioScraper(WebClient scraperWebClient, ScrapingProperties scrapingProperties) {
        super(scraperWebClient, scrapingProperties);
    }

    @Override
    public Vendor vendor() {
        return Vendor.AJIO;
    }

    @Override
    protected String baseUrl() {
        return "https://www.ajio.com";
    }

    @Override
    protected String searchPath() {
        return "/search/?text={query}";
    }

    @Override
    protected ProductSelectors selectors() {
        return SELECTORS;
    }
}
