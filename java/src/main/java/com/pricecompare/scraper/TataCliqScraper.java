package com.pricecompare.scraper;

import com.pricecompare.config.ScrapingProperties;
import com.pricecompare.model.Vendor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class TataCliqScraper extends HtmlVendorScraper {

    private static final ProductSelectors SELECTORS = ProductSelectors.builder()
            .card("[class*=product-card], [class*=ProductModule]")
            .brand("[class*=ProductBrand], [class*=product-brand]")
            .title("[class*=ProductName], [class*=product-name]")
            .price("[class*=Price], [class*=price]")
            .link("a")
            .image("img")
            .discount("[class*=Discount], [class*=discount]")
            .build();

    public TataCliqScraper(WebClient scraperWebClient, ScrapingProperties scrapingProperties) {
        super(scraperWebClient, scrapingProperties);
    }

    @Override
    public Vendor vendor() {
        return Vendor.TATACLIQ;
    }

    @Override
    protected String baseUrl() {
        return "https://www.tatacliq.com";
    }

    @Override
    protected String searchPath() {
        return "/search/?searchCategory=all&text={query}";
    }

    @Override
    protected ProductSelectors selectors() {
        return SELECTORS;
    }
}
