package com.pricecompare.scraper;

import lombok.Builder;
import lombok.Value;

/**
 * CSS selectors locating product fields on a vendor's search result page.
 * All but {@code card}, {@code title} and {@code price} are optional.
 */
@Value
@Builder
public class ProductSelectors {
    String card;
    String title;
    String brand;
    String price;
    String originalPrice;
    /** When absent the card itself must be the product link. */
    String link;
    String image;
    String rating;
    String reviews;
    String discount;
}
