package com.pricecompare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * PriceCompare Server Application
 *
 * Multi-vendor price comparison API built with Spring Boot WebFlux.
 * Searches all selected vendors concurrently and merges their offers
 * into a single price-sorted result set.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PriceCompareApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceCompareApplication.class, args);
    }

}
