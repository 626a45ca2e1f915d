package com.pricecompare.controller;

import com.pricecompare.model.Vendor;
import com.pricecompare.model.dto.VendorInfo;
import com.pricecompare.scraper.ScraperRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.Arrays;

@RestController
@RequestMapping("/api/vendors")
@RequiredArgsConstructor
public class VendorController {

    private final ScraperRegistry scraperRegistry;

    /**
     * Vendors that have a registered scraper, in canonical order.
     */
    @GetMapping
    public Flux<VendorInfo> listVendors() {
        return Flux.fromStream(Arrays.stream(Vendor.values())
                .filter(scraperRegistry.registeredVendors()::contains)
                .map(VendorInfo::from));
    }
}
