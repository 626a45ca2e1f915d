package com.pricecompare.controller;

import com.pricecompare.model.dto.ComparisonResponse;
import com.pricecompare.model.dto.SearchRequest;
import com.pricecompare.model.dto.SearchResponse;
import com.pricecompare.service.ProductComparisonService;
import com.pricecompare.service.SearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Controller for multi-vendor product search.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SearchController {

    private final SearchService searchService;
    private final ProductComparisonService comparisonService;

    /**
     * GET /api/search?q=...&amp;vendors=amazon,flipkart
     */
    @GetMapping("/search")
    public Mono<SearchResponse> search(@Valid @ModelAttribute SearchRequest request) {
        return searchService.search(request.trimmedQuery(), request.vendorSelection());
    }

    @GetMapping("/compare")
    public Mono<ComparisonResponse> compare(@Valid @ModelAttribute SearchRequest request) {
        return comparisonService.compare(request.trimmedQuery(), request.vendorSelection());
    }
}
