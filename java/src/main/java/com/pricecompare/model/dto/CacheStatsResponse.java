package com.pricecompare.model.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CacheStatsResponse {
    long size;
    List<String> keys;
    long hitCount;
    long missCount;
}
