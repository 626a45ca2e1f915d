package com.pricecompare.model.dto;

import com.pricecompare.model.Vendor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VendorInfo {
    String id;
    String name;
    String color;
    boolean defaultEnabled;

    public static VendorInfo from(Vendor vendor) {
        return VendorInfo.builder()
                .id(vendor.getId())
                .name(vendor.getDisplayName())
                .color(vendor.getColor())
                .defaultEnabled(vendor.isDefaultEnabled())
                .build();
    }
}
