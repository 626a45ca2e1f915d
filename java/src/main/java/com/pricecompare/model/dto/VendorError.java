package com.pricecompare.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pricecompare.model.Vendor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A failed vendor invocation.
 */
@Value
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VendorError {
    Vendor vendor;
    String message;
    String code;
}
