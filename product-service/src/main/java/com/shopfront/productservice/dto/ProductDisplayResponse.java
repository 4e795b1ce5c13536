package com.shopfront.productservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-side product representation. Never carries the price; the seller
 * summary is left out entirely when the product has no seller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProductDisplayResponse {
    private String name;
    private String description;
    private SellerDisplayResponse seller;
}
