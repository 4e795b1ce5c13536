package com.shopfront.productservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Full seller record as stored, returned by registration. {@code password}
 * is the bcrypt hash, kept in the body for compatibility with existing clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SellerResponse {
    private Long id;
    private String username;
    private String email;
    private String password;
}
