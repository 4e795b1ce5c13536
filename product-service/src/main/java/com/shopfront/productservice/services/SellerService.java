package com.shopfront.productservice.services;

import com.shopfront.productservice.dto.SellerRequest;
import com.shopfront.productservice.dto.SellerResponse;

public interface SellerService {
    SellerResponse registerSeller(SellerRequest request);
}
