package com.shopfront.productservice.services;

import com.shopfront.productservice.dto.MessageResponse;
import com.shopfront.productservice.dto.ProductDisplayResponse;
import com.shopfront.productservice.dto.ProductRequest;
import com.shopfront.productservice.dto.ProductResponse;

import java.util.List;

public interface ProductService {
    // Read side: display form, never the price
    List<ProductDisplayResponse> getAllProducts();
    ProductDisplayResponse getProductById(Long productId);

    // Write side
    ProductResponse createProduct(ProductRequest request);
    MessageResponse updateProduct(Long productId, ProductRequest request);
    MessageResponse deleteProduct(Long productId);
}
