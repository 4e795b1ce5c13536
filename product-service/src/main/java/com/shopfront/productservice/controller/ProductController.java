package com.shopfront.productservice.controller;

import com.shopfront.productservice.dto.MessageResponse;
import com.shopfront.productservice.dto.ProductDisplayResponse;
import com.shopfront.productservice.dto.ProductRequest;
import com.shopfront.productservice.dto.ProductResponse;
import com.shopfront.productservice.services.ProductService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Tag(name = "Products")
public class ProductController {

    private final ProductService productService;

    // List all products, display form
    @GetMapping("/products")
    public ResponseEntity<List<ProductDisplayResponse>> getAllProducts() {
        return ResponseEntity.ok(productService.getAllProducts());
    }

    // Get a single product, display form
    @GetMapping("/product/{id}")
    public ResponseEntity<ProductDisplayResponse> getProductById(@PathVariable Long id) {
        return ResponseEntity.ok(productService.getProductById(id));
    }

    // Create a product; the response is the full record including price
    @PostMapping("/product")
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody ProductRequest request) {
        ProductResponse createdProduct = productService.createProduct(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(createdProduct);
    }

    @PutMapping("/product/{id}")
    public ResponseEntity<MessageResponse> updateProduct(
            @PathVariable Long id,
            @Valid @RequestBody ProductRequest request) {
        return ResponseEntity.ok(productService.updateProduct(id, request));
    }

    @DeleteMapping("/product/{id}")
    public ResponseEntity<MessageResponse> deleteProduct(@PathVariable Long id) {
        return ResponseEntity.ok(productService.deleteProduct(id));
    }
}
