package com.shopfront.productservice.controller;

import com.shopfront.productservice.dto.SellerRequest;
import com.shopfront.productservice.dto.SellerResponse;
import com.shopfront.productservice.services.SellerService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Seller")
public class SellerController {

    private final SellerService sellerService;

    // Registration answers 200 with the stored record, not 201
    @PostMapping("/seller")
    public ResponseEntity<SellerResponse> createSeller(@Valid @RequestBody SellerRequest request) {
        return ResponseEntity.ok(sellerService.registerSeller(request));
    }
}
