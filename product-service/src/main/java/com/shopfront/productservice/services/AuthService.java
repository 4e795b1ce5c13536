package com.shopfront.productservice.services;

import com.shopfront.productservice.dto.LoginRequest;
import com.shopfront.productservice.dto.TokenResponse;

public interface AuthService {
    TokenResponse login(LoginRequest request);
}
