package com.shopfront.productservice.security;

import lombok.Getter;

/**
 * Thrown by {@link TokenService#validate} when a bearer token is rejected.
 * HTTP Status: 401 Unauthorized (set in GlobalExceptionHandler)
 */
@Getter
public class TokenValidationException extends RuntimeException {

    private final TokenError error;

    public TokenValidationException(TokenError error, String message) {
        super(message);
        this.error = error;
    }

    public TokenValidationException(TokenError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
