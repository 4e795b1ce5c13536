package com.shopfront.common.exception;

/**
 * Exception thrown when a requested resource (Product, Seller) does not exist
 * HTTP Status: 404 Not Found (set in GlobalExceptionHandler)
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
