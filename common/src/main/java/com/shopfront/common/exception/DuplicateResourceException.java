package com.shopfront.common.exception;

/**
 * Exception thrown when creating a resource whose unique key is already taken
 * HTTP Status: 409 Conflict
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
