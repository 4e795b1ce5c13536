package com.shopfront.productservice.exception;

/**
 * Exception thrown when a login names an unknown seller or the password does not match.
 * HTTP Status: 404 Not Found. Existing clients depend on the 404 and on the
 * two distinct messages ("Invalid user" / "Invalid password").
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
