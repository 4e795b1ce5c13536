package com.shopfront.productservice.security;

public enum TokenError {
    /** Not a parseable JWS, bad signature, or no subject. */
    MALFORMED,
    /** Signature is valid but {@code exp} is not after the validation instant. */
    EXPIRED
}
