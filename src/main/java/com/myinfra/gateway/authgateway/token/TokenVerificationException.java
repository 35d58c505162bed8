package com.myinfra.gateway.authgateway.token;

/**
 * Thrown when a bearer token fails verification.
 */
public class TokenVerificationException extends RuntimeException {

    public TokenVerificationException(String message) {
        super(message);
    }

    public TokenVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
