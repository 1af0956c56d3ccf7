package com.licenseguard.api.identity.exceptions;

/**
 * Thrown when a lease token is malformed, tampered, expired or issued for a different device.
 */
public class LeaseTokenVerificationException extends Exception {

    public LeaseTokenVerificationException(String message) {
        super(message);
    }

    public LeaseTokenVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
