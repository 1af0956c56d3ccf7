package com.licenseguard.api.subscription.exceptions;

/**
 * Thrown when the billing provider can't be reached while processing an event. The failure is
 * transient, so the provider is expected to deliver the event again later.
 */
public class BillingProviderUnavailableException extends Exception {

    public BillingProviderUnavailableException(String message) {
        super(message);
    }

    public BillingProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
