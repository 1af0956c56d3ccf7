package com.licenseguard.api.subscription.exceptions;

/**
 * Thrown by webhook event handlers when the event could not be verified or parsed correctly.
 */
public class WebhookPayloadException extends Exception {

    public WebhookPayloadException(String message) {
        super(message);
    }

    public WebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
