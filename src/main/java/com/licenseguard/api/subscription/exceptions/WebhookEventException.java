package com.licenseguard.api.subscription.exceptions;

/**
 * Thrown by webhook event handlers when a well-formed event can't be applied to the local state,
 * e.g. because it refers to an unknown subscription or user. The provider is expected to deliver
 * the event again later.
 */
public class WebhookEventException extends Exception {

    public WebhookEventException(String message) {
        super(message);
    }

    public WebhookEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
