package com.licenseguard.api.subscription;

import com.stripe.Stripe;
import com.stripe.StripeClient;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Event;
import com.stripe.model.Subscription;
import com.stripe.net.Webhook;
import lombok.NonNull;

/**
 * A thin wrapper around {@link Stripe} api to enable easy mocking.
 */
public class StripeApi {

    private final StripeClient client;

    public StripeApi(@NonNull String apiKey) {
        client = new StripeClient(apiKey);
    }

    /**
     * @see Webhook#constructEvent(String, String, String)
     */
    @NonNull
    public Event decodeWebhookPayload(
        @NonNull String payload,
        @NonNull String signature,
        @NonNull String secret
    ) throws SignatureVerificationException {
        return Webhook.constructEvent(payload, signature, secret);
    }

    /**
     * @see com.stripe.service.SubscriptionService#retrieve(String)
     */
    @NonNull
    public Subscription getSubscription(@NonNull String id) throws StripeException {
        return client.subscriptions().retrieve(id);
    }
}
