package com.licenseguard.api.subscription.models;

/**
 * Local status of a subscription.
 */
public enum SubscriptionStatus {
    TRIAL,
    ACTIVE,
    EXPIRED;

    /**
     * Maps a Stripe subscription status to the local status. Only {@code active} and
     * {@code trialing} grant access.
     */
    public static SubscriptionStatus fromStripeStatus(String stripeStatus) {
        if ("active".equals(stripeStatus) || "trialing".equals(stripeStatus)) {
            return ACTIVE;
        }

        return EXPIRED;
    }
}
