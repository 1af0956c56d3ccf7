package com.licenseguard.api.subscription.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * State of a subscription as reported by the billing provider, carried by a billing event.
 */
@Value
@Builder
public class SubscriptionSnapshot {

    @NonNull
    String stripeSubscriptionId;

    String stripeCustomerId;

    /**
     * Raw provider status, e.g. {@code active}, {@code trialing}, {@code past_due} or
     * {@code canceled}.
     */
    String providerStatus;

    /**
     * Id of the owning user. Only checkout sessions carry it.
     */
    Long userId;

    String priceId;

    OffsetDateTime currentPeriodStart;

    OffsetDateTime currentPeriodEnd;

    boolean cancelAtPeriodEnd;

    OffsetDateTime canceledAt;

    OffsetDateTime trialEnd;
}
