package com.licenseguard.api.subscription.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Read-only view of a subscription that license evaluation depends on.
 */
@Value
@Builder
public class SubscriptionState {

    long id;

    @NonNull
    SubscriptionStatus status;

    OffsetDateTime currentPeriodEnd;

    /**
     * Plan of the subscription, or {@literal null} if the subscription's price isn't mapped to one.
     */
    PlanTier plan;

    /**
     * @return whether the subscription is active and its current billing period hasn't elapsed at
     * {@code now}.
     */
    public boolean isActiveAt(@NonNull OffsetDateTime now) {
        return status == SubscriptionStatus.ACTIVE && (currentPeriodEnd == null || !now.isAfter(currentPeriodEnd));
    }
}
