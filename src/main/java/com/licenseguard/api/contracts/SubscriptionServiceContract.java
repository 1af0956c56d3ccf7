package com.licenseguard.api.contracts;

import com.licenseguard.api.subscription.models.PlanFeatures;
import com.licenseguard.api.subscription.models.PlanTier;
import com.licenseguard.api.subscription.models.SubscriptionState;
import lombok.NonNull;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * An interface to expose the internal subscription service to other packages.
 */
public interface SubscriptionServiceContract {

    /**
     * Finds the subscription that decides the license of a device used by the given users. A
     * subscription that is active at {@code now} wins over others. Otherwise, the most recently
     * created one is returned.
     *
     * @param userIds ids of the users associated with a device. It may be empty.
     * @param now     the instant of evaluation.
     * @return an optional {@link SubscriptionState}, empty if none of the users ever subscribed.
     */
    @NonNull
    Optional<SubscriptionState> findCurrentSubscription(@NonNull Collection<Long> userIds, @NonNull OffsetDateTime now);

    /**
     * @return features unlocked by the given plan.
     */
    @NonNull
    PlanFeatures getPlanFeatures(@NonNull PlanTier tier);
}
