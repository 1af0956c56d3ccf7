package com.licenseguard.api.subscription;

import com.licenseguard.api.subscription.models.SubscriptionSnapshot;
import com.stripe.model.Price;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionItem;
import com.stripe.model.checkout.Session;
import lombok.NonNull;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static java.util.Objects.requireNonNullElse;

/**
 * Converts Stripe API objects to provider-agnostic {@link SubscriptionSnapshot}s.
 */
final class StripeSnapshots {

    static final String USER_ID_METADATA_KEY = "user_id";

    private StripeSnapshots() {
    }

    /**
     * @param subscription a Stripe subscription.
     * @param userId       id of the owning user if known, {@literal null} otherwise.
     */
    @NonNull
    static SubscriptionSnapshot fromSubscription(@NonNull Subscription subscription, Long userId) {
        return SubscriptionSnapshot.builder()
            .stripeSubscriptionId(subscription.getId())
            .stripeCustomerId(subscription.getCustomer())
            .providerStatus(subscription.getStatus())
            .userId(userId)
            .priceId(priceIdOf(subscription))
            .currentPeriodStart(fromEpochSeconds(subscription.getCurrentPeriodStart()))
            .currentPeriodEnd(fromEpochSeconds(subscription.getCurrentPeriodEnd()))
            .cancelAtPeriodEnd(requireNonNullElse(subscription.getCancelAtPeriodEnd(), false))
            .canceledAt(fromEpochSeconds(subscription.getCanceledAt()))
            .trialEnd(fromEpochSeconds(subscription.getTrialEnd()))
            .build();
    }

    /**
     * Resolves the owner of a checkout session from its {@code user_id} metadata, falling back to
     * its client reference id.
     *
     * @return the user id, or {@literal null} if the session doesn't identify a (numeric) user.
     */
    static Long userIdOf(@NonNull Session session) {
        var raw = session.getMetadata() == null ? null : session.getMetadata().get(USER_ID_METADATA_KEY);
        if (raw == null) {
            raw = session.getClientReferenceId();
        }

        if (raw == null) {
            return null;
        }

        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String priceIdOf(@NonNull Subscription subscription) {
        if (subscription.getItems() == null || subscription.getItems().getData() == null) {
            return null;
        }

        return subscription.getItems().getData().stream()
            .map(SubscriptionItem::getPrice)
            .filter(p -> p != null && p.getId() != null)
            .map(Price::getId)
            .findFirst()
            .orElse(null);
    }

    private static OffsetDateTime fromEpochSeconds(Long seconds) {
        return Optional.ofNullable(seconds)
            .map(s -> OffsetDateTime.ofInstant(Instant.ofEpochSecond(s), ZoneOffset.UTC))
            .orElse(null);
    }
}
