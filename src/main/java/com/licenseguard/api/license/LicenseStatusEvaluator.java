package com.licenseguard.api.license;

import com.licenseguard.api.device.entities.Device;
import com.licenseguard.api.license.models.EntitlementSnapshot;
import com.licenseguard.api.license.models.LicenseOutcome;
import com.licenseguard.api.subscription.models.PlanFeatures;
import com.licenseguard.api.subscription.models.PlanTier;
import com.licenseguard.api.subscription.models.SubscriptionState;
import lombok.NonNull;
import lombok.val;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.function.Function;

/**
 * Derives the entitlement of a device from its trial and its subscription. It has no side effects
 * and reads nothing but its arguments.
 */
@Component
class LicenseStatusEvaluator {

    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    /**
     * @param device       the device being evaluated.
     * @param subscription the subscription of the device's users, or {@literal null} if none.
     * @param planFeatures resolves the features of a plan.
     * @param now          instant of evaluation.
     */
    @NonNull
    EntitlementSnapshot evaluate(
        @NonNull Device device,
        SubscriptionState subscription,
        @NonNull Function<PlanTier, PlanFeatures> planFeatures,
        @NonNull OffsetDateTime now
    ) {
        val outcome = outcomeOf(device, subscription, now);
        final PlanTier plan;
        final OffsetDateTime expiresAt;
        switch (outcome) {
            case SUBSCRIPTION_ACTIVE:
                plan = subscription.getPlan() == null ? PlanTier.BASIC : subscription.getPlan();
                expiresAt = subscription.getCurrentPeriodEnd();
                break;
            case TRIAL_ACTIVE:
                plan = PlanTier.TRIAL;
                expiresAt = device.getTrialEndedAt();
                break;
            case SUBSCRIPTION_EXPIRED:
                plan = null;
                expiresAt = subscription.getCurrentPeriodEnd();
                break;
            case TRIAL_EXPIRED:
                plan = null;
                expiresAt = device.getTrialEndedAt();
                break;
            case NO_TRIAL:
                plan = null;
                expiresAt = null;
                break;
            default:
                throw new IllegalStateException("unknown license outcome: " + outcome);
        }

        return EntitlementSnapshot.builder()
            .deviceId(device.getId())
            .outcome(outcome)
            .plan(plan)
            .features(plan == null ? PlanFeatures.NONE : planFeatures.apply(plan))
            .expiresAt(expiresAt)
            .daysLeft(daysLeft(expiresAt, now))
            .trialStartedAt(device.getTrialStartedAt())
            .trialEndedAt(device.getTrialEndedAt())
            .build();
    }

    @NonNull
    private static LicenseOutcome outcomeOf(@NonNull Device device, SubscriptionState subscription, @NonNull OffsetDateTime now) {
        if (subscription != null && subscription.isActiveAt(now)) {
            return LicenseOutcome.SUBSCRIPTION_ACTIVE;
        } else if (device.isTrialActiveAt(now)) {
            return LicenseOutcome.TRIAL_ACTIVE;
        } else if (subscription != null) {
            return LicenseOutcome.SUBSCRIPTION_EXPIRED;
        } else if (device.getTrialStartedAt() != null) {
            return LicenseOutcome.TRIAL_EXPIRED;
        }

        return LicenseOutcome.NO_TRIAL;
    }

    private static Long daysLeft(OffsetDateTime expiresAt, @NonNull OffsetDateTime now) {
        if (expiresAt == null) {
            return null;
        }

        val seconds = Duration.between(now, expiresAt).getSeconds();
        if (seconds <= 0) {
            return 0L;
        }

        return Math.floorDiv(seconds + SECONDS_PER_DAY - 1, SECONDS_PER_DAY);
    }
}
