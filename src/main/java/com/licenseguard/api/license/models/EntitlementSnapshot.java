package com.licenseguard.api.license.models;

import com.licenseguard.api.subscription.models.PlanFeatures;
import com.licenseguard.api.subscription.models.PlanTier;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * What a device is entitled to at a given instant.
 */
@Value
@Builder
public class EntitlementSnapshot {

    long deviceId;

    @NonNull
    LicenseOutcome outcome;

    /**
     * Plan that the features derive from, or {@literal null} if the device isn't entitled.
     */
    PlanTier plan;

    @NonNull
    PlanFeatures features;

    /**
     * End of the current subscription period or of the trial, whichever decided the outcome.
     * {@literal null} if the device never had a trial, or if its subscription has no period end.
     */
    OffsetDateTime expiresAt;

    /**
     * Whole days left until {@link #expiresAt}, rounded up and never negative. {@literal null} if
     * {@link #expiresAt} is {@literal null}.
     */
    Long daysLeft;

    OffsetDateTime trialStartedAt;

    OffsetDateTime trialEndedAt;

    @NonNull
    public String getLicenseStatus() {
        return outcome.getLicenseStatus();
    }
}
