package com.licenseguard.api.device.models;

import com.licenseguard.api.license.models.EntitlementSnapshot;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Outcome of a successful device registration.
 */
@Value
@Builder
public class RegistrationResult {

    long userId;

    long deviceId;

    OffsetDateTime trialStartedAt;

    OffsetDateTime trialExpiresAt;

    @NonNull
    EntitlementSnapshot entitlement;

    /**
     * A lease token bound to the registered device.
     */
    @NonNull
    String leaseToken;
}
