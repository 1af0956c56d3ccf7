package com.licenseguard.api.contracts;

import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * Defines a service contract for the identity package to issue lease tokens to the device and
 * license packages.
 */
public interface LeaseTokenServiceContract {

    /**
     * Issues a signed lease token that embeds the entitlement a device held at the time of issue.
     *
     * @param deviceId      internal id of the device that the lease is bound to.
     * @param licenseStatus client-facing license status, i.e. {@code trial}, {@code active} or
     *                      {@code expired}.
     * @param expiresAt     when the entitlement ends, or {@literal null} if there is none.
     * @param plan          name of the plan the entitlement derives from, or {@literal null}.
     * @return a signed JWT.
     */
    @NonNull
    String issueLeaseToken(long deviceId, @NonNull String licenseStatus, OffsetDateTime expiresAt, String plan);
}
