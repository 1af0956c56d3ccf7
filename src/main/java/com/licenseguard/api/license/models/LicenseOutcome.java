package com.licenseguard.api.license.models;

import lombok.NonNull;

/**
 * Mutually exclusive license outcomes of a device, listed in order of precedence.
 */
public enum LicenseOutcome {
    SUBSCRIPTION_ACTIVE,
    TRIAL_ACTIVE,
    SUBSCRIPTION_EXPIRED,
    TRIAL_EXPIRED,
    NO_TRIAL;

    /**
     * @return the status reported to clients: {@code active}, {@code trial} or {@code expired}.
     */
    @NonNull
    public String getLicenseStatus() {
        switch (this) {
            case SUBSCRIPTION_ACTIVE:
                return "active";
            case TRIAL_ACTIVE:
                return "trial";
            case SUBSCRIPTION_EXPIRED:
            case TRIAL_EXPIRED:
            case NO_TRIAL:
                return "expired";
            default:
                throw new IllegalStateException("unknown license outcome: " + this);
        }
    }

    public boolean isEntitled() {
        return this == SUBSCRIPTION_ACTIVE || this == TRIAL_ACTIVE;
    }
}
