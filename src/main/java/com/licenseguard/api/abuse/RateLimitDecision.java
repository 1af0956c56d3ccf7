package com.licenseguard.api.abuse;

import com.licenseguard.api.abuse.entities.IdentifierType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Outcome of {@link DeviceCreationRateLimiter#checkAndIncrement(String, IdentifierType)}.
 */
@Value
@Builder
public class RateLimitDecision {

    @NonNull
    IdentifierType identifierType;

    /**
     * Counter value of the current window, including the creation that was just counted.
     */
    int current;

    int max;

    @NonNull
    OffsetDateTime windowStart;

    /**
     * Time left until the current window closes.
     */
    @NonNull
    Duration retryAfter;

    public boolean isExceeded() {
        return current > max;
    }
}
