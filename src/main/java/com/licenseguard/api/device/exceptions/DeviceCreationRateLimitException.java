package com.licenseguard.api.device.exceptions;

import com.licenseguard.api.abuse.RateLimitDecision;
import lombok.NonNull;

import java.util.Locale;
import java.util.Map;

import static java.lang.String.format;

/**
 * Thrown when too many devices were registered from an ip address or by a user within the current
 * rate limit window.
 */
public class DeviceCreationRateLimitException extends RegistrationRejectedException {

    public DeviceCreationRateLimitException(@NonNull RateLimitDecision decision) {
        super(
            RejectionReason.RATE_LIMIT_EXCEEDED,
            format("too many device registrations per %s, at most %d allowed",
                decision.getIdentifierType().name().toLowerCase(Locale.ROOT), decision.getMax()),
            decision.getRetryAfter(),
            Map.of(
                "current", decision.getCurrent(),
                "max", decision.getMax(),
                "type", decision.getIdentifierType().name().toLowerCase(Locale.ROOT)));
    }
}
