package com.licenseguard.api.device.exceptions;

import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of the policy rejections that {@code registerDeviceUser} operation of the
 * {@link com.licenseguard.api.device.DeviceRegistrationService} throws. Rejections are
 * user-actionable and never surface as internal errors.
 */
@Getter
public abstract class RegistrationRejectedException extends Exception {

    private final RejectionReason reason;

    /**
     * Duration after which the same registration may succeed, or {@literal null} if retrying
     * won't help.
     */
    private final Duration retryAfter;

    private final Map<String, Object> details;

    protected RegistrationRejectedException(
        @NonNull RejectionReason reason,
        @NonNull String message,
        Duration retryAfter,
        @NonNull Map<String, Object> details
    ) {
        super(message);
        this.reason = reason;
        this.retryAfter = retryAfter;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean isRetryable() {
        return retryAfter != null;
    }

    public enum RejectionReason {
        DEVICE_CAP_EXCEEDED,
        RATE_LIMIT_EXCEEDED,
    }
}
