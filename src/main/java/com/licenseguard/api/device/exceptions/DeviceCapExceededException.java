package com.licenseguard.api.device.exceptions;

import java.util.Map;

import static java.lang.String.format;

/**
 * Thrown when linking one more device would exceed a user's device cap.
 */
public class DeviceCapExceededException extends RegistrationRejectedException {

    public DeviceCapExceededException(long current, int max) {
        super(
            RejectionReason.DEVICE_CAP_EXCEEDED,
            format("maximum %d devices allowed per user, %d already registered", max, current),
            null,
            Map.of("current", current, "max", max, "type", "user"));
    }
}
